package com.metasearch.content;

/**
 * web_fetch 的结果。
 *
 * @param url         最终地址（跟随重定向之后）
 * @param contentType 响应的 Content-Type，缺失时为空串
 * @param rawBody     原始响应体
 * @param finalText   截断后的输出文本：简化后的 Markdown 或原文
 * @param simplified  finalText 是否经过正文提取与 Markdown 转换
 */
public record FetchedDocument(String url, String contentType, String rawBody, String finalText, boolean simplified) {
}
