package com.metasearch.http;

import java.util.Locale;

/**
 * 一次成功 HTTP 请求的结果。
 *
 * @param url         跟随重定向后的最终地址
 * @param statusCode  HTTP 状态码（2xx）
 * @param contentType 响应的 Content-Type，缺失时为空串
 * @param body        按响应字符集解码的响应体
 */
public record FetchedPage(
        String url,
        int statusCode,
        String contentType,
        String body
) {
    public boolean isHtml() {
        return contentType.toLowerCase(Locale.ROOT).contains("html");
    }
}
