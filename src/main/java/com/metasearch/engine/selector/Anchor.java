package com.metasearch.engine.selector;

/**
 * 链接元素的原始 href 与内部 HTML。
 */
public record Anchor(String href, String innerHtml) {
}
