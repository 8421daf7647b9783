package com.metasearch.engine;

/**
 * 单条搜索结果。
 */
public record SearchItem(
        String url,
        String title,
        String summary
) {
    public SearchItem {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("搜索结果 URL 不能为空");
        }
        if (title == null || title.isEmpty()) {
            throw new IllegalArgumentException("搜索结果标题不能为空: " + url);
        }
        summary = summary == null ? "" : summary;
    }
}
