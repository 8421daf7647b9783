package com.metasearch.content;

import com.metasearch.config.SearchConfig;
import com.metasearch.http.FetchException;
import com.metasearch.http.FetchedPage;
import com.metasearch.http.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * web_fetch：抓取单个页面，HTML 可选简化为正文 Markdown，结果按字符预算截断。
 */
public class WebFetchService {
    private static final Logger logger = LoggerFactory.getLogger(WebFetchService.class);

    private final PageFetcher fetcher;
    private final ContentExtractor extractor;
    private final MarkdownConverter converter;
    private final int defaultMaxCharSize;

    public WebFetchService(PageFetcher fetcher, ContentExtractor extractor, MarkdownConverter converter,
                           int defaultMaxCharSize) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.converter = converter;
        this.defaultMaxCharSize = defaultMaxCharSize;
    }

    public static WebFetchService create(SearchConfig config) {
        return new WebFetchService(PageFetcher.create(config), new ContentExtractor(), new MarkdownConverter(),
            config.getDefaultMaxCharSize());
    }

    public FetchedDocument fetch(String url) throws FetchException {
        return fetch(url, defaultMaxCharSize, true);
    }

    public FetchedDocument fetch(String url, int maxCharSize, boolean simplify) throws FetchException {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url parameter is required and cannot be empty.");
        }
        String trimmedUrl = url.trim();
        logger.info("[web_fetch] url=\"{}\", maxCharSize={}, simplify={}", trimmedUrl, maxCharSize, simplify);

        FetchedPage page = fetcher.fetch(trimmedUrl);
        if (!page.isHtml() || !simplify) {
            return new FetchedDocument(page.url(), page.contentType(), page.body(),
                truncate(page.body(), maxCharSize), false);
        }

        String mainContent = extractor.extractMain(page.body());
        String markdown = converter.toMarkdown(mainContent);
        logger.debug("[web_fetch] 原始 {} 字符，简化后 {} 字符", page.body().length(), markdown.length());
        return new FetchedDocument(page.url(), page.contentType(), page.body(),
            truncate(markdown, maxCharSize), true);
    }

    /**
     * 截断到最多 maxCharSize 个字符，不拆开代理对；负数按 0 处理。
     */
    static String truncate(String text, int maxCharSize) {
        int limit = Math.max(0, maxCharSize);
        if (text.length() <= limit) {
            return text;
        }
        int end = limit;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
