package com.metasearch.engine;

import com.metasearch.config.Constants;
import com.metasearch.engine.selector.Anchor;
import com.metasearch.engine.selector.FallbackChain;
import com.metasearch.engine.selector.RegexExtractor;
import com.metasearch.filter.UrlNormalizer;
import com.metasearch.text.TextSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Brave Search 结果解析。
 * 
 * 每个结果块以 {@code data-type="web"} 分隔；视频、图片等其它类型的卡片不带该标记，
 * 或者块内没有站外链接，会被自然跳过。
 */
public class BraveParser implements EngineParser {

    static final String BLOCK_MARKER = "data-type=\"web\"";

    /** 第一个非 Brave 站内的 http(s) 链接，同时捕获链接文本 */
    static final RegexExtractor<Anchor> RESULT_LINK = RegexExtractor.anchor("outbound-link",
        "<a[^>]+href=\"(https?://(?!search\\.brave\\.com|brave\\.com)[^\"]+)\"[^>]*>([\\s\\S]*?)</a>");

    static final FallbackChain<String> SUMMARY = new FallbackChain<>("brave-summary", List.of(
        RegexExtractor.text("snippet-description",
            "class=\"[^\"]*snippet-description[^\"]*\"[^>]*>([\\s\\S]*?)</(?:p|div|span)>"),
        RegexExtractor.text("generic-snippet",
            "class=\"[^\"]*generic-snippet[^\"]*\"[^>]*>([\\s\\S]*?)</div>")
    ), summary -> !summary.isEmpty());

    private final int scanLimit;

    public BraveParser() {
        this(Constants.BLOCK_SCAN_LIMIT);
    }

    public BraveParser(int scanLimit) {
        this.scanLimit = Math.max(1, scanLimit);
    }

    @Override
    public List<SearchItem> parse(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }

        List<SearchItem> results = new ArrayList<>();
        String[] blocks = html.split(BLOCK_MARKER, -1);
        // 第一个分段位于任何结果之前
        for (int index = 1; index < blocks.length; index++) {
            String block = blocks[index].substring(0, Math.min(blocks[index].length(), scanLimit));

            Optional<Anchor> link = RESULT_LINK.extract(block);
            if (link.isEmpty()) {
                continue;
            }
            String url = TextSanitizer.decodeEntities(link.get().href());
            String title = TextSanitizer.stripTags(link.get().innerHtml());
            if (title.length() <= 1 || !UrlNormalizer.isAbsoluteHttpUrl(url)) {
                continue;
            }

            String summary = SUMMARY.extract(block).orElse("");
            results.add(new SearchItem(url, title, summary));
        }
        return List.copyOf(results);
    }
}
