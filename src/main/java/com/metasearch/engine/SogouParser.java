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
 * 搜狗搜索结果解析。
 * 
 * 每个结果位于 {@code class="vrwrap"} 卡片内，标题与链接在 {@code <h3>} 中；
 * 没有 h3 的卡片是视频、影视等特殊卡片，直接跳过。
 */
public class SogouParser implements EngineParser {

    static final String CARD_MARKER = "class=\"vrwrap\"";
    static final String ORIGIN = "https://www.sogou.com";

    static final RegexExtractor<String> HEADING = RegexExtractor.raw("h3", "<h3[^>]*>([\\s\\S]*?)</h3>");
    static final RegexExtractor<Anchor> HEADING_LINK = RegexExtractor.anchor("h3-link",
        "<a[^>]+href=\"([^\"]+)\"[^>]*>([\\s\\S]*?)</a>");

    /** 摘要优先级: text-layout > summary > str-text */
    static final FallbackChain<String> SUMMARY = new FallbackChain<>("sogou-summary", List.of(
        RegexExtractor.text("text-layout", "class=\"[^\"]*text-layout[^\"]*\"[^>]*>([\\s\\S]*?)</div>"),
        RegexExtractor.text("summary", "class=\"[^\"]*summary[^\"]*\"[^>]*>([\\s\\S]*?)</div>"),
        RegexExtractor.text("str-text", "class=\"[^\"]*str[-_]text[^\"]*\"[^>]*>([\\s\\S]*?)</(?:p|div)>")
    ), summary -> summary.length() > Constants.MIN_SUMMARY_LENGTH);

    private final int scanLimit;

    public SogouParser() {
        this(Constants.BLOCK_SCAN_LIMIT);
    }

    public SogouParser(int scanLimit) {
        this.scanLimit = Math.max(1, scanLimit);
    }

    @Override
    public List<SearchItem> parse(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }

        List<SearchItem> results = new ArrayList<>();
        String[] cards = html.split(CARD_MARKER, -1);
        for (int index = 1; index < cards.length; index++) {
            String card = cards[index].substring(0, Math.min(cards[index].length(), scanLimit));

            Optional<Anchor> link = HEADING.extract(card).flatMap(HEADING_LINK::extract);
            if (link.isEmpty()) {
                continue;
            }
            String title = TextSanitizer.stripTags(link.get().innerHtml());
            if (title.isEmpty()) {
                continue;
            }
            String url = resolveAgainstOrigin(TextSanitizer.decodeEntities(link.get().href().trim()));
            if (!UrlNormalizer.isAbsoluteHttpUrl(url)) {
                continue;
            }

            String summary = SUMMARY.extract(card).orElse("");
            results.add(new SearchItem(url, title, summary));
        }
        return List.copyOf(results);
    }

    /**
     * 补全搜狗站内跳转链接（/link?url=...）等相对地址。
     */
    static String resolveAgainstOrigin(String url) {
        if (url.startsWith("//")) {
            return "https:" + url;
        }
        if (url.startsWith("/")) {
            return ORIGIN + url;
        }
        return url;
    }
}
