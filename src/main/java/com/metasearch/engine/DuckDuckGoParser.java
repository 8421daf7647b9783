package com.metasearch.engine;

import com.metasearch.engine.selector.Anchor;
import com.metasearch.engine.selector.RegexExtractor;
import com.metasearch.filter.AdClassifier;
import com.metasearch.filter.UrlNormalizer;
import com.metasearch.text.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * DuckDuckGo HTML 版搜索结果解析。
 * 
 * 结果链接形如 {@code //duckduckgo.com/l/?uddg=ENCODED_URL&amp;rut=...}，
 * 真实地址在 uddg 参数中；摘要位于独立的 result__snippet 链接里，按序号与结果链接配对。
 * 负载较高时 DuckDuckGo 会返回验证码页面，此时直接返回空列表，不做重试。
 */
public class DuckDuckGoParser implements EngineParser {
    private static final Logger logger = LoggerFactory.getLogger(DuckDuckGoParser.class);

    static final List<String> CHALLENGE_MARKERS = List.of(
        "anomaly-modal",
        "Please complete the following challenge"
    );
    static final String AD_SCRIPT_PATH = "duckduckgo.com/y.js";
    private static final String REDIRECT_PARAM = "uddg=";

    static final RegexExtractor<Anchor> RESULT_LINKS = RegexExtractor.anchor("result__a", Pattern.compile(
        "<a(?=[^>]*\\bclass=\"(?:[^\"]*\\s)?result__a(?:\\s[^\"]*)?\")[^>]*\\bhref=\"([^\"]*)\"[^>]*>([\\s\\S]*?)</a>",
        Pattern.CASE_INSENSITIVE));
    static final RegexExtractor<String> SNIPPETS = new RegexExtractor<>("result__snippet", Pattern.compile(
        "<a(?=[^>]*\\bclass=\"(?:[^\"]*\\s)?result__snippet(?:\\s[^\"]*)?\")[^>]*>([\\s\\S]*?)</a>",
        Pattern.CASE_INSENSITIVE), match -> TextSanitizer.stripTags(match.group(1)));

    @Override
    public List<SearchItem> parse(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        if (isChallengePage(html)) {
            logger.info("[DuckDuckGo] 返回了验证码页面，跳过");
            return List.of();
        }

        List<Anchor> links = RESULT_LINKS.extractAll(html);
        List<String> snippets = SNIPPETS.extractAll(html);

        List<SearchItem> results = new ArrayList<>();
        for (int index = 0; index < links.size(); index++) {
            Anchor link = links.get(index);
            String url = resolveDestination(TextSanitizer.decodeEntities(link.href().trim()));
            if (url.contains(AD_SCRIPT_PATH) || AdClassifier.isAd(url)) {
                logger.debug("[DuckDuckGo] 过滤广告结果: {}", url);
                continue;
            }

            String title = TextSanitizer.stripTags(link.innerHtml());
            if (title.isEmpty() || !UrlNormalizer.isAbsoluteHttpUrl(url)) {
                continue;
            }
            String summary = index < snippets.size() ? snippets.get(index) : "";
            results.add(new SearchItem(url, title, summary));
        }
        return List.copyOf(results);
    }

    static boolean isChallengePage(String html) {
        for (String marker : CHALLENGE_MARKERS) {
            if (html.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 从跳转链接中还原目标地址。
     * 
     * 格式1: //duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.com&rut=...
     * 格式2: https://duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.com
     */
    static String resolveDestination(String rawUrl) {
        int paramIndex = rawUrl.indexOf(REDIRECT_PARAM);
        if (paramIndex >= 0) {
            String encoded = rawUrl.substring(paramIndex + REDIRECT_PARAM.length());
            int ampersand = encoded.indexOf('&');
            if (ampersand >= 0) {
                encoded = encoded.substring(0, ampersand);
            }
            String decoded = percentDecode(encoded);
            if (!decoded.isEmpty()) {
                return decoded;
            }
            return rawUrl;
        }
        if (rawUrl.startsWith("//")) {
            return "https:" + rawUrl;
        }
        return rawUrl;
    }

    /**
     * 百分号解码，字面量 '+' 保持不变；编码非法时返回原值。
     */
    private static String percentDecode(String encoded) {
        try {
            return URLDecoder.decode(encoded.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException exception) {
            logger.debug("[DuckDuckGo] uddg 参数解码失败: {}", encoded);
            return encoded;
        }
    }
}
