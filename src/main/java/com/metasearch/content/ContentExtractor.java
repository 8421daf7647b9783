package com.metasearch.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 网页正文区域提取。
 * 
 * 先移除脚本、样式、导航等非正文标签与注释，再按
 * {@code <main>} > {@code <article>} > {@code <div id="content">} > {@code <body>} > 全文
 * 的优先级选取正文区域。纯词法处理，不构建 DOM。
 */
public class ContentExtractor {

    static final List<String> NOISE_TAGS = List.of(
        "script", "style", "iframe", "noscript", "svg",
        "object", "embed", "applet", "head", "nav", "footer", "aside"
    );
    static final List<String> VOID_NOISE_TAGS = List.of("link", "meta");

    /** 标签名之后必须是空白、"/" 或 ">"，{@code <main-menu>} 这类自定义元素不算 {@code <main>}。 */
    private static final String NAME_END = "(?=[\\s/>])";

    private static final Pattern COMMENT_PATTERN = Pattern.compile("<!--[\\s\\S]*?-->");
    private static final Pattern VOID_NOISE_PATTERN =
        Pattern.compile("<(?:link|meta)" + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> NOISE_PATTERNS = compileNoisePatterns();

    private static final List<Region> REGIONS = List.of(
        new Region("main", Pattern.compile("<main" + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE)),
        new Region("article", Pattern.compile("<article" + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE)),
        new Region("div", Pattern.compile("<div" + NAME_END + "[^>]*\\sid\\s*=\\s*[\"']content[\"'][^>]*>", Pattern.CASE_INSENSITIVE)),
        new Region("body", Pattern.compile("<body" + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE))
    );

    /**
     * 移除非正文标签后选取正文区域。
     */
    public String extractMain(String html) {
        return selectMain(removeNoise(html));
    }

    /**
     * 移除非正文标签（从开始标签到对应结束标签或自闭合形式）与注释。
     */
    public String removeNoise(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String cleaned = COMMENT_PATTERN.matcher(html).replaceAll("");
        for (Pattern pattern : NOISE_PATTERNS) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        return VOID_NOISE_PATTERN.matcher(cleaned).replaceAll("");
    }

    /**
     * 按优先级返回第一个存在的正文区域的内部 HTML，都不存在时返回原文。
     */
    public String selectMain(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        for (Region region : REGIONS) {
            Optional<String> inner = innerHtml(html, region);
            if (inner.isPresent()) {
                return inner.get();
            }
        }
        return html;
    }

    /**
     * 从第一个开始标签起按嵌套深度寻找匹配的结束标签；未闭合时视为不存在。
     */
    private Optional<String> innerHtml(String html, Region region) {
        Matcher open = region.openTag().matcher(html);
        if (!open.find()) {
            return Optional.empty();
        }
        int contentStart = open.end();
        Matcher tags = region.anyTag().matcher(html);
        tags.region(contentStart, html.length());
        int depth = 1;
        while (tags.find()) {
            boolean closing = !tags.group(1).isEmpty();
            if (!closing) {
                if (!tags.group().endsWith("/>")) {
                    depth++;
                }
                continue;
            }
            depth--;
            if (depth == 0) {
                return Optional.of(html.substring(contentStart, tags.start()));
            }
        }
        return Optional.empty();
    }

    private static List<Pattern> compileNoisePatterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (String tag : NOISE_TAGS) {
            // 成对或自闭合的完整元素
            patterns.add(Pattern.compile(
                "<" + tag + NAME_END + "[^>]*?/\\s*>|<" + tag + NAME_END + "[^>]*>[\\s\\S]*?</" + tag + "\\s*>",
                Pattern.CASE_INSENSITIVE));
        }
        for (String tag : NOISE_TAGS) {
            // 残留的未闭合开始标签与孤立结束标签
            patterns.add(Pattern.compile("</?" + tag + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private record Region(String tagName, Pattern openTag, Pattern anyTag) {
        Region(String tagName, Pattern openTag) {
            this(tagName, openTag, Pattern.compile("<(/?)" + tagName + NAME_END + "[^>]*>", Pattern.CASE_INSENSITIVE));
        }
    }
}
