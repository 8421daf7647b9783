package com.metasearch.text;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * HTML 文本清洗工具：实体解码与纯词法的标签剥离。
 */
public final class TextSanitizer {

    private static final Pattern ENTITY_PATTERN =
        Pattern.compile("&(?:([a-zA-Z]+)|#(\\d{1,8})|#[xX]([0-9a-fA-F]{1,8}));");
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private static final Map<String, String> NAMED_ENTITIES = Map.of(
        "amp", "&",
        "lt", "<",
        "gt", ">",
        "quot", "\"",
        "apos", "'"
    );

    private TextSanitizer() {
    }

    /**
     * 单遍解码常见命名实体与十进制/十六进制数字字符引用，未知实体原样保留。
     */
    public static String decodeEntities(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = ENTITY_PATTERN.matcher(text);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(decodeEntity(match)));
    }

    /**
     * 移除所有 {@code <...>} 标记，解码实体并去除首尾空白。
     */
    public static String stripTags(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        return decodeEntities(TAG_PATTERN.matcher(html).replaceAll("")).trim();
    }

    /**
     * 将连续空白折叠为单个空格。
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
    }

    private static String decodeEntity(MatchResult match) {
        String name = match.group(1);
        if (name != null) {
            return NAMED_ENTITIES.getOrDefault(name, match.group());
        }
        int codePoint;
        try {
            codePoint = match.group(2) != null
                ? Integer.parseInt(match.group(2))
                : Integer.parseInt(match.group(3), 16);
        } catch (NumberFormatException exception) {
            return match.group();
        }
        if (codePoint <= 0 || !Character.isValidCodePoint(codePoint)) {
            return match.group();
        }
        return new String(Character.toChars(codePoint));
    }
}
