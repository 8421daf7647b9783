package com.metasearch.content;

import com.metasearch.text.TextSanitizer;
import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * HTML 转 Markdown。
 *
 * 转换前用 jsoup 再次移除脚本、样式、导航等节点，再交给 flexmark 的 HTML 转换器：
 * ATX 标题、围栏代码块、"-" 列表标记，正文中的 Markdown 特殊字符会被转义。
 * 任何转换失败都退化为纯文本提取，保证总能返回一些文本。
 */
public class MarkdownConverter {
    private static final Logger logger = LoggerFactory.getLogger(MarkdownConverter.class);

    static final String REMOVED_SELECTOR = "script, style, iframe, noscript, svg, nav, footer";
    static final char BULLET_MARKER = '-';

    private static final DataHolder OPTIONS = new MutableDataSet()
        .set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false)
        .set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, BULLET_MARKER)
        .set(FlexmarkHtmlConverter.OUTPUT_ATTRIBUTES_ID, false)
        .toImmutable();

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \t]+$", Pattern.MULTILINE);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");

    private final FlexmarkHtmlConverter converter = FlexmarkHtmlConverter.builder(OPTIONS).build();

    public String toMarkdown(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        try {
            Document document = Jsoup.parse(html);
            document.select(REMOVED_SELECTOR).remove();
            document.outputSettings().prettyPrint(false);
            return postProcess(converter.convert(document.body().html()));
        } catch (RuntimeException exception) {
            logger.warn("[htmlToMarkdown] 转换失败，退化为纯文本: {}", exception.getMessage());
            return plainText(html);
        }
    }

    /**
     * 去除行尾空白并把 3 个及以上的连续换行折叠为 2 个。
     */
    static String postProcess(String markdown) {
        String normalized = markdown.replace("\r\n", "\n").replace('\u00A0', ' ');
        String stripped = TRAILING_WHITESPACE.matcher(normalized).replaceAll("");
        return EXCESS_NEWLINES.matcher(stripped).replaceAll("\n\n").trim();
    }

    /**
     * 退化的纯文本提取：剥离全部标签并折叠空白。
     */
    static String plainText(String html) {
        String withoutTags = TAG_PATTERN.matcher(html).replaceAll(" ");
        return TextSanitizer.collapseWhitespace(TextSanitizer.decodeEntities(withoutTags));
    }
}
