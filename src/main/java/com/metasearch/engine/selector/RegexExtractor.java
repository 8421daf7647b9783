package com.metasearch.engine.selector;

import com.metasearch.text.TextSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RegexExtractor<T> implements Extractor<T> {

    private final String name;
    private final Pattern pattern;
    private final Function<MatchResult, T> mapper;

    public RegexExtractor(String name, Pattern pattern, Function<MatchResult, T> mapper) {
        this.name = name;
        this.pattern = pattern;
        this.mapper = mapper;
    }

    /**
     * 取第一个捕获组并剥离标签后的文本。
     */
    public static RegexExtractor<String> text(String name, String regex) {
        return new RegexExtractor<>(name, Pattern.compile(regex), match -> TextSanitizer.stripTags(match.group(1)));
    }

    /**
     * 第一个捕获组为 href、第二个为链接内容的链接提取。
     */
    public static RegexExtractor<Anchor> anchor(String name, String regex) {
        return anchor(name, Pattern.compile(regex));
    }

    public static RegexExtractor<Anchor> anchor(String name, Pattern pattern) {
        return new RegexExtractor<>(name, pattern, match -> new Anchor(match.group(1), match.group(2)));
    }

    /**
     * 原样返回第一个捕获组。
     */
    public static RegexExtractor<String> raw(String name, String regex) {
        return new RegexExtractor<>(name, Pattern.compile(regex), match -> match.group(1));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<T> extract(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(fragment);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.apply(matcher.toMatchResult()));
    }

    /**
     * 按文档顺序返回所有匹配。
     */
    public List<T> extractAll(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        List<T> values = new ArrayList<>();
        Matcher matcher = pattern.matcher(fragment);
        while (matcher.find()) {
            T value = mapper.apply(matcher.toMatchResult());
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    public Pattern pattern() {
        return pattern;
    }
}
