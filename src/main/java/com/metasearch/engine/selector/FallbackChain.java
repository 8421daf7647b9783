package com.metasearch.engine.selector;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 按顺序尝试多个提取策略，第一个被接受的结果胜出。
 * 
 * 接受条件由调用方给出，例如"非空"或"长度超过阈值"。
 */
public final class FallbackChain<T> implements Extractor<T> {

    private final String name;
    private final List<Extractor<T>> attempts;
    private final Predicate<T> acceptance;

    public FallbackChain(String name, List<Extractor<T>> attempts, Predicate<T> acceptance) {
        if (attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("回退链至少需要一个提取策略: " + name);
        }
        this.name = name;
        this.attempts = List.copyOf(attempts);
        this.acceptance = acceptance;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<T> extract(String fragment) {
        return attempt(fragment).map(Extraction::value);
    }

    /**
     * 返回胜出的策略及其结果。
     */
    public Optional<Extraction<T>> attempt(String fragment) {
        for (Extractor<T> extractor : attempts) {
            Optional<T> candidate = extractor.extract(fragment);
            if (candidate.isPresent() && acceptance.test(candidate.get())) {
                return Optional.of(new Extraction<>(extractor.name(), candidate.get()));
            }
        }
        return Optional.empty();
    }

    public List<String> attemptNames() {
        return attempts.stream().map(Extractor::name).toList();
    }
}
