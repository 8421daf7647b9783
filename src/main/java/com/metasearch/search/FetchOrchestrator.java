package com.metasearch.search;

import com.metasearch.engine.SearchEngine;
import com.metasearch.engine.SearchItem;
import com.metasearch.http.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 并发查询所有搜索后端并等待全部结束。
 * 
 * 每个后端独立超时；非 2xx、网络错误、超时或解析异常只让该后端贡献空列表，
 * 从不提前中止其它后端，也不自动重试。
 */
public class FetchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final PageFetcher fetcher;
    private final List<SearchEngine> engines;

    public FetchOrchestrator(PageFetcher fetcher, List<SearchEngine> engines) {
        this.fetcher = fetcher;
        this.engines = List.copyOf(engines);
    }

    /**
     * 返回按后端顺序排列的结果，future 仅在所有后端都结束后完成，且从不异常完成。
     */
    public CompletableFuture<List<EngineOutcome>> queryAll(String query) {
        List<CompletableFuture<EngineOutcome>> pending = new ArrayList<>(engines.size());
        for (SearchEngine engine : engines) {
            pending.add(queryEngine(engine, query));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> pending.stream().map(CompletableFuture::join).toList());
    }

    public List<SearchEngine> engines() {
        return engines;
    }

    private CompletableFuture<EngineOutcome> queryEngine(SearchEngine engine, String query) {
        CompletableFuture<List<SearchItem>> parsed;
        try {
            parsed = fetcher.fetchAsync(engine.searchUrl(query))
                .thenApply(page -> engine.parser().parse(page.body()));
        } catch (RuntimeException exception) {
            parsed = CompletableFuture.failedFuture(exception);
        }
        return parsed.handle((items, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                logger.warn("[{}] 搜索失败: {}", engine.name(), cause.getMessage());
                return new EngineOutcome.Failure(engine.name(), describe(cause));
            }
            return new EngineOutcome.Success(engine.name(), items);
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
