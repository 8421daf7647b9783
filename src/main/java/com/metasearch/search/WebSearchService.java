package com.metasearch.search;

import com.metasearch.config.SearchConfig;
import com.metasearch.engine.SearchEngines;
import com.metasearch.engine.SearchItem;
import com.metasearch.http.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * web_search：同时查询所有后端，合并去重并过滤广告。
 * 
 * 只有查询词缺失会报错；单个后端的失败被吸收，结果可能为空但调用总是成功。
 */
public class WebSearchService {
    private static final Logger logger = LoggerFactory.getLogger(WebSearchService.class);

    private final FetchOrchestrator orchestrator;
    private final int defaultNumResults;

    public WebSearchService(FetchOrchestrator orchestrator, int defaultNumResults) {
        this.orchestrator = orchestrator;
        this.defaultNumResults = defaultNumResults;
    }

    public static WebSearchService create(SearchConfig config) {
        FetchOrchestrator orchestrator = new FetchOrchestrator(PageFetcher.create(config), SearchEngines.defaults());
        return new WebSearchService(orchestrator, config.getDefaultNumResults());
    }

    public SearchResult search(String query) {
        return search(query, defaultNumResults);
    }

    public SearchResult search(String query, int numResults) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query parameter is required and cannot be empty.");
        }
        String trimmedQuery = query.trim();
        logger.info("[web_search] query=\"{}\", numResults={}", trimmedQuery, numResults);

        long startNanos = System.nanoTime();
        List<EngineOutcome> outcomes = orchestrator.queryAll(trimmedQuery).join();

        List<List<SearchItem>> engineResults = new ArrayList<>(outcomes.size());
        List<EngineStat> stats = new ArrayList<>(outcomes.size());
        for (EngineOutcome outcome : outcomes) {
            engineResults.add(outcome.items());
            stats.add(EngineStat.of(outcome));
            logger.info("[web_search] {}: {} results", outcome.engineName(), outcome.items().size());
        }

        List<SearchItem> merged = ResultMerger.merge(engineResults, numResults);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        return new SearchResult(trimmedQuery, merged, List.copyOf(stats), elapsedMs, Instant.now());
    }
}
