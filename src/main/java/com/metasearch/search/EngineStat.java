package com.metasearch.search;

/**
 * 单个后端的结果统计，error 为空表示查询成功。
 */
public record EngineStat(
        String engine,
        int resultCount,
        String error
) {
    static EngineStat of(EngineOutcome outcome) {
        if (outcome instanceof EngineOutcome.Failure failure) {
            return new EngineStat(failure.engineName(), 0, failure.reason());
        }
        return new EngineStat(outcome.engineName(), outcome.items().size(), null);
    }
}
