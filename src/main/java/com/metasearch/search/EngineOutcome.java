package com.metasearch.search;

import com.metasearch.engine.SearchItem;

import java.util.List;

/**
 * 单个搜索后端的查询结果：成功或失败，失败不影响其它后端。
 */
public sealed interface EngineOutcome permits EngineOutcome.Success, EngineOutcome.Failure {

    String engineName();

    /**
     * 参与合并的结果列表；失败时为空列表。
     */
    List<SearchItem> items();

    record Success(String engineName, List<SearchItem> items) implements EngineOutcome {
        public Success {
            items = List.copyOf(items);
        }
    }

    record Failure(String engineName, String reason) implements EngineOutcome {
        @Override
        public List<SearchItem> items() {
            return List.of();
        }
    }
}
