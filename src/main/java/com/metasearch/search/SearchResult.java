package com.metasearch.search;

import com.metasearch.engine.SearchItem;

import java.time.Instant;
import java.util.List;

public record SearchResult(
        String query,
        List<SearchItem> items,
        List<EngineStat> engines,
        long elapsedMs,
        Instant searchedAt
) {
}
