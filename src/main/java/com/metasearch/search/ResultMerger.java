package com.metasearch.search;

import com.metasearch.engine.SearchItem;
import com.metasearch.filter.AdClassifier;
import com.metasearch.filter.UrlNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 多引擎结果合并。
 * 
 * 按位置轮转交替取各引擎结果（而不是逐个引擎拼接），保证输出头部的来源多样性；
 * 同时过滤广告并基于标准化 URL 去重，保留最先出现的条目。
 */
public final class ResultMerger {

    private ResultMerger() {
    }

    public static List<SearchItem> merge(List<List<SearchItem>> engineResults, int maxResults) {
        if (engineResults == null || engineResults.isEmpty() || maxResults <= 0) {
            return List.of();
        }

        int longest = 0;
        for (List<SearchItem> results : engineResults) {
            if (results != null) {
                longest = Math.max(longest, results.size());
            }
        }

        Set<String> seen = new HashSet<>();
        List<SearchItem> merged = new ArrayList<>();
        for (int position = 0; position < longest; position++) {
            for (List<SearchItem> results : engineResults) {
                if (results == null || position >= results.size()) {
                    continue;
                }
                SearchItem item = results.get(position);
                if (item == null || AdClassifier.isAd(item.url())) {
                    continue;
                }
                if (!seen.add(UrlNormalizer.normalize(item.url()))) {
                    continue;
                }
                merged.add(item);
                if (merged.size() >= maxResults) {
                    return List.copyOf(merged);
                }
            }
        }
        return List.copyOf(merged);
    }
}
