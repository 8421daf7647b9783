package com.metasearch.engine;

import java.util.List;

public interface EngineParser {

    /**
     * 将搜索引擎返回的 HTML 解析为按页面顺序排列的结果列表。
     * 
     * 纯函数，从不抛出异常：无法识别的片段被跳过，畸形输入得到空或部分列表。
     */
    List<SearchItem> parse(String html);
}
