package com.metasearch.engine;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 搜索后端描述：名称、查询地址前缀与对应的结果解析器。
 */
public record SearchEngine(
        String name,
        String searchUrlPrefix,
        EngineParser parser
) {
    /**
     * 拼接带 URL 编码查询词的请求地址。
     */
    public String searchUrl(String query) {
        return searchUrlPrefix + URLEncoder.encode(query, StandardCharsets.UTF_8);
    }
}
