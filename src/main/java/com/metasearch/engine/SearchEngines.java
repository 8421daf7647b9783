package com.metasearch.engine;

import java.util.List;

/**
 * 内置搜索后端。
 * 
 * Google/Bing/百度 在服务端环境依赖 JS 渲染或直接返回验证码，无法直接抓取，因此不在此列。
 */
public final class SearchEngines {

    public static final String BRAVE = "Brave";
    public static final String SOGOU = "Sogou";
    public static final String DUCKDUCKGO = "DuckDuckGo";

    private SearchEngines() {
    }

    public static SearchEngine brave() {
        return new SearchEngine(BRAVE, "https://search.brave.com/search?q=", new BraveParser());
    }

    public static SearchEngine sogou() {
        return new SearchEngine(SOGOU, "https://www.sogou.com/web?query=", new SogouParser());
    }

    public static SearchEngine duckDuckGo() {
        return new SearchEngine(DUCKDUCKGO, "https://html.duckduckgo.com/html/?q=", new DuckDuckGoParser());
    }

    /**
     * 默认后端，顺序即合并时的轮转顺序。
     */
    public static List<SearchEngine> defaults() {
        return List.of(brave(), sogou(), duckDuckGo());
    }
}
