package com.metasearch.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 全局常量定义
 * 
 * 包含网络请求参数、浏览器请求头模板、搜索结果数量与网页抓取字符上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 网络请求参数 ====================
    /** 单次请求（搜索引擎查询或网页抓取）的超时时间 */
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    /** 连接池最大空闲连接数 */
    public static final int CONNECTION_POOL_SIZE = 5;
    /** 连接池空闲连接保活时间（分钟） */
    public static final int CONNECTION_KEEP_ALIVE_MINUTES = 5;

    /** 模拟浏览器的 User-Agent 池，每次请求随机取一个 */
    public static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15"
    );

    /** 浏览器请求头模板（不含 User-Agent；Accept-Encoding 由 HTTP 客户端自行协商） */
    public static final Map<String, String> BROWSER_HEADER_TEMPLATE = browserHeaderTemplate();

    // ==================== 搜索参数 ====================
    /** 默认返回的搜索结果数 */
    public static final int DEFAULT_NUM_RESULTS = 8;
    /** 搜索结果数上限 */
    public static final int MAX_NUM_RESULTS = 50;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 500;
    /** 解析单个结果块时只扫描的前缀长度，避免超大页面上的二次方开销 */
    public static final int BLOCK_SCAN_LIMIT = 5000;
    /** 搜狗摘要的最小有效长度，过滤装饰性的近空容器 */
    public static final int MIN_SUMMARY_LENGTH = 10;

    // ==================== 网页抓取参数 ====================
    /** 默认返回内容的最大字符数 */
    public static final int DEFAULT_MAX_CHAR_SIZE = 50_000;

    private static Map<String, String> browserHeaderTemplate() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9,zh-CN;q=0.8,zh;q=0.7");
        headers.put("Cache-Control", "no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("Sec-Fetch-Dest", "document");
        headers.put("Sec-Fetch-Mode", "navigate");
        headers.put("Sec-Fetch-Site", "none");
        headers.put("Sec-Fetch-User", "?1");
        headers.put("Upgrade-Insecure-Requests", "1");
        return Collections.unmodifiableMap(headers);
    }
}
