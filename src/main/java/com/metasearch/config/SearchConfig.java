package com.metasearch.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行时配置
 * 
 * 支持从CLI参数或环境变量注入，覆盖Constants默认值。
 * 抓取层在构造时显式接收该配置，不读取任何进程级全局状态。
 */
public class SearchConfig {
    private Duration requestTimeout = Constants.REQUEST_TIMEOUT;
    private List<String> userAgents = Constants.USER_AGENTS;
    private Map<String, String> headerTemplate = Constants.BROWSER_HEADER_TEMPLATE;
    private String proxyUrl;
    private int defaultNumResults = Constants.DEFAULT_NUM_RESULTS;
    private int maxNumResults = Constants.MAX_NUM_RESULTS;
    private int defaultMaxCharSize = Constants.DEFAULT_MAX_CHAR_SIZE;
    private int connectionPoolSize = Constants.CONNECTION_POOL_SIZE;

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("请求超时必须为正数: " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
    }

    public List<String> getUserAgents() {
        return userAgents;
    }

    public void setUserAgents(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("User-Agent 池不能为空");
        }
        this.userAgents = List.copyOf(userAgents);
    }

    public Map<String, String> getHeaderTemplate() {
        return headerTemplate;
    }

    public void setHeaderTemplate(Map<String, String> headerTemplate) {
        this.headerTemplate = headerTemplate == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headerTemplate));
    }

    public String getProxyUrl() {
        return proxyUrl;
    }

    public void setProxyUrl(String proxyUrl) {
        this.proxyUrl = proxyUrl;
    }

    public int getDefaultNumResults() {
        return defaultNumResults;
    }

    public void setDefaultNumResults(int defaultNumResults) {
        this.defaultNumResults = defaultNumResults;
    }

    public int getMaxNumResults() {
        return maxNumResults;
    }

    public void setMaxNumResults(int maxNumResults) {
        this.maxNumResults = maxNumResults;
    }

    public int getDefaultMaxCharSize() {
        return defaultMaxCharSize;
    }

    public void setDefaultMaxCharSize(int defaultMaxCharSize) {
        this.defaultMaxCharSize = defaultMaxCharSize;
    }

    public int getConnectionPoolSize() {
        return connectionPoolSize;
    }

    public void setConnectionPoolSize(int connectionPoolSize) {
        this.connectionPoolSize = connectionPoolSize;
    }

    /**
     * 使用默认配置创建实例
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }
}
