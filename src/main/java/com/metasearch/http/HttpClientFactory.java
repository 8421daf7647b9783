package com.metasearch.http;

import com.metasearch.config.Constants;
import com.metasearch.config.SearchConfig;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 按配置创建 OkHttpClient。
 * 
 * 同一配置下所有搜索后端与网页抓取共用一个客户端（连接池与调度线程）：
 * - 整个调用（连接、发送、读取响应体）受 callTimeout 约束
 * - 自动跟随重定向
 * - 可选 HTTP/SOCKS 代理
 */
public final class HttpClientFactory {
    private static final Logger logger = LoggerFactory.getLogger(HttpClientFactory.class);

    private HttpClientFactory() {
        // 禁止实例化
    }

    public static OkHttpClient create(SearchConfig config) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(
                Math.max(1, config.getConnectionPoolSize()),
                Constants.CONNECTION_KEEP_ALIVE_MINUTES,
                TimeUnit.MINUTES))
            .callTimeout(config.getRequestTimeout())
            .followRedirects(true)
            .followSslRedirects(true)
            .retryOnConnectionFailure(false);

        ProxySettings.toProxy(config.getProxyUrl()).ifPresent(proxy -> {
            logger.info("使用代理: {}", config.getProxyUrl());
            builder.proxy(proxy);
        });
        return builder.build();
    }
}
