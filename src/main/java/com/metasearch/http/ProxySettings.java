package com.metasearch.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 代理配置解析。
 * 
 * 优先级: --proxy 命令行参数 > 环境变量 HTTPS_PROXY / HTTP_PROXY / ALL_PROXY（大小写两种写法）
 */
public final class ProxySettings {
    private static final Logger logger = LoggerFactory.getLogger(ProxySettings.class);

    static final List<String> ENV_KEYS = List.of(
        "HTTPS_PROXY", "https_proxy",
        "HTTP_PROXY", "http_proxy",
        "ALL_PROXY", "all_proxy"
    );

    private ProxySettings() {
    }

    /**
     * 按优先级选出代理地址。
     */
    public static Optional<String> resolveUrl(String cliProxy, Map<String, String> env) {
        if (cliProxy != null && !cliProxy.isBlank()) {
            return Optional.of(cliProxy.trim());
        }
        if (env == null) {
            return Optional.empty();
        }
        for (String key : ENV_KEYS) {
            String value = env.get(key);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    /**
     * 将代理地址转换为 {@link Proxy}；http(s) 为 HTTP 代理，socks* 为 SOCKS 代理，非法地址忽略。
     */
    public static Optional<Proxy> toProxy(String proxyUrl) {
        if (proxyUrl == null || proxyUrl.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(proxyUrl.trim());
        } catch (URISyntaxException exception) {
            logger.warn("忽略非法代理地址: {} - {}", proxyUrl, exception.getMessage());
            return Optional.empty();
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            logger.warn("忽略缺少主机名的代理地址: {}", proxyUrl);
            return Optional.empty();
        }

        Proxy.Type type;
        int defaultPort;
        switch (scheme) {
            case "http" -> {
                type = Proxy.Type.HTTP;
                defaultPort = 80;
            }
            case "https" -> {
                type = Proxy.Type.HTTP;
                defaultPort = 443;
            }
            case "socks", "socks4", "socks5", "socks5h" -> {
                type = Proxy.Type.SOCKS;
                defaultPort = 1080;
            }
            default -> {
                logger.warn("忽略不支持的代理协议: {}", proxyUrl);
                return Optional.empty();
            }
        }
        int port = uri.getPort() > 0 ? uri.getPort() : defaultPort;
        return Optional.of(new Proxy(type, InetSocketAddress.createUnresolved(host, port)));
    }
}
