package com.metasearch.http;

import com.metasearch.config.SearchConfig;
import okhttp3.Headers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * 模拟浏览器的请求头集合。
 * 
 * User-Agent 每次请求按选择函数从池中取一个，降低统一指纹被拦截的概率；
 * 池、模板与选择函数都由调用方显式传入。
 */
public final class BrowserHeaders {
    static final String USER_AGENT = "User-Agent";

    private final List<String> userAgents;
    private final Map<String, String> template;
    private final Function<List<String>, String> userAgentPicker;

    public BrowserHeaders(List<String> userAgents, Map<String, String> template,
                          Function<List<String>, String> userAgentPicker) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("User-Agent 池不能为空");
        }
        this.userAgents = List.copyOf(userAgents);
        this.template = template == null ? Map.of() : Map.copyOf(template);
        this.userAgentPicker = userAgentPicker;
    }

    public static BrowserHeaders from(SearchConfig config) {
        return new BrowserHeaders(config.getUserAgents(), config.getHeaderTemplate(), BrowserHeaders::randomPick);
    }

    public static String randomPick(List<String> pool) {
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }

    /**
     * 生成一次请求使用的完整请求头。
     */
    public Headers next() {
        Headers.Builder builder = new Headers.Builder();
        template.forEach(builder::set);
        builder.set(USER_AGENT, userAgentPicker.apply(userAgents));
        return builder.build();
    }

    public List<String> userAgents() {
        return userAgents;
    }
}
