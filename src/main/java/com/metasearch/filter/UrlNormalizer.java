package com.metasearch.filter;

import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 生成用于去重的 URL 标准化键。
 * 
 * 忽略协议、www 前缀、末尾斜杠、参数顺序与跟踪参数；键只用于判等，不对外展示。
 */
public final class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
        "ref", "fbclid", "gclid", "msclkid", "spm", "from"
    );
    private static final String UTM_PREFIX = "utm_";

    private static final Comparator<QueryParam> PARAM_ORDER = Comparator
        .comparing(QueryParam::name)
        .thenComparing(QueryParam::value, Comparator.nullsFirst(Comparator.naturalOrder()));

    private UrlNormalizer() {
    }

    /**
     * 计算标准化键；无法解析时退化为小写原串，从不抛出异常。
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            return url.toLowerCase(Locale.ROOT);
        }

        String host = parsed.host();
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        String path = stripTrailingSlashes(parsed.encodedPath());
        String query = canonicalQuery(parsed);

        String key = query.isEmpty() ? host + path : host + path + "?" + query;
        return key.toLowerCase(Locale.ROOT);
    }

    /**
     * 判断字符串是否为可解析的绝对 http(s) URL。
     */
    public static boolean isAbsoluteHttpUrl(String url) {
        return url != null && !url.isBlank() && HttpUrl.parse(url.trim()) != null;
    }

    public static boolean isTrackingParam(String name) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        return lowerName.startsWith(UTM_PREFIX) || TRACKING_PARAMS.contains(lowerName);
    }

    private static String canonicalQuery(HttpUrl parsed) {
        List<QueryParam> kept = new ArrayList<>();
        for (int index = 0; index < parsed.querySize(); index++) {
            String name = parsed.queryParameterName(index);
            if (!isTrackingParam(name)) {
                kept.add(new QueryParam(name, parsed.queryParameterValue(index)));
            }
        }
        if (kept.isEmpty()) {
            return "";
        }
        kept.sort(PARAM_ORDER);

        HttpUrl.Builder builder = parsed.newBuilder().query(null).fragment(null);
        for (QueryParam param : kept) {
            builder.addQueryParameter(param.name(), param.value());
        }
        String encodedQuery = builder.build().encodedQuery();
        return encodedQuery == null ? "" : encodedQuery;
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    private record QueryParam(String name, String value) {
    }
}
