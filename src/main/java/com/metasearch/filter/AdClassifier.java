package com.metasearch.filter;

import java.util.List;
import java.util.Optional;

/**
 * 基于固定正则特征表的广告链接识别。
 * 
 * 解析阶段用于过滤引擎自身的广告标记，合并阶段再作为兜底过滤一次。
 */
public final class AdClassifier {

    private static final List<AdSignature> SIGNATURES = List.of(
        // 广告平台域名
        AdSignature.of(AdCategory.AD_NETWORK, "googleads\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "doubleclick\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "googlesyndication\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "googleadservices\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "adclick\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "adsense\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "adservice\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "adserver\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "clickserve\\."),
        AdSignature.of(AdCategory.AD_NETWORK, "clicktrack\\."),
        // 百度推广
        AdSignature.of(AdCategory.ENGINE_MARKER, "baidu\\.com/aclick"),
        AdSignature.of(AdCategory.ENGINE_MARKER, "(?<![\\w-])(?:pos|cpro|e)\\.baidu\\.com"),
        // Bing 广告
        AdSignature.of(AdCategory.ENGINE_MARKER, "bingads\\."),
        AdSignature.of(AdCategory.ENGINE_MARKER, "microsoftadvertising\\."),
        // DuckDuckGo 推广结果
        AdSignature.of(AdCategory.ENGINE_MARKER, "ad_provider="),
        AdSignature.of(AdCategory.ENGINE_MARKER, "ad_domain="),
        AdSignature.of(AdCategory.ENGINE_MARKER, "duckduckgo\\.com/y\\.js"),
        // 通用广告路径
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/ads?/"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/advert"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/sponsor"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/promo/"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/click\\?"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/aclk\\?"),
        AdSignature.of(AdCategory.PATH_FRAGMENT, "/pagead/")
    );

    private AdClassifier() {
    }

    /**
     * 任一特征命中即判定为广告。
     */
    public static boolean isAd(String url) {
        return classify(url).isPresent();
    }

    /**
     * 返回第一个命中的广告特征，用于诊断日志与测试。
     */
    public static Optional<AdSignature> classify(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        for (AdSignature signature : SIGNATURES) {
            if (signature.matches(url)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    public static List<AdSignature> signatures() {
        return SIGNATURES;
    }
}
