package com.metasearch.http;

import java.io.IOException;
import java.time.Duration;

/**
 * 网页抓取失败，按 HTTP 状态、超时与其它网络错误分类。
 */
public class FetchException extends IOException {

    public enum Category {
        HTTP_STATUS,
        TIMEOUT,
        NETWORK
    }

    private final Category category;
    private final String url;
    private final int statusCode;

    public FetchException(Category category, String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.url = url;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(String url, int statusCode, String reason) {
        String message = reason == null || reason.isBlank()
            ? "HTTP " + statusCode
            : "HTTP " + statusCode + ": " + reason;
        return new FetchException(Category.HTTP_STATUS, url, statusCode, message, null);
    }

    public static FetchException timeout(String url, Duration timeout, Throwable cause) {
        return new FetchException(Category.TIMEOUT, url, -1,
            "Timeout: Failed to fetch \"" + url + "\" within " + describe(timeout) + ".", cause);
    }

    public static FetchException network(String url, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null
            ? (cause == null ? "unknown error" : cause.getClass().getSimpleName())
            : cause.getMessage();
        return new FetchException(Category.NETWORK, url, -1,
            "Failed to fetch \"" + url + "\": " + detail, cause);
    }

    public Category getCategory() {
        return category;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP 状态码，非 HTTP_STATUS 类错误为 -1。
     */
    public int getStatusCode() {
        return statusCode;
    }

    private static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis % 1000 == 0) {
            long seconds = millis / 1000;
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return millis + " milliseconds";
    }
}
