package com.metasearch.http;

import com.metasearch.config.SearchConfig;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 带浏览器请求头、截止时间与重定向跟随的 GET 抓取。
 * 
 * 截止时间到达时请求被取消并报告为 TIMEOUT，与 HTTP 状态错误、其它网络错误区分。
 */
public class PageFetcher {

    private final OkHttpClient client;
    private final BrowserHeaders headers;
    private final Duration timeout;

    public PageFetcher(OkHttpClient client, BrowserHeaders headers, Duration timeout) {
        this.client = client.newBuilder().callTimeout(timeout).build();
        this.headers = headers;
        this.timeout = timeout;
    }

    public static PageFetcher create(SearchConfig config) {
        return new PageFetcher(HttpClientFactory.create(config), BrowserHeaders.from(config), config.getRequestTimeout());
    }

    /**
     * 同步抓取。
     */
    public FetchedPage fetch(String url) throws FetchException {
        Request request = buildRequest(url);
        try (Response response = client.newCall(request).execute()) {
            return toPage(url, response);
        } catch (IOException exception) {
            throw classify(url, exception);
        }
    }

    /**
     * 异步抓取，失败时以 {@link FetchException} 异常完成；取消返回的 future 会取消底层请求。
     */
    public CompletableFuture<FetchedPage> fetchAsync(String url) {
        CompletableFuture<FetchedPage> future = new CompletableFuture<>();
        Request request;
        try {
            request = buildRequest(url);
        } catch (FetchException exception) {
            future.completeExceptionally(exception);
            return future;
        }

        Call call = client.newCall(request);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException exception) {
                future.completeExceptionally(classify(url, exception));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    future.complete(toPage(url, response));
                } catch (IOException exception) {
                    future.completeExceptionally(classify(url, exception));
                }
            }
        });
        future.whenComplete((page, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        return future;
    }

    public Duration timeout() {
        return timeout;
    }

    private Request buildRequest(String url) throws FetchException {
        try {
            return new Request.Builder()
                .url(url)
                .headers(headers.next())
                .get()
                .build();
        } catch (IllegalArgumentException exception) {
            throw FetchException.network(url, exception);
        }
    }

    private FetchedPage toPage(String url, Response response) throws IOException {
        if (!response.isSuccessful()) {
            throw FetchException.httpStatus(url, response.code(), response.message());
        }
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        String contentType = response.header("Content-Type", "");
        return new FetchedPage(response.request().url().toString(), response.code(), contentType, text);
    }

    private FetchException classify(String url, IOException exception) {
        if (exception instanceof FetchException fetchException) {
            return fetchException;
        }
        if (exception instanceof InterruptedIOException) {
            return FetchException.timeout(url, timeout, exception);
        }
        return FetchException.network(url, exception);
    }
}
