package com.metasearch.http;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageFetcherTest {

    private MockWebServer server;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        BrowserHeaders headers = new BrowserHeaders(
            List.of("agent-one", "agent-two"),
            Map.of("Accept-Language", "en-US"),
            pool -> pool.get(1));
        fetcher = new PageFetcher(new OkHttpClient(), headers, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("fetch: 成功返回响应体与 Content-Type，并发送浏览器请求头")
    void testFetchHtml() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html><body>hello</body></html>"));

        FetchedPage page = fetcher.fetch(server.url("/page").toString());

        assertEquals(200, page.statusCode());
        assertTrue(page.isHtml());
        assertEquals("<html><body>hello</body></html>", page.body());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("GET", request.getMethod());
        assertEquals("agent-two", request.getHeader("User-Agent"));
        assertEquals("en-US", request.getHeader("Accept-Language"));
    }

    @Test
    @DisplayName("fetch: 跟随重定向并记录最终地址")
    void testFollowsRedirects() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/final"));
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/plain").setBody("done"));

        FetchedPage page = fetcher.fetch(server.url("/start").toString());

        assertEquals(server.url("/final").toString(), page.url());
        assertFalse(page.isHtml());
        assertEquals("done", page.body());
    }

    @Test
    @DisplayName("fetch: 非 2xx 状态归类为 HTTP_STATUS")
    void testHttpStatusError() {
        server.enqueue(new MockResponse().setResponseCode(404));
        String url = server.url("/missing").toString();

        FetchException exception = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertEquals(FetchException.Category.HTTP_STATUS, exception.getCategory());
        assertEquals(404, exception.getStatusCode());
        assertEquals(url, exception.getUrl());
        assertTrue(exception.getMessage().startsWith("HTTP 404"), exception.getMessage());
    }

    @Test
    @DisplayName("fetch: 截止时间到达归类为 TIMEOUT")
    void testTimeout() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));
        String url = server.url("/slow").toString();

        FetchException exception = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertEquals(FetchException.Category.TIMEOUT, exception.getCategory());
        assertEquals(-1, exception.getStatusCode());
        assertEquals("Timeout: Failed to fetch \"" + url + "\" within 500 milliseconds.", exception.getMessage());
    }

    @Test
    @DisplayName("fetch: 非法地址归类为 NETWORK")
    void testInvalidUrl() {
        FetchException exception = assertThrows(FetchException.class, () -> fetcher.fetch("not a url"));
        assertEquals(FetchException.Category.NETWORK, exception.getCategory());
    }

    @Test
    @DisplayName("fetchAsync: 失败以 FetchException 异常完成")
    void testFetchAsyncFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));

        CompletionException exception = assertThrows(CompletionException.class,
            () -> fetcher.fetchAsync(server.url("/error").toString()).join());

        FetchException cause = assertInstanceOf(FetchException.class, exception.getCause());
        assertEquals(500, cause.getStatusCode());
    }

    @Test
    @DisplayName("timeout: 返回构造时的截止时间")
    void testTimeoutAccessor() {
        assertEquals(Duration.ofMillis(500), fetcher.timeout());
    }
}
