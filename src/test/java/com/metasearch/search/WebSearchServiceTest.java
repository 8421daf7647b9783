package com.metasearch.search;

import com.metasearch.engine.BraveParser;
import com.metasearch.engine.DuckDuckGoParser;
import com.metasearch.engine.SearchEngine;
import com.metasearch.engine.SearchItem;
import com.metasearch.http.BrowserHeaders;
import com.metasearch.http.PageFetcher;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSearchServiceTest {

    private static final String BRAVE_PAGE = """
        <div data-type="web"><a href="https://www.example.com/page/">Example Page</a>
          <div class="snippet-description">From Brave.</div></div>
        <div data-type="web"><a href="https://brave-only.example.net/">Brave Only</a></div>
        """;

    private static final String DDG_PAGE = """
        <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.com%2Fpage&amp;rut=a">Example Again</a>
        <a class="result__snippet">From DuckDuckGo.</a>
        <a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fddg-only.example.org%2F&amp;rut=b">DDG Only</a>
        <a class="result__snippet">Second.</a>
        """;

    private MockWebServer server;
    private WebSearchService service;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.startsWith("/brave")) {
                    return new MockResponse().setHeader("Content-Type", "text/html").setBody(BRAVE_PAGE);
                }
                if (path.startsWith("/ddg")) {
                    return new MockResponse().setHeader("Content-Type", "text/html").setBody(DDG_PAGE);
                }
                return new MockResponse().setResponseCode(503);
            }
        });
        server.start();

        BrowserHeaders headers = new BrowserHeaders(List.of("test-agent"), Map.of(), BrowserHeaders::randomPick);
        PageFetcher fetcher = new PageFetcher(new OkHttpClient(), headers, Duration.ofSeconds(2));
        FetchOrchestrator orchestrator = new FetchOrchestrator(fetcher, List.of(
            new SearchEngine("Brave", server.url("/brave?q=").toString(), new BraveParser()),
            new SearchEngine("Down", server.url("/down?q=").toString(), new BraveParser()),
            new SearchEngine("DuckDuckGo", server.url("/ddg?q=").toString(), new DuckDuckGoParser())
        ));
        service = new WebSearchService(orchestrator, 8);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("search: 轮转合并、去重并记录每个后端的统计")
    void testSearchMergesAndReportsStats() {
        SearchResult result = service.search("  example  ");

        assertEquals("example", result.query());
        assertEquals(List.of("Example Page", "Brave Only", "DDG Only"),
            result.items().stream().map(SearchItem::title).toList());
        assertNotNull(result.searchedAt());
        assertTrue(result.elapsedMs() >= 0);

        assertEquals(3, result.engines().size());
        EngineStat brave = result.engines().get(0);
        assertEquals("Brave", brave.engine());
        assertEquals(2, brave.resultCount());
        assertNull(brave.error());

        EngineStat down = result.engines().get(1);
        assertEquals(0, down.resultCount());
        assertTrue(down.error().contains("503"), down.error());

        assertEquals(2, result.engines().get(2).resultCount());
    }

    @Test
    @DisplayName("search: 结果数上限生效")
    void testNumResultsLimit() {
        assertEquals(1, service.search("example", 1).items().size());
        assertTrue(service.search("example", 0).items().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("search: 查询词为空时抛出参数异常")
    @ValueSource(strings = {"", "   ", "\t\n"})
    void testBlankQueryRejected(String query) {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> service.search(query));
        assertEquals("query parameter is required and cannot be empty.", exception.getMessage());
    }

    @Test
    @DisplayName("search: null 查询词同样被拒绝")
    void testNullQueryRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.search(null, 5));
    }
}
