package com.metasearch.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.metasearch.config.Constants;
import com.metasearch.config.SearchConfig;
import com.metasearch.engine.SearchItem;
import com.metasearch.search.EngineStat;
import com.metasearch.search.SearchResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs(
            "--proxy", "http://127.0.0.1:7890", "--timeout", "5", "search", "java records", "-n", "3", "-f", "json");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
        assertEquals(3, (int) parseResult.subcommand().matchedOptionValue("-n", 0));
        assertEquals("json", parseResult.subcommand().matchedOptionValue("--format", ""));
    }

    @Test
    void testParseFetchSubcommand() {
        ParseResult parseResult = new CommandLine(new MainCommand())
            .parseArgs("fetch", "https://example.com", "--max-chars", "100", "--raw");

        ParseResult fetch = parseResult.subcommand();
        assertEquals("fetch", fetch.commandSpec().name());
        assertEquals(100, (int) fetch.matchedOptionValue("-m", 0));
        assertTrue(fetch.hasMatchedOption("--raw"));
    }

    @Test
    void testBuildConfigAppliesTimeoutAndProxy() throws Exception {
        MainCommand command = new MainCommand();
        setField(command, "timeoutSeconds", 3);
        setField(command, "proxy", "socks5://127.0.0.1:1080");

        SearchConfig config = command.buildConfig();

        assertEquals(Duration.ofSeconds(3), config.getRequestTimeout());
        assertEquals("socks5://127.0.0.1:1080", config.getProxyUrl());

        setField(command, "timeoutSeconds", 0);
        assertEquals(Constants.REQUEST_TIMEOUT, command.buildConfig().getRequestTimeout());
    }

    @Test
    void testSanitizeLimits() {
        MainCommand command = new MainCommand();

        assertEquals(Constants.DEFAULT_NUM_RESULTS, command.sanitizeNumResults(-1));
        assertEquals(Constants.MAX_NUM_RESULTS, command.sanitizeNumResults(Constants.MAX_NUM_RESULTS + 10));
        assertEquals(12, command.sanitizeNumResults(12));
        assertEquals(Constants.DEFAULT_MAX_CHAR_SIZE, command.sanitizeMaxChars(-5));
        assertEquals(300, command.sanitizeMaxChars(300));
    }

    @Test
    void testSanitizeQuery() {
        MainCommand command = new MainCommand();

        assertEquals("java", command.sanitizeQuery("  java "));
        assertEquals("", command.sanitizeQuery(null));
        assertThrows(CommandLine.ParameterException.class,
            () -> command.sanitizeQuery("x".repeat(Constants.MAX_QUERY_LENGTH + 1)));
    }

    @Test
    void testSearchSubcommandPrintTextResultWhenNoItems() throws Exception {
        SearchResult emptyResult = new SearchResult("none", List.of(),
            List.of(new EngineStat("Brave", 0, "HTTP 503: Service Unavailable")), 2L, Instant.now());

        String outputText = capture(() -> invokePrint("printTextResult", emptyResult));

        assertTrue(outputText.contains("未找到搜索结果"));
        assertTrue(outputText.contains("Brave: 失败 (HTTP 503: Service Unavailable)"));
    }

    @Test
    void testSearchSubcommandPrintTextResult() throws Exception {
        SearchResult result = new SearchResult("demo",
            List.of(new SearchItem("https://example.com", "Example", "A summary")),
            List.of(new EngineStat("Sogou", 1, null)), 5L, Instant.now());

        String outputText = capture(() -> invokePrint("printTextResult", result));

        assertTrue(outputText.contains("1. Example"));
        assertTrue(outputText.contains("https://example.com"));
        assertTrue(outputText.contains("Sogou: 1 条"));
    }

    @Test
    void testSearchSubcommandPrintJsonResult() throws Exception {
        SearchResult result = new SearchResult("demo",
            List.of(new SearchItem("https://example.com", "Example", "A summary")),
            List.of(new EngineStat("Sogou", 1, null)), 5L, Instant.parse("2024-05-01T10:15:30Z"));

        String outputText = capture(() -> invokePrint("printJsonResult", result));

        assertTrue(outputText.contains("\"query\" : \"demo\""));
        assertTrue(outputText.contains("\"searchedAt\" : \"2024-05-01T10:15:30Z\""));
        assertTrue(outputText.contains("\"resultCount\" : 1"));
    }

    @Test
    void testEnginesSubcommandListsBackends() throws Exception {
        String outputText = capture(() -> new MainCommand.EnginesSubcommand().call());

        assertTrue(outputText.contains("Brave"));
        assertTrue(outputText.contains("https://www.sogou.com/web?query="));
        assertTrue(outputText.contains("DuckDuckGo"));
    }

    @Test
    void testFetchSubcommandAgainstLocalServer() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setHeader("Content-Type", "text/html")
                .setBody("<html><body><article><h2>Local</h2><p>Page body</p></article></body></html>"));
            server.enqueue(new MockResponse().setResponseCode(404));
            server.start();

            MainCommand mainCommand = new MainCommand();
            setField(mainCommand, "timeoutSeconds", 2);

            MainCommand.FetchSubcommand fetchSubcommand = new MainCommand.FetchSubcommand();
            setField(fetchSubcommand, "main", mainCommand);
            setField(fetchSubcommand, "url", server.url("/page").toString());
            setField(fetchSubcommand, "maxChars", 1000);

            String outputText = capture(() -> assertEquals(0, fetchSubcommand.call()));
            assertTrue(outputText.contains("## Local"));
            assertTrue(outputText.contains("Page body"));

            assertEquals(1, fetchSubcommand.call());
        }
    }

    private static void invokePrint(String methodName, SearchResult result) throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        Method method = MainCommand.SearchSubcommand.class.getDeclaredMethod(methodName, SearchResult.class);
        method.setAccessible(true);
        method.invoke(searchSubcommand, result);
    }

    private static String capture(ThrowingRunnable action) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface ThrowingRunnable {
        void run() throws Exception;
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
