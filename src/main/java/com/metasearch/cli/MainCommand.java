package com.metasearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metasearch.config.Constants;
import com.metasearch.config.SearchConfig;
import com.metasearch.content.FetchedDocument;
import com.metasearch.content.WebFetchService;
import com.metasearch.engine.SearchEngine;
import com.metasearch.engine.SearchEngines;
import com.metasearch.engine.SearchItem;
import com.metasearch.http.FetchException;
import com.metasearch.http.ProxySettings;
import com.metasearch.search.EngineStat;
import com.metasearch.search.SearchResult;
import com.metasearch.search.WebSearchService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
    name = "mse",
    description = "🔍 多引擎网页搜索聚合与网页正文简化工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.FetchSubcommand.class,
        MainCommand.EnginesSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--proxy"}, description = "代理地址，如 http://127.0.0.1:7890 或 socks5://127.0.0.1:1080（缺省读取 HTTPS_PROXY 等环境变量）")
    private String proxy;

    @Option(names = {"--timeout"}, description = "单次请求超时（秒）", defaultValue = "10")
    private int timeoutSeconds;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 多引擎网页搜索聚合与网页正文简化工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    SearchConfig buildConfig() {
        SearchConfig config = SearchConfig.defaults();
        config.setRequestTimeout(resolveTimeout());
        ProxySettings.resolveUrl(proxy, System.getenv()).ifPresent(config::setProxyUrl);
        return config;
    }

    private Duration resolveTimeout() {
        if (timeoutSeconds <= 0) {
            System.err.printf("⚠️ 非法超时 %d 秒，已回退为默认值 %d 秒%n",
                timeoutSeconds, Constants.REQUEST_TIMEOUT.toSeconds());
            return Constants.REQUEST_TIMEOUT;
        }
        return Duration.ofSeconds(timeoutSeconds);
    }

    int sanitizeNumResults(int rawNumResults) {
        if (rawNumResults < 0) {
            System.err.printf("⚠️ num-results=%d 非法，已使用默认值 %d%n", rawNumResults, Constants.DEFAULT_NUM_RESULTS);
            return Constants.DEFAULT_NUM_RESULTS;
        }
        if (rawNumResults > Constants.MAX_NUM_RESULTS) {
            System.err.printf("⚠️ num-results=%d 超过上限 %d，已自动限制%n", rawNumResults, Constants.MAX_NUM_RESULTS);
            return Constants.MAX_NUM_RESULTS;
        }
        return rawNumResults;
    }

    int sanitizeMaxChars(int rawMaxChars) {
        if (rawMaxChars < 0) {
            System.err.printf("⚠️ max-chars=%d 非法，已使用默认值 %d%n", rawMaxChars, Constants.DEFAULT_MAX_CHAR_SIZE);
            return Constants.DEFAULT_MAX_CHAR_SIZE;
        }
        return rawMaxChars;
    }

    String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "search", description = "🔎 并发查询所有搜索后端并合并结果")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "搜索查询语句", arity = "1")
        private String query;

        @Option(names = {"-n", "--num-results"}, description = "返回结果数量", defaultValue = "8")
        private int numResults;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String safeQuery = main.sanitizeQuery(query);
                int safeNumResults = main.sanitizeNumResults(numResults);
                WebSearchService service = WebSearchService.create(main.buildConfig());
                SearchResult result = service.search(safeQuery, safeNumResults);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                    return 0;
                }
                System.out.println("🔍 查询: \"" + result.query() + "\"");
                System.out.println();
                printTextResult(result);
                System.out.println();
                System.out.println("📊 共 " + result.items().size() + " 条结果，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.items().isEmpty()) {
                System.out.println("⚠️ 未找到搜索结果");
            } else {
                int rank = 1;
                for (SearchItem item : result.items()) {
                    System.out.println("─────────────────────────────────");
                    System.out.printf("%d. %s%n", rank++, item.title());
                    System.out.println("   " + item.url());
                    if (!item.summary().isEmpty()) {
                        System.out.println("   " + item.summary().replace("\n", " "));
                    }
                    System.out.println();
                }
            }

            for (EngineStat stat : result.engines()) {
                if (stat.error() == null) {
                    System.out.printf("   %s: %d 条%n", stat.engine(), stat.resultCount());
                } else {
                    System.out.printf("   %s: 失败 (%s)%n", stat.engine(), stat.error());
                }
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "fetch", description = "📄 抓取网页并简化为正文 Markdown")
    static class FetchSubcommand implements Callable<Integer> {

        @Parameters(description = "要抓取的网页地址", arity = "1")
        private String url;

        @Option(names = {"-m", "--max-chars"}, description = "返回文本的最大字符数", defaultValue = "50000")
        private int maxChars;

        @Option(names = {"--raw"}, description = "不做正文提取与 Markdown 转换", defaultValue = "false")
        private boolean raw;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                WebFetchService service = WebFetchService.create(main.buildConfig());
                FetchedDocument document = service.fetch(url, main.sanitizeMaxChars(maxChars), !raw);
                System.out.println(document.finalText());
                return 0;
            } catch (FetchException exception) {
                System.err.println("❌ 抓取失败 [" + exception.getCategory() + "]: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 抓取失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "engines", description = "🧭 列出内置搜索后端")
    static class EnginesSubcommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("🧭 搜索后端");
            System.out.println("═══════════");
            for (SearchEngine engine : SearchEngines.defaults()) {
                System.out.printf("%-12s %s%n", engine.name(), engine.searchUrlPrefix());
            }
            return 0;
        }
    }

}
