package com.corpussearch.cli;

import com.corpussearch.config.Constants;
import com.corpussearch.config.EngineConfig;
import com.corpussearch.document.Corpus;
import com.corpussearch.document.CorpusLoader;
import com.corpussearch.document.DocumentTable;
import com.corpussearch.document.InMemoryCorpus;
import com.corpussearch.index.InMemoryInvertedIndex;
import com.corpussearch.query.SearchHit;
import com.corpussearch.query.SearchOptions;
import com.corpussearch.query.SearchResult;
import com.corpussearch.query.SimpleSearchEngine;
import com.corpussearch.scoring.Ranker;
import com.corpussearch.scoring.TermFrequencyRanker;
import com.corpussearch.scoring.TfIdfRanker;
import com.corpussearch.text.ShingleTokenizer;
import com.corpussearch.text.SimpleNormalizer;
import com.corpussearch.text.SimpleTokenizer;
import com.corpussearch.text.Tokenizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "corpus-search",
    description = "🔍 小型语料库 N-out-of-M 排序检索",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.StatsSubcommand.class,
        MainCommand.ImportSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "JSON配置文件路径")
    private Path configFile;

    @Option(names = {"-f", "--field"}, description = "参与索引的字段（可指定多个，默认 body）")
    private List<String> fields;

    @Option(names = {"--compressed"}, description = "使用压缩倒排列表")
    private boolean compressed;

    @Option(names = {"--shingles"}, paramLabel = "<width>", description = "改用宽度为 width 的 k-shingle 分词，容忍拼写错误")
    private Integer shingles;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 小型语料库 N-out-of-M 排序检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 读取配置文件，再用命令行选项覆盖。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (fields != null && !fields.isEmpty()) {
            config.setFields(fields);
        }
        if (compressed) {
            config.setCompressed(true);
        }
        if (shingles != null) {
            if (shingles < 1) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "--shingles 必须至少为1: " + shingles);
            }
            config.setShingleWidth(shingles);
        }
        if (config.getShingleWidth() < 0) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "shingleWidth 不能为负数: " + config.getShingleWidth());
        }
        return config;
    }

    InMemoryInvertedIndex buildIndex(Corpus corpus, EngineConfig config) {
        return new InMemoryInvertedIndex(
            corpus,
            config.getFields(),
            new SimpleNormalizer(),
            createTokenizer(config),
            config.isCompressed());
    }

    private Tokenizer createTokenizer(EngineConfig config) {
        return config.getShingleWidth() > 0
            ? new ShingleTokenizer(config.getShingleWidth())
            : new SimpleTokenizer();
    }

    static boolean isDatabasePath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return Constants.DATABASE_EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    /**
     * 打开语料：.db/.sqlite 按 SQLite 文档表打开，其余交给 CorpusLoader。
     */
    Corpus openCorpus(Path corpusFile) throws IOException {
        if (!isDatabasePath(corpusFile)) {
            return new CorpusLoader().load(corpusFile);
        }
        if (!Files.isRegularFile(corpusFile)) {
            throw new IOException("语料数据库不存在: " + corpusFile);
        }
        return new DocumentTable(corpusFile);
    }

    void closeCorpus(Corpus corpus) {
        if (corpus instanceof DocumentTable documentTable) {
            documentTable.close();
        }
    }

    private String sanitizeQuery(String rawQuery) {
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

    @Command(name = "search", description = "🔎 执行搜索查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.json/.jsonl/.tsv）或文档数据库（.db/.sqlite）")
        private Path corpusFile;

        @Parameters(index = "1", description = "搜索查询语句")
        private String query;

        @Option(names = {"-t", "--threshold"}, description = "匹配比例 (0, 1]")
        private Double threshold;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量")
        private Integer limit;

        @Option(names = {"-r", "--ranker"}, description = "排序方式 (tf|tfidf)", defaultValue = "tfidf")
        private String ranker;

        @Option(names = {"--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            String safeQuery = main.sanitizeQuery(query);
            EngineConfig config;
            try {
                config = main.resolveConfig();
            } catch (IOException exception) {
                System.err.println("❌ 读取配置失败: " + exception.getMessage());
                return 1;
            }
            SearchOptions options = resolveOptions(config);

            Corpus corpus = null;
            try {
                corpus = main.openCorpus(corpusFile);
                InMemoryInvertedIndex index = main.buildIndex(corpus, config);
                SimpleSearchEngine engine = new SimpleSearchEngine(corpus, index);
                SearchResult result = engine.search(safeQuery, options, createRanker(corpus, index, config));

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    System.out.println("🔍 查询: \"" + safeQuery + "\"");
                    System.out.println();
                    printTextResult(result, config.getFields());
                    System.out.println();
                    System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                }
                return 0;
            } catch (CommandLine.ParameterException exception) {
                throw exception;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            } finally {
                main.closeCorpus(corpus);
            }
        }

        private SearchOptions resolveOptions(EngineConfig config) {
            double matchThreshold = threshold == null ? config.getMatchThreshold() : threshold;
            int hitCount = limit == null ? config.getHitCount() : limit;
            try {
                return new SearchOptions(matchThreshold, hitCount);
            } catch (IllegalArgumentException exception) {
                throw new CommandLine.ParameterException(new CommandLine(this), exception.getMessage(), exception);
            }
        }

        private Ranker createRanker(Corpus corpus, InMemoryInvertedIndex index, EngineConfig config) {
            return switch (ranker.toLowerCase(Locale.ROOT)) {
                case "tf" -> new TermFrequencyRanker();
                case "tfidf" -> new TfIdfRanker(corpus, index, config);
                default -> throw new CommandLine.ParameterException(new CommandLine(this),
                    "未知的排序方式: " + ranker + "（可选 tf|tfidf）");
            };
        }

        private void printTextResult(SearchResult result, List<String> displayFields) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%d. docId=%d (score: %.4f)%n", rank++, hit.document().docId(), hit.score());
                for (String field : displayFields) {
                    String text = hit.document().getText(field);
                    if (!text.isEmpty()) {
                        System.out.println("   " + field + ": " + text.replace("\n", " "));
                    }
                }
                System.out.println();
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "stats", description = "📊 查看语料与索引统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.json/.jsonl/.tsv）或文档数据库（.db/.sqlite）")
        private Path corpusFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config;
            try {
                config = main.resolveConfig();
            } catch (IOException exception) {
                System.err.println("❌ 读取配置失败: " + exception.getMessage());
                return 1;
            }

            Corpus corpus = null;
            try {
                corpus = main.openCorpus(corpusFile);
                InMemoryInvertedIndex index = main.buildIndex(corpus, config);

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 语料文件: " + corpusFile);
                System.out.println("🏷️ 索引字段: " + config.getFields());
                System.out.println("📄 文档总数: " + corpus.size());
                System.out.println("🔤 词条总数: " + index.getTermCount());
                System.out.println("📦 压缩倒排: " + (index.isCompressed() ? "是" : "否"));
                System.out.println("✂️ 分词方式: " + (config.getShingleWidth() > 0
                    ? config.getShingleWidth() + "-shingle" : "字母数字"));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取统计失败: " + exception.getMessage());
                return 1;
            } finally {
                main.closeCorpus(corpus);
            }
        }
    }

    @Command(name = "import", description = "📥 把语料文件导入 SQLite 文档表")
    static class ImportSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（.json/.jsonl/.tsv）")
        private Path corpusFile;

        @Parameters(index = "1", description = "目标数据库（.db/.sqlite），不存在时创建")
        private Path databaseFile;

        @Option(names = {"--replace"}, description = "导入前清空已有文档")
        private boolean replace;

        @Override
        public Integer call() {
            if (!isDatabasePath(databaseFile)) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "目标数据库扩展名必须为 " + Constants.DATABASE_EXTENSIONS + ": " + databaseFile);
            }
            try {
                InMemoryCorpus corpus = new CorpusLoader().load(corpusFile);
                try (DocumentTable documentTable = new DocumentTable(databaseFile)) {
                    if (replace) {
                        documentTable.clear();
                    }
                    int imported = documentTable.importFrom(corpus);
                    System.out.println("✅ 已导入 " + imported + " 篇文档，数据库共 " + documentTable.size() + " 篇");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 导入失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
