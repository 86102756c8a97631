package com.ngramengine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ngramengine.config.Constants;
import com.ngramengine.config.EngineConfig;
import com.ngramengine.index.IndexStore;
import com.ngramengine.index.NgramIndex;
import com.ngramengine.index.NgramIndexBuilder;
import com.ngramengine.query.SearchHit;
import com.ngramengine.query.SearchResult;
import com.ngramengine.storage.IndexMeta;
import com.ngramengine.storage.ItemIdCodec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "ngi",
    description = "🔤 n-gram 模糊词项索引",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.DemoSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    static final List<String> DEMO_TERMS = List.of(
        "music",
        "muskel",
        "kindergarten",
        "preschool",
        "school",
        "highschool",
        "to skip school",
        "kind"
    );

    @Option(names = {"--index-dir"}, description = "索引目录路径", defaultValue = "./ngram-index")
    private Path indexDir;

    @Option(names = {"-n", "--gram-length"}, description = "n-gram 长度", defaultValue = "3")
    private int gramLength;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔤 n-gram 模糊词项索引");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig toConfig() {
        EngineConfig config = EngineConfig.defaults();
        if (indexDir != null) {
            config.setIndexDir(indexDir);
        }
        if (gramLength < 1) {
            System.err.printf("⚠️ 非法 gram 长度 %d，已回退为默认值 %d%n", gramLength, Constants.DEFAULT_GRAM_LENGTH);
        } else {
            config.setGramLength(gramLength);
        }
        return config;
    }

    private int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
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

    /**
     * 词项文件每行一个词项；"id\t词项" 形式显式指定ID，否则词项本身即ID。
     */
    static int loadTerms(Path termsFile, NgramIndexBuilder<String> builder) throws IOException {
        int skipped = 0;
        for (String line : Files.readAllLines(termsFile, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            int tab = line.indexOf('\t');
            String itemId = tab >= 0 ? line.substring(0, tab) : line;
            String term = tab >= 0 ? line.substring(tab + 1) : line;
            if (!builder.insert(term, itemId)) {
                skipped++;
            }
        }
        return skipped;
    }

    @Command(name = "build", description = "📂 从词项文件构建索引")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "词项文件路径", arity = "1")
        private Path termsFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.toConfig();
            System.out.println("🚀 开始构建索引...");
            System.out.println("📁 索引目录: " + config.getIndexDir());
            System.out.println("📄 词项文件: " + termsFile);
            System.out.println("🔧 gram 长度: " + config.getGramLength());

            try {
                long start = System.currentTimeMillis();
                NgramIndexBuilder<String> builder = new NgramIndexBuilder<>(config.getGramLength());
                int skipped = loadTerms(termsFile, builder);
                NgramIndex<String> index = builder.build();
                IndexMeta meta = IndexStore.save(index, config.getIndexDir(), ItemIdCodec.STRING);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   词项数: " + meta.itemCount());
                System.out.println("   维度数: " + meta.dimensionCount());
                System.out.println("   跳过(过短): " + skipped);
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "search", description = "🔎 模糊查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询字符串", arity = "1")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制（默认 10）")
        private Integer limit;

        @Option(names = {"-t", "--threshold"}, description = "维度文档频率剪枝阈值（默认不剪枝）")
        private Integer threshold;

        @Option(names = {"-w", "--weight"}, description = "加权 Dice 权重 [0,1]（默认 0.5，即普通 Dice）")
        private Double weight;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.toConfig();
            try {
                NgramIndex<String> index = IndexStore.load(config.getIndexDir(), ItemIdCodec.STRING);
                String safeQuery = main.sanitizeQuery(query);
                int safeLimit = main.sanitizeSearchLimit(limit == null ? config.getQueryLimit() : limit);
                double effectiveWeight = weight == null ? config.getWeight() : weight;
                int effectiveThreshold = threshold == null ? Integer.MAX_VALUE : threshold;
                SearchResult<String> result = index.search(safeQuery, safeLimit, effectiveWeight, effectiveThreshold);

                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                System.out.println();

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }

                System.out.println();
                System.out.println("📊 共 " + result.totalMatches() + " 条候选，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult<String> result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit<String> hit : result.hits()) {
                System.out.printf("%d. %s (score: %.4f)%n", rank++, hit.itemId(), hit.score());
            }
        }

        private void printJsonResult(SearchResult<String> result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.toConfig();
            try {
                IndexMeta meta = IndexStore.readMeta(config.getIndexDir());

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引目录: " + config.getIndexDir());
                System.out.println("🏷️ 格式版本: " + meta.formatVersion());
                System.out.println("🔤 gram 长度: " + meta.gramLength());
                System.out.println("📄 词项数: " + meta.itemCount());
                System.out.println("📐 维度数: " + meta.dimensionCount());
                System.out.println("🕒 创建时间: " + meta.createTime());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "demo", description = "🎯 用内置词表演示查询")
    static class DemoSubcommand implements Callable<Integer> {

        @Parameters(description = "查询字符串", arity = "0..1", defaultValue = "shol")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            int effectiveGramLength = main == null ? Constants.DEFAULT_GRAM_LENGTH : main.toConfig().getGramLength();
            NgramIndexBuilder<Integer> builder = new NgramIndexBuilder<>(effectiveGramLength);
            for (int position = 0; position < DEMO_TERMS.size(); position++) {
                builder.insert(DEMO_TERMS.get(position), position);
            }
            NgramIndex<Integer> index = builder.build();

            SearchResult<Integer> result = index.search(query, DEMO_TERMS.size());
            System.out.println("🔍 查询: \"" + query + "\"");
            for (SearchHit<Integer> hit : result.hits()) {
                System.out.printf("%s %.4f%n", DEMO_TERMS.get(hit.itemId()), hit.score());
            }
            return 0;
        }
    }
}
