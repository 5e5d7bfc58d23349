package com.ftindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ftindex.column.TextColumnVector;
import com.ftindex.config.Constants;
import com.ftindex.config.IndexConfig;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingIterator;
import com.ftindex.posting.TermMeta;
import com.ftindex.segment.PartitionedIndexBuilder;
import com.ftindex.segment.SegmentIndexReader;
import com.ftindex.segment.SegmentMeta;
import com.ftindex.text.Analyzer;
import com.ftindex.text.AnalyzerRegistry;
import com.ftindex.text.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "ftindex",
    description = "📚 列式全文倒排索引构建工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.TermSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--index-dir"}, description = "段目录路径", defaultValue = "./index")
    private Path indexDir;

    @Option(names = {"--segment"}, description = "段名称", defaultValue = "segment-0")
    private String segmentName;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 列式全文倒排索引构建工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private IndexConfig loadConfig() throws IOException {
        return configFile == null ? IndexConfig.defaults() : IndexConfig.load(configFile);
    }

    private static ObjectMapper jsonMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Command(name = "build", description = "🚀 把文本文件（每行一个文档）构建成段")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文本文件", arity = "1")
        private Path inputFile;

        @Option(names = {"-p", "--partitions"}, description = "构建分区数")
        private Integer partitions;

        @Option(names = {"-a", "--analyzer"}, description = "分词器名称 (standard|english)")
        private String analyzer;

        @Option(names = {"--skip-interval"}, description = "跳表间隔")
        private Integer skipInterval;

        @Option(names = {"--base-row-id"}, description = "段起始行号", defaultValue = "0")
        private long baseRowId;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexConfig config = main.loadConfig();
                if (partitions != null) {
                    if (partitions > Constants.MAX_PARTITIONS) {
                        System.err.printf("⚠️ 分区数 %d 超过安全上限 %d，已自动限制%n", partitions, Constants.MAX_PARTITIONS);
                    }
                    config.setPartitions(Math.min(partitions, Constants.MAX_PARTITIONS));
                }
                if (analyzer != null) {
                    config.setAnalyzer(analyzer);
                }
                if (skipInterval != null) {
                    config.setSkipInterval(skipInterval);
                }
                config.validate();

                System.out.println("🚀 开始构建...");
                System.out.println("📄 输入文件: " + inputFile);
                System.out.println("📁 段目录: " + main.indexDir);
                System.out.println("🔧 分区数: " + config.getPartitions());

                long start = System.currentTimeMillis();
                TextColumnVector column = TextColumnVector.fromLines(inputFile);
                SegmentMeta meta = new PartitionedIndexBuilder(config, PostingFormatOption.ALL)
                    .buildSegment(column, main.indexDir, main.segmentName, baseRowId);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 构建完成！");
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + meta.docCount());
                System.out.println("   词条数: " + meta.termCount());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "term", description = "🔎 查看词项的倒排")
    static class TermSubcommand implements Callable<Integer> {

        @Parameters(description = "词项（按段的分词器归一化）", arity = "1")
        private String term;

        @Option(names = {"-l", "--limit"}, description = "最多列出的文档数", defaultValue = "20")
        private int limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SegmentIndexReader reader = SegmentIndexReader.open(main.indexDir, main.segmentName)) {
                String normalized = normalize(reader.meta().analyzer(), term);
                TermReport report = collect(reader, normalized, Math.max(limit, 0));
                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(report));
                } else {
                    printText(report);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }

        private static String normalize(String analyzerName, String rawTerm) {
            Analyzer analyzer = AnalyzerRegistry.create(analyzerName);
            List<Token> tokens = analyzer.tokenize(rawTerm);
            return tokens.isEmpty() ? rawTerm : tokens.get(0).term();
        }

        private static TermReport collect(SegmentIndexReader reader, String term, int limit) throws IOException {
            Optional<TermMeta> termMeta = reader.termMeta(term);
            if (termMeta.isEmpty()) {
                return new TermReport(term, 0, 0L, List.of());
            }
            PostingIterator iterator = reader.postingIterator(term);
            List<DocHit> hits = new ArrayList<>();
            for (long docId = iterator.seekDoc(0L);
                 docId != Constants.INVALID_ROW_ID && hits.size() < limit;
                 docId = iterator.seekDoc(docId + 1)) {
                List<Integer> positions = new ArrayList<>();
                if (reader.option().hasPosition()) {
                    for (int position = iterator.seekPosition(0);
                         position != Constants.INVALID_POSITION;
                         position = iterator.seekPosition(position + 1)) {
                        positions.add(position);
                    }
                }
                hits.add(new DocHit(docId, iterator.getCurrentTF(), positions));
            }
            return new TermReport(term, termMeta.get().docFreq(), termMeta.get().totalTermFreq(), hits);
        }

        private static void printText(TermReport report) {
            System.out.println("🔤 词项: \"" + report.term() + "\"");
            if (report.docFreq() == 0) {
                System.out.println("⚠️ 段中不存在该词项");
                return;
            }
            System.out.println("📄 文档频次: " + report.docFreq());
            System.out.println("🔢 总词频: " + report.totalTermFreq());
            System.out.println("─────────────────────────────────");
            for (DocHit hit : report.docs()) {
                System.out.printf("doc=%d tf=%d positions=%s%n", hit.docId(), hit.termFreq(), hit.positions());
            }
        }
    }

    @Command(name = "stats", description = "📊 查看段统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @Option(names = {"--prefix"}, description = "列出以该前缀开头的词项")
        private String prefix;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SegmentIndexReader reader = SegmentIndexReader.open(main.indexDir, main.segmentName)) {
                SegmentMeta meta = reader.meta();
                int[] lengths = reader.columnLengths();
                long totalTokens = 0;
                for (int length : lengths) {
                    totalTokens += length;
                }

                System.out.println("📊 段状态");
                System.out.println("═══════════");
                System.out.println("📁 段目录: " + main.indexDir);
                System.out.println("🏷️ 段名称: " + meta.segmentName());
                System.out.println("📍 起始行号: " + meta.baseRowId());
                System.out.println("📄 文档总数: " + meta.docCount());
                System.out.println("🔤 词条总数: " + meta.termCount());
                System.out.println("🧩 分词器: " + meta.analyzer());
                System.out.printf("📏 平均列长度: %.2f%n", lengths.length == 0 ? 0.0 : (double) totalTokens / lengths.length);
                System.out.println("💾 段大小: " + formatBytes(meta.sizeBytes()));
                if (prefix != null) {
                    System.out.println("🔎 前缀 \"" + prefix + "\": " + reader.prefixTerms(prefix));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
    }

    public record TermReport(String term, int docFreq, long totalTermFreq, List<DocHit> docs) {
    }

    public record DocHit(long docId, int termFreq, List<Integer> positions) {
    }
}
