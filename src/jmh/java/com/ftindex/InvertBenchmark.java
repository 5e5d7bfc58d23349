package com.ftindex;

import com.ftindex.column.TextColumnVector;
import com.ftindex.config.Constants;
import com.ftindex.config.IndexConfig;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingIterator;
import com.ftindex.posting.SegmentPosting;
import com.ftindex.segment.PartitionedIndexBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 列倒排性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class InvertBenchmark {

    @State(Scope.Benchmark)
    public static class ColumnState {
        @Param({"1", "4"})
        int partitions;

        TextColumnVector column;
        IndexConfig config;

        @Setup
        public void setup() {
            column = new TextColumnVector();
            for (int i = 0; i < 10000; i++) {
                column.append("Document " + i + " about "
                    + (i % 10 == 0 ? "finite state transducer" :
                       i % 10 == 1 ? "automaton theory" :
                       "general content")
                    + " with various keywords for inversion testing."
                    + " The quick brown fox jumps over the lazy dog.".repeat(3));
            }
            config = IndexConfig.defaults();
            config.setPartitions(partitions);
        }
    }

    @State(Scope.Benchmark)
    public static class PostingState {
        TextColumnVector column;
        PartitionedIndexBuilder.BuildResult result;

        @Setup
        public void setup() throws IOException {
            column = new TextColumnVector();
            for (int i = 0; i < 100000; i++) {
                column.append(i % 3 == 0 ? "common rare" : "common");
            }
            result = new PartitionedIndexBuilder(IndexConfig.defaults(), PostingFormatOption.ALL).build(column, null);
        }
    }

    @Benchmark
    public int invertThroughput(ColumnState state) throws IOException {
        return new PartitionedIndexBuilder(state.config, PostingFormatOption.ALL)
            .build(state.column, null)
            .inverter()
            .getTermCount();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long seekDocStride(PostingState state) {
        PostingIterator iterator = new PostingIterator(PostingFormatOption.ALL);
        iterator.init(List.of(new SegmentPosting(0L,
            state.result.inverter().getPostingWriter("common").getPostingBlock())));
        long matched = 0;
        for (long docId = iterator.seekDoc(0); docId != Constants.INVALID_ROW_ID; docId = iterator.seekDoc(docId + 1000)) {
            matched++;
        }
        return matched;
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(InvertBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
