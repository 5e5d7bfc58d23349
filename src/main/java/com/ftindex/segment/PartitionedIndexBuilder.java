package com.ftindex.segment;

import com.ftindex.column.ColumnVector;
import com.ftindex.config.IndexConfig;
import com.ftindex.invert.ColumnInverter;
import com.ftindex.invert.ColumnLengthArray;
import com.ftindex.invert.ColumnLengthFileHandler;
import com.ftindex.invert.ColumnLengthUpdateJob;
import com.ftindex.invert.MapPostingWriterProvider;
import com.ftindex.memory.PostingArenas;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.PostingWriter;
import com.ftindex.text.AnalyzerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把一列按行区间切成若干分区并行倒排，再在调用线程上依次合并、排序、封存。
 *
 * <p>每个分区持有私有的内存池与倒排器；列长度通过共享的 {@link ColumnLengthArray} 汇总，
 * 并由各分区的 {@link ColumnLengthUpdateJob} 写入列长度文件。任一分区失败时取消其余分区并抛出原始异常。
 */
public final class PartitionedIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PartitionedIndexBuilder.class);

    private final IndexConfig config;
    private final PostingFormatOption option;

    public PartitionedIndexBuilder(IndexConfig config, PostingFormatOption option) {
        if (config == null || option == null) {
            throw new IllegalArgumentException("config 与 option 不能为null");
        }
        this.config = config.validate();
        this.option = option;
    }

    /**
     * 倒排整列，文档ID为行号。
     *
     * @param column 列数据
     * @param lengthFile 列长度文件，为 null 时不落盘
     * @return 已封存的合并结果
     * @throws IOException 列长度写入失败或构建被中断
     */
    public BuildResult build(ColumnVector column, Path lengthFile) throws IOException {
        if (column == null) {
            throw new IllegalArgumentException("column 不能为null");
        }
        int rowCount = column.size();
        int partitions = Math.max(1, Math.min(config.getPartitions(), rowCount));
        int partitionSize = rowCount == 0 ? 0 : (rowCount + partitions - 1) / partitions;
        ColumnLengthArray columnLengths = new ColumnLengthArray();

        ColumnLengthFileHandler handler = null;
        if (lengthFile != null) {
            handler = new ColumnLengthFileHandler(lengthFile);
        }
        ExecutorService executor = Executors.newFixedThreadPool(partitions, newThreadFactory());
        try {
            List<Future<ColumnInverter>> futures = new ArrayList<>(partitions);
            for (int partition = 0; partition < partitions; partition++) {
                int startRow = Math.min(partition * partitionSize, rowCount);
                int count = Math.min(partitionSize, rowCount - startRow);
                ColumnLengthFileHandler partitionHandler = handler;
                futures.add(executor.submit(() -> invertPartition(column, startRow, count, columnLengths, partitionHandler)));
            }

            List<ColumnInverter> inverters = await(futures);
            ColumnInverter merged = inverters.get(0);
            for (int index = 1; index < inverters.size(); index++) {
                merged.merge(inverters.get(index));
            }
            merged.sort();
            merged.generatePosting();
            if (handler != null) {
                handler.sync();
            }
            logger.info("列倒排完成: rows={}, partitions={}, terms={}", rowCount, partitions, merged.getTermCount());
            return new BuildResult(merged, columnLengths, partitions);
        } finally {
            executor.shutdownNow();
            if (handler != null) {
                handler.close();
            }
        }
    }

    /**
     * 倒排整列并写成段目录下的一个段。失败时删除已写出的段文件。
     *
     * @throws IOException 写入失败
     */
    public SegmentMeta buildSegment(ColumnVector column, Path directory, String segmentName, long baseRowId) throws IOException {
        Files.createDirectories(directory);
        Path lengthFile = SegmentFiles.lengths(directory, segmentName);
        try {
            BuildResult result = build(column, lengthFile);
            try (SegmentIndexWriter writer = new SegmentIndexWriter(directory, segmentName, option)) {
                for (Map.Entry<String, PostingWriter> entry : result.inverter().getSortedTerms()) {
                    writer.addTerm(entry.getKey(), entry.getValue().getPostingBlock());
                }
                return writer.finish(baseRowId, result.docCount(), config.getSkipInterval(), config.getAnalyzer());
            }
        } catch (IOException | RuntimeException exception) {
            try {
                Files.deleteIfExists(lengthFile);
            } catch (IOException deleteException) {
                exception.addSuppressed(deleteException);
            }
            throw exception;
        }
    }

    private ColumnInverter invertPartition(ColumnVector column, int startRow, int rowCount,
                                           ColumnLengthArray columnLengths, ColumnLengthFileHandler handler) throws IOException {
        PostingArenas arenas = PostingArenas.create(config);
        ColumnInverter inverter = new ColumnInverter(
            AnalyzerRegistry.create(config.getAnalyzer()),
            new MapPostingWriterProvider(option, arenas, config.getSkipInterval()));
        inverter.invertColumn(column, startRow, rowCount, startRow);
        if (handler == null) {
            inverter.getTermListLength(columnLengths);
        } else {
            try (ColumnLengthUpdateJob job = new ColumnLengthUpdateJob(handler, rowCount, startRow, columnLengths)) {
                inverter.getTermListLength(job.getColumnLengthArray());
                job.dumpToFile();
            }
        }
        logger.debug("分区倒排完成: rows=[{}, {}), terms={}, arenaBytes={}",
            startRow, startRow + rowCount, inverter.getTermCount(), arenas.bytesUsed());
        return inverter;
    }

    private static List<ColumnInverter> await(List<Future<ColumnInverter>> futures) throws IOException {
        List<ColumnInverter> inverters = new ArrayList<>(futures.size());
        try {
            for (Future<ColumnInverter> future : futures) {
                inverters.add(future.get());
            }
            return inverters;
        } catch (InterruptedException exception) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("列倒排被中断");
            interrupted.initCause(exception);
            throw interrupted;
        } catch (ExecutionException exception) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = exception.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("分区倒排失败", cause);
        }
    }

    private static ThreadFactory newThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ftindex-invert-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 一次构建的结果。
     *
     * @param inverter 合并并封存后的倒排器
     * @param columnLengths 全列的列长度
     * @param partitions 实际使用的分区数
     */
    public record BuildResult(ColumnInverter inverter, ColumnLengthArray columnLengths, int partitions) {

        public int docCount() {
            return inverter.getDocCount();
        }
    }
}
