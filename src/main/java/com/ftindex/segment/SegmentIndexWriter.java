package com.ftindex.segment;

import com.ftindex.config.Constants;
import com.ftindex.posting.PostingBlock;
import com.ftindex.posting.PostingFormatOption;
import com.ftindex.posting.TermMeta;
import com.ftindex.posting.TermMetaDumper;
import com.ftindex.storage.IndexFileWriter;
import com.ftindex.storage.StorageFileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 把按词项升序到达的倒排块写成一个段。
 *
 * <p>倒排文件格式（{@code .pst}）：
 * <pre>
 * [magic:int32][version:int16][optionFlags:int32]
 * 每个词项: [docCount:VarInt][skipInterval:VarInt][lastDocId+1:VarInt]
 *          [skipDocId:int32 skipDocOffset:int32 skipPosOffset:int32] x (docCount / skipInterval)
 *          [docLength:VarInt][docBytes][posLength:VarInt][posBytes]
 * [crc32:int32]
 * </pre>
 * 词典文件格式（{@code .dic}）：
 * <pre>
 * [magic:int32][version:int16][optionFlags:int32][termCount:int32]
 * 每个词项: [termLength:VarInt][termBytes:UTF-8][TermMeta][postingsOffset:int64]
 * [crc32:int32]
 * </pre>
 * 词典在 {@link #finish} 时一次写出，未完成就关闭会删除已写的部分文件。
 */
public final class SegmentIndexWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SegmentIndexWriter.class);

    private final Path directory;
    private final String segmentName;
    private final PostingFormatOption option;
    private final TermMetaDumper termMetaDumper;
    private final IndexFileWriter postingsOut;
    private final List<DictionaryEntry> entries = new ArrayList<>();

    private String lastTerm;
    private boolean finished;
    private boolean closed;

    public SegmentIndexWriter(Path directory, String segmentName, PostingFormatOption option) throws IOException {
        if (directory == null || segmentName == null || segmentName.isBlank() || option == null) {
            throw new IllegalArgumentException("段目录、段名与格式选项不能为空");
        }
        Files.createDirectories(directory);
        this.directory = directory;
        this.segmentName = segmentName;
        this.option = option;
        this.termMetaDumper = new TermMetaDumper(option);
        this.postingsOut = new IndexFileWriter(SegmentFiles.postings(directory, segmentName));
        postingsOut.writeInt(Constants.POSTINGS_MAGIC);
        postingsOut.writeShort(Constants.FORMAT_VERSION);
        postingsOut.writeInt(option.flags());
    }

    /**
     * 追加一个词项的倒排块。
     *
     * @throws IllegalArgumentException 词项未严格递增或格式不一致
     * @throws IOException 写入失败
     */
    public void addTerm(String term, PostingBlock block) throws IOException {
        ensureWritable();
        if (term == null || block == null) {
            throw new IllegalArgumentException("term 与 block 不能为null");
        }
        if (lastTerm != null && term.compareTo(lastTerm) <= 0) {
            throw new IllegalArgumentException("词项必须严格递增: previous=" + lastTerm + ", current=" + term);
        }
        if (!option.equals(block.option())) {
            throw new IllegalArgumentException("倒排格式不一致: term=" + term + ", expected=" + option + ", actual=" + block.option());
        }
        long offset = postingsOut.position();
        writeBlock(block);
        entries.add(new DictionaryEntry(term, block.termMeta(), offset));
        lastTerm = term;
    }

    /**
     * 写出词典、CRC 页脚与元数据，完成段。
     *
     * @param baseRowId 段起始行号
     * @param docCount 段覆盖的文档数
     * @param skipInterval 跳表间隔
     * @param analyzer 构建时使用的分词器名称
     * @return 段元数据
     * @throws IOException 写入失败，此时部分文件已被删除
     */
    public SegmentMeta finish(long baseRowId, int docCount, int skipInterval, String analyzer) throws IOException {
        ensureWritable();
        try {
            postingsOut.sync();
            postingsOut.close();
            Path dictionaryPath = SegmentFiles.dictionary(directory, segmentName);
            try (IndexFileWriter dictionaryOut = new IndexFileWriter(dictionaryPath)) {
                dictionaryOut.writeInt(Constants.DICT_MAGIC);
                dictionaryOut.writeShort(Constants.FORMAT_VERSION);
                dictionaryOut.writeInt(option.flags());
                dictionaryOut.writeInt(entries.size());
                for (DictionaryEntry entry : entries) {
                    byte[] termBytes = entry.term().getBytes(StandardCharsets.UTF_8);
                    dictionaryOut.writeVarInt(termBytes.length);
                    dictionaryOut.writeBytes(termBytes);
                    termMetaDumper.dump(dictionaryOut, entry.termMeta());
                    dictionaryOut.writeLong(entry.postingsOffset());
                }
                dictionaryOut.sync();
            }
            StorageFileUtil.appendCrc32Footer(postingsOut.path());
            StorageFileUtil.appendCrc32Footer(dictionaryPath);

            long sizeBytes = Files.size(postingsOut.path()) + Files.size(dictionaryPath);
            SegmentMeta meta = new SegmentMeta(segmentName, baseRowId, docCount, entries.size(), option.flags(),
                skipInterval, analyzer, sizeBytes, Instant.now());
            meta.writeTo(SegmentFiles.meta(directory, segmentName));
            finished = true;
            logger.info("段写入完成: segment={}, docs={}, terms={}, bytes={}", segmentName, docCount, entries.size(), sizeBytes);
            return meta;
        } catch (IOException | RuntimeException exception) {
            abort();
            throw exception;
        }
    }

    public int getTermCount() {
        return entries.size();
    }

    public Path getDirectory() {
        return directory;
    }

    public String getSegmentName() {
        return segmentName;
    }

    /**
     * 未完成时关闭会删除部分文件。
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        if (!finished) {
            abort();
        }
        closed = true;
    }

    private void writeBlock(PostingBlock block) throws IOException {
        postingsOut.writeVarInt(block.docCount());
        postingsOut.writeVarInt(block.skipInterval());
        postingsOut.writeVarInt(block.lastDocId() + 1);
        for (int index = 0; index < block.skipCount(); index++) {
            postingsOut.writeInt(block.skipDocId(index));
            postingsOut.writeInt(block.skipDocOffset(index));
            postingsOut.writeInt(block.skipPosOffset(index));
        }
        ByteBuffer docBytes = block.docBytes();
        postingsOut.writeVarInt(docBytes.remaining());
        postingsOut.writeBytes(docBytes);
        ByteBuffer posBytes = block.posBytes();
        postingsOut.writeVarInt(posBytes.remaining());
        postingsOut.writeBytes(posBytes);
    }

    private void abort() {
        closed = true;
        try {
            postingsOut.close();
        } catch (IOException exception) {
            logger.warn("关闭倒排文件失败: {} - {}", postingsOut.path(), exception.getMessage());
        }
        for (Path path : List.of(
                SegmentFiles.postings(directory, segmentName),
                SegmentFiles.dictionary(directory, segmentName),
                SegmentFiles.meta(directory, segmentName))) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException exception) {
                logger.warn("删除部分段文件失败: {} - {}", path, exception.getMessage());
            }
        }
    }

    private void ensureWritable() {
        if (finished || closed) {
            throw new IllegalStateException("段写入器已关闭: segment=" + segmentName);
        }
    }

    private record DictionaryEntry(String term, TermMeta termMeta, long postingsOffset) {
    }
}
