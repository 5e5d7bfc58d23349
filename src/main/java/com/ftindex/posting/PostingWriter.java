package com.ftindex.posting;

import com.ftindex.config.Constants;
import com.ftindex.memory.ByteSliceOutput;
import com.ftindex.memory.PostingArenas;
import com.ftindex.storage.VarIntCodec;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 单词项倒排构建器，在一次构建过程中增量追加 (docId, tf, positions)。
 *
 * <p>文档流写入小块切片池，位置流写入可回收缓冲池；{@link #finalizePosting()} 把两条流
 * 复制成紧凑的 {@link PostingBlock} 并归还内存池中的块，之后不可再追加。
 */
public final class PostingWriter {
    private static final int[] NO_SKIPS = new int[0];

    private final String term;
    private final PostingFormatOption option;
    private final int skipInterval;
    private final ByteSliceOutput docOut;
    private final ByteSliceOutput posOut;
    private final ByteBuffer varIntScratch = ByteBuffer.allocate(5);

    private int[] skipDocIds = NO_SKIPS;
    private int[] skipDocOffsets = NO_SKIPS;
    private int[] skipPosOffsets = NO_SKIPS;
    private int skipCount;

    private int docFreq;
    private long totalTermFreq;
    private int termPayload;
    private int firstDocId = -1;
    private int lastDocId = -1;
    private PostingBlock finalizedBlock;
    private boolean discarded;

    public PostingWriter(String term, PostingFormatOption option, PostingArenas arenas) {
        this(term, option, arenas, Constants.SKIP_INTERVAL);
    }

    public PostingWriter(String term, PostingFormatOption option, PostingArenas arenas, int skipInterval) {
        if (term == null) {
            throw new IllegalArgumentException("term 不能为null");
        }
        if (option == null || arenas == null) {
            throw new IllegalArgumentException("option 与 arenas 不能为null");
        }
        if (skipInterval <= 0) {
            throw new IllegalArgumentException("skipInterval 必须为正数: " + skipInterval);
        }
        this.term = term;
        this.option = option;
        this.skipInterval = skipInterval;
        this.docOut = new ByteSliceOutput(arenas.byteSlicePool());
        this.posOut = new ByteSliceOutput(arenas.bufferPool());
    }

    /**
     * 追加一个文档的倒排项。
     *
     * @param docId 文档ID，必须严格大于上一次追加的文档ID
     * @param termFreq 该词项在文档中的出现次数
     * @param positions 出现位置，格式记录位置时长度必须等于 termFreq 且严格递增
     * @throws OutOfOrderDocumentException docId 未严格递增
     * @throws AlreadyFinalizedException 已封存
     */
    public void appendDocument(int docId, int termFreq, int[] positions) {
        ensureAppendable("appendDocument");
        if (docId < 0) {
            throw new IllegalArgumentException("docId 不能为负数: term=" + term + ", docId=" + docId);
        }
        if (docId <= lastDocId) {
            throw new OutOfOrderDocumentException(term, lastDocId, docId);
        }
        if (termFreq <= 0) {
            throw new IllegalArgumentException("termFreq 必须为正数: term=" + term + ", docId=" + docId + ", tf=" + termFreq);
        }
        if (option.hasPosition()) {
            checkPositions(docId, termFreq, positions);
        }

        writeVarInt(docOut, docId - Math.max(lastDocId, 0));
        if (option.hasTermFrequency()) {
            writeVarInt(docOut, termFreq);
        }
        if (option.hasPosition()) {
            int previous = 0;
            for (int position : positions) {
                writeVarInt(posOut, position - previous);
                previous = position;
            }
        }

        if (firstDocId < 0) {
            firstDocId = docId;
        }
        lastDocId = docId;
        docFreq++;
        totalTermFreq += option.hasTermFrequency() ? termFreq : 1;
        if (docFreq % skipInterval == 0) {
            addSkipPoint(docId);
        }
    }

    /**
     * 把另一个构建器的全部文档接在本构建器之后，用于合并按行区间拆分的倒排器。
     *
     * @throws OutOfOrderDocumentException other 的首个文档ID不大于本构建器的最后文档ID
     */
    public void appendFrom(PostingWriter other) {
        ensureAppendable("appendFrom");
        if (other == null || other == this) {
            throw new IllegalArgumentException("合并来源非法: term=" + term);
        }
        if (!option.equals(other.option)) {
            throw new IllegalArgumentException("倒排格式不一致: term=" + term + ", " + option + " vs " + other.option);
        }
        if (other.docFreq == 0) {
            return;
        }
        if (other.firstDocId <= lastDocId) {
            throw new OutOfOrderDocumentException(term, lastDocId, other.firstDocId);
        }

        PostingDecoder decoder = other.snapshot().newDecoder();
        for (int docId = decoder.nextDoc(); docId != PostingDecoder.NO_MORE_DOCS; docId = decoder.nextDoc()) {
            int termFreq = decoder.freq();
            int[] positions = null;
            if (option.hasPosition()) {
                positions = new int[termFreq];
                for (int index = 0; index < termFreq; index++) {
                    positions[index] = decoder.nextPosition();
                }
            }
            appendDocument(docId, termFreq, positions);
        }
        termPayload |= other.termPayload;
    }

    /**
     * 封存为只读倒排块并归还内存池中的块。
     *
     * @throws AlreadyFinalizedException 重复封存
     */
    public PostingBlock finalizePosting() {
        ensureAppendable("finalizePosting");
        finalizedBlock = snapshot();
        docOut.release();
        posOut.release();
        return finalizedBlock;
    }

    /**
     * 丢弃构建器并归还内存池中的块，用于合并后被吸收的一方。
     */
    public void discard() {
        if (finalizedBlock == null) {
            docOut.release();
            posOut.release();
        }
        discarded = true;
    }

    public String getTerm() {
        return term;
    }

    public PostingFormatOption getOption() {
        return option;
    }

    public int getDocFreq() {
        return docFreq;
    }

    public long getTotalTermFreq() {
        return totalTermFreq;
    }

    public int getFirstDocId() {
        return firstDocId;
    }

    public int getLastDocId() {
        return lastDocId;
    }

    public int getTermPayload() {
        return termPayload;
    }

    public void setTermPayload(int termPayload) {
        ensureAppendable("setTermPayload");
        this.termPayload = termPayload;
    }

    public boolean isFinalized() {
        return finalizedBlock != null;
    }

    /**
     * 封存后的倒排块。
     *
     * @throws IllegalStateException 尚未封存
     */
    public PostingBlock getPostingBlock() {
        if (finalizedBlock == null) {
            throw new IllegalStateException("倒排尚未封存: term=" + term);
        }
        return finalizedBlock;
    }

    public TermMeta toTermMeta() {
        return new TermMeta(docFreq, totalTermFreq, option.hasTermPayload() ? termPayload : 0);
    }

    /**
     * 把当前已写入的数据复制成一个独立的倒排块，不影响后续追加。
     */
    PostingBlock snapshot() {
        return new PostingBlock(
            option,
            docFreq,
            totalTermFreq,
            termPayload,
            lastDocId,
            skipInterval,
            Arrays.copyOf(skipDocIds, skipCount),
            Arrays.copyOf(skipDocOffsets, skipCount),
            Arrays.copyOf(skipPosOffsets, skipCount),
            ByteBuffer.wrap(docOut.toByteArray()),
            ByteBuffer.wrap(posOut.toByteArray()));
    }

    private void addSkipPoint(int docId) {
        if (skipCount == skipDocIds.length) {
            int newLength = Math.max(4, skipCount * 2);
            skipDocIds = Arrays.copyOf(skipDocIds, newLength);
            skipDocOffsets = Arrays.copyOf(skipDocOffsets, newLength);
            skipPosOffsets = Arrays.copyOf(skipPosOffsets, newLength);
        }
        skipDocIds[skipCount] = docId;
        skipDocOffsets[skipCount] = Math.toIntExact(docOut.length());
        skipPosOffsets[skipCount] = Math.toIntExact(posOut.length());
        skipCount++;
    }

    private void checkPositions(int docId, int termFreq, int[] positions) {
        if (positions == null || positions.length != termFreq) {
            throw new IllegalArgumentException("位置数与词频不一致: term=" + term + ", docId=" + docId
                + ", tf=" + termFreq + ", positions=" + (positions == null ? "null" : positions.length));
        }
        for (int index = 0; index < positions.length; index++) {
            if (positions[index] < 0) {
                throw new IllegalArgumentException("位置不能为负数: term=" + term + ", docId=" + docId);
            }
            if (index > 0 && positions[index] <= positions[index - 1]) {
                throw new IllegalArgumentException("文档内位置必须严格递增: term=" + term + ", docId=" + docId);
            }
        }
    }

    private void writeVarInt(ByteSliceOutput out, int value) {
        varIntScratch.clear();
        VarIntCodec.writeVarInt(value, varIntScratch);
        out.write(varIntScratch.array(), 0, varIntScratch.position());
    }

    private void ensureAppendable(String operation) {
        if (finalizedBlock != null) {
            throw new AlreadyFinalizedException(operation, "term=" + term);
        }
        if (discarded) {
            throw new IllegalStateException("构建器已被丢弃: term=" + term + ", operation=" + operation);
        }
    }
}
