package com.ftindex.posting;

import java.nio.ByteBuffer;

/**
 * 封存后的单词项倒排块，只读。
 *
 * <p>字节布局：
 * <ul>
 *   <li>文档流：每个文档 {@code VarInt(docId - prevDocId)}，格式记录词频时再跟 {@code VarInt(tf)}；
 *       prevDocId 初始为 0。</li>
 *   <li>位置流：每个文档 tf 个 {@code VarInt(pos - prevPos)}，prevPos 在每个文档开头归零。</li>
 *   <li>跳表：每 skipInterval 个文档记录一次 (该组最后一个 docId, 文档流偏移, 位置流偏移)，
 *       偏移指向下一组的起点。</li>
 * </ul>
 * 底层缓冲可以是堆内数组，也可以是内存映射的段文件切片。
 */
public final class PostingBlock {
    private final PostingFormatOption option;
    private final int docCount;
    private final long totalTermFreq;
    private final int termPayload;
    private final int lastDocId;
    private final int skipInterval;
    private final int[] skipDocIds;
    private final int[] skipDocOffsets;
    private final int[] skipPosOffsets;
    private final ByteBuffer docBytes;
    private final ByteBuffer posBytes;

    public PostingBlock(
            PostingFormatOption option,
            int docCount,
            long totalTermFreq,
            int termPayload,
            int lastDocId,
            int skipInterval,
            int[] skipDocIds,
            int[] skipDocOffsets,
            int[] skipPosOffsets,
            ByteBuffer docBytes,
            ByteBuffer posBytes) {
        if (option == null || docBytes == null || posBytes == null) {
            throw new IllegalArgumentException("option 与字节流不能为null");
        }
        if (skipDocIds == null || skipDocOffsets == null || skipPosOffsets == null) {
            throw new IllegalArgumentException("跳表数组不能为null");
        }
        if (docCount < 0 || skipInterval <= 0) {
            throw new IllegalArgumentException("docCount/skipInterval 非法: " + docCount + "/" + skipInterval);
        }
        int expectedSkips = docCount / skipInterval;
        if (skipDocIds.length != expectedSkips
            || skipDocOffsets.length != expectedSkips
            || skipPosOffsets.length != expectedSkips) {
            throw new IllegalArgumentException("跳表长度与文档数不一致: docCount=" + docCount
                + ", skipInterval=" + skipInterval + ", skips=" + skipDocIds.length);
        }
        this.option = option;
        this.docCount = docCount;
        this.totalTermFreq = totalTermFreq;
        this.termPayload = termPayload;
        this.lastDocId = lastDocId;
        this.skipInterval = skipInterval;
        this.skipDocIds = skipDocIds.clone();
        this.skipDocOffsets = skipDocOffsets.clone();
        this.skipPosOffsets = skipPosOffsets.clone();
        this.docBytes = docBytes.asReadOnlyBuffer();
        this.posBytes = posBytes.asReadOnlyBuffer();
    }

    /**
     * 创建新的解码游标，游标之间互不影响。
     */
    public PostingDecoder newDecoder() {
        return new PostingDecoder(this);
    }

    public TermMeta termMeta() {
        return new TermMeta(docCount, totalTermFreq, option.hasTermPayload() ? termPayload : 0);
    }

    public PostingFormatOption option() {
        return option;
    }

    public int docCount() {
        return docCount;
    }

    public long totalTermFreq() {
        return totalTermFreq;
    }

    public int termPayload() {
        return termPayload;
    }

    /**
     * 最后一个文档ID，空块为 -1。
     */
    public int lastDocId() {
        return lastDocId;
    }

    public int skipInterval() {
        return skipInterval;
    }

    public int skipCount() {
        return skipDocIds.length;
    }

    public int skipDocId(int index) {
        return skipDocIds[index];
    }

    public int skipDocOffset(int index) {
        return skipDocOffsets[index];
    }

    public int skipPosOffset(int index) {
        return skipPosOffsets[index];
    }

    /**
     * 文档流的独立只读视图，position 为 0。
     */
    public ByteBuffer docBytes() {
        return docBytes.duplicate();
    }

    /**
     * 位置流的独立只读视图，position 为 0。
     */
    public ByteBuffer posBytes() {
        return posBytes.duplicate();
    }
}
