package com.ftindex.posting;

import com.ftindex.config.Constants;
import com.ftindex.storage.VarIntCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

/**
 * 单个 {@link PostingBlock} 上的前向解码游标。
 *
 * <p>{@link #advance(int)} 先在跳表上二分定位到目标之前最近的 skip point，再线性解码；
 * 位置按需读取，跳过文档时未读的位置一并跳过。
 */
public final class PostingDecoder {
    /** 游标耗尽 */
    public static final int NO_MORE_DOCS = Integer.MAX_VALUE;

    private final PostingBlock block;
    private final boolean hasTermFreq;
    private final ByteBuffer docIn;
    private final ByteBuffer posIn;

    private int docIndex;
    private int docId = -1;
    private int termFreq;
    private int positionsLeft;
    private int lastPosition;

    PostingDecoder(PostingBlock block) {
        this.block = block;
        this.hasTermFreq = block.option().hasTermFrequency();
        this.docIn = block.docBytes();
        this.posIn = block.posBytes();
    }

    /**
     * 当前文档ID；尚未前进时为 -1，耗尽后为 {@link #NO_MORE_DOCS}。
     */
    public int docId() {
        return docId;
    }

    /**
     * 当前文档词频；格式不记录词频时恒为 1。
     */
    public int freq() {
        return termFreq;
    }

    /**
     * 前进到下一个文档。
     */
    public int nextDoc() {
        if (docId == NO_MORE_DOCS) {
            return NO_MORE_DOCS;
        }
        if (docIndex == block.docCount()) {
            docId = NO_MORE_DOCS;
            return docId;
        }
        skipUnreadPositions();
        int previous = Math.max(docId, 0);
        docId = previous + readVarInt(docIn);
        termFreq = hasTermFreq ? readVarInt(docIn) : 1;
        positionsLeft = block.option().hasPosition() ? termFreq : 0;
        lastPosition = 0;
        docIndex++;
        return docId;
    }

    /**
     * 前进到第一个 docId &gt;= target 的文档；当前文档已满足时原地返回。
     */
    public int advance(int target) {
        if (docId != -1 && docId >= target) {
            return docId;
        }
        int skipIndex = findSkipPoint(target);
        if (skipIndex >= 0) {
            int skipDocIndex = (skipIndex + 1) * block.skipInterval();
            if (skipDocIndex > docIndex) {
                docIn.position(block.skipDocOffset(skipIndex));
                posIn.position(block.skipPosOffset(skipIndex));
                docIndex = skipDocIndex;
                docId = block.skipDocId(skipIndex);
                positionsLeft = 0;
            }
        }
        int current = nextDoc();
        while (current < target) {
            current = nextDoc();
        }
        return current;
    }

    /**
     * 读取当前文档的下一个位置，读完返回 {@link Constants#INVALID_POSITION}。
     */
    public int nextPosition() {
        if (positionsLeft == 0) {
            return Constants.INVALID_POSITION;
        }
        lastPosition += readVarInt(posIn);
        positionsLeft--;
        return lastPosition;
    }

    /**
     * 二分查找最后一个 skipDocId &lt; target 的跳表项，没有时返回 -1。
     */
    private int findSkipPoint(int target) {
        int low = 0;
        int high = block.skipCount() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (block.skipDocId(mid) < target) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }

    private void skipUnreadPositions() {
        while (positionsLeft > 0) {
            readVarInt(posIn);
            positionsLeft--;
        }
    }

    private static int readVarInt(ByteBuffer buffer) {
        try {
            return VarIntCodec.readVarInt(buffer);
        } catch (IOException exception) {
            throw new UncheckedIOException("倒排数据损坏: offset=" + buffer.position(), exception);
        }
    }
}
