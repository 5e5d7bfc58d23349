package com.ftindex.posting;

import com.ftindex.config.Constants;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 查询期倒排游标，遍历同一词项在多个段上的倒排。
 *
 * <p>状态只在显式 seek 时迁移：
 * <pre>
 *   UNPOSITIONED --seekDoc--> POSITIONED --seekDoc--> ... --seekDoc--> EXHAUSTED
 * </pre>
 * EXHAUSTED 为终态。{@link #seekPosition(int)} 只允许在 POSITIONED 状态调用。
 * 每次查询新建实例，非线程安全。
 */
public final class PostingIterator {

    public enum State {
        UNPOSITIONED,
        POSITIONED,
        EXHAUSTED
    }

    private final PostingFormatOption option;

    private List<SegmentPosting> segments = List.of();
    private PostingDecoder[] decoders = new PostingDecoder[0];
    private int segmentCursor;
    private State state = State.UNPOSITIONED;
    private long currentDocId = Constants.INVALID_ROW_ID;
    private int currentPosition = Constants.INVALID_POSITION;
    private boolean positionsExhausted;

    public PostingIterator(PostingFormatOption option) {
        if (option == null) {
            throw new IllegalArgumentException("option 不能为null");
        }
        this.option = option;
    }

    /**
     * 以一组段倒排初始化游标，段按 baseRowId 升序排列，各段文档ID区间不得重叠。
     */
    public void init(List<SegmentPosting> segmentPostings) {
        if (segmentPostings == null) {
            throw new IllegalArgumentException("segmentPostings 不能为null");
        }
        List<SegmentPosting> sorted = new ArrayList<>(segmentPostings);
        sorted.sort(Comparator.comparingLong(SegmentPosting::baseRowId));
        long previousLastRowId = -1L;
        for (SegmentPosting segment : sorted) {
            if (!option.equals(segment.block().option())) {
                throw new IllegalArgumentException("段倒排格式不一致: expected=" + option + ", actual=" + segment.block().option());
            }
            if (segment.block().docCount() == 0) {
                continue;
            }
            if (segment.baseRowId() <= previousLastRowId) {
                throw new IllegalArgumentException("段文档区间重叠: baseRowId=" + segment.baseRowId()
                    + ", previousLastRowId=" + previousLastRowId);
            }
            previousLastRowId = segment.lastRowId();
        }
        this.segments = List.copyOf(sorted);
        this.decoders = new PostingDecoder[sorted.size()];
        this.segmentCursor = 0;
        this.state = State.UNPOSITIONED;
        this.currentDocId = Constants.INVALID_ROW_ID;
        resetPositionCursor();
    }

    /**
     * 前进到第一个文档ID &gt;= target 的文档。
     *
     * @param target 目标文档ID
     * @return 命中的文档ID；不存在时返回 {@link Constants#INVALID_ROW_ID} 并进入 EXHAUSTED
     */
    public long seekDoc(long target) {
        if (state == State.EXHAUSTED) {
            return Constants.INVALID_ROW_ID;
        }
        if (state == State.POSITIONED && target <= currentDocId) {
            return currentDocId;
        }
        long effectiveTarget = Math.max(target, 0L);
        while (segmentCursor < segments.size()) {
            SegmentPosting segment = segments.get(segmentCursor);
            if (effectiveTarget <= segment.lastRowId()) {
                long localTarget = Math.max(effectiveTarget - segment.baseRowId(), 0L);
                int localDocId = decoder(segmentCursor).advance((int) localTarget);
                if (localDocId != PostingDecoder.NO_MORE_DOCS) {
                    currentDocId = segment.baseRowId() + localDocId;
                    state = State.POSITIONED;
                    resetPositionCursor();
                    return currentDocId;
                }
            }
            segmentCursor++;
        }
        state = State.EXHAUSTED;
        currentDocId = Constants.INVALID_ROW_ID;
        resetPositionCursor();
        return Constants.INVALID_ROW_ID;
    }

    /**
     * 当前文档的词频。
     *
     * @throws InvalidIteratorStateException 不在 POSITIONED 状态
     */
    public int getCurrentTF() {
        ensurePositioned("getCurrentTF");
        return decoders[segmentCursor].freq();
    }

    /**
     * 把文档内位置游标推进到第一个 &gt;= fromPosition 的位置。游标只前进不回退。
     *
     * @param fromPosition 起始位置
     * @return 命中的位置；当前文档的位置已耗尽时返回 {@link Constants#INVALID_POSITION}
     * @throws InvalidIteratorStateException 不在 POSITIONED 状态或格式不记录位置
     */
    public int seekPosition(int fromPosition) {
        ensurePositioned("seekPosition");
        if (!option.hasPosition()) {
            throw new InvalidIteratorStateException("seekPosition(无位置格式)", state);
        }
        if (positionsExhausted) {
            return Constants.INVALID_POSITION;
        }
        if (currentPosition != Constants.INVALID_POSITION && currentPosition >= fromPosition) {
            return currentPosition;
        }
        PostingDecoder decoder = decoders[segmentCursor];
        int position = decoder.nextPosition();
        while (position != Constants.INVALID_POSITION && position < fromPosition) {
            position = decoder.nextPosition();
        }
        if (position == Constants.INVALID_POSITION) {
            positionsExhausted = true;
        }
        currentPosition = position;
        return position;
    }

    public State getState() {
        return state;
    }

    /**
     * 当前文档ID，非 POSITIONED 状态为 {@link Constants#INVALID_ROW_ID}。
     */
    public long getCurrentDocId() {
        return currentDocId;
    }

    /**
     * 全部段合计的文档频次。
     */
    public int getDocFreq() {
        int docFreq = 0;
        for (SegmentPosting segment : segments) {
            docFreq += segment.block().docCount();
        }
        return docFreq;
    }

    /**
     * 全部段合计的词项摘要。
     */
    public TermMeta getTermMeta() {
        int docFreq = 0;
        long totalTermFreq = 0;
        int payload = 0;
        for (SegmentPosting segment : segments) {
            TermMeta meta = segment.block().termMeta();
            docFreq += meta.docFreq();
            totalTermFreq += meta.totalTermFreq();
            payload |= meta.payload();
        }
        return new TermMeta(docFreq, totalTermFreq, payload);
    }

    private PostingDecoder decoder(int index) {
        if (decoders[index] == null) {
            decoders[index] = segments.get(index).block().newDecoder();
        }
        return decoders[index];
    }

    private void resetPositionCursor() {
        currentPosition = Constants.INVALID_POSITION;
        positionsExhausted = false;
    }

    private void ensurePositioned(String operation) {
        if (state != State.POSITIONED) {
            throw new InvalidIteratorStateException(operation, state);
        }
    }
}
