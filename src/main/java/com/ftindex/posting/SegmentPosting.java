package com.ftindex.posting;

/**
 * 一个段内某词项的倒排，迭代时对外报告的文档ID为 {@code baseRowId + 块内文档ID}。
 *
 * @param baseRowId 段起始行号
 * @param block 封存后的倒排块
 */
public record SegmentPosting(long baseRowId, PostingBlock block) {

    public SegmentPosting {
        if (baseRowId < 0) {
            throw new IllegalArgumentException("baseRowId 不能为负数: " + baseRowId);
        }
        if (block == null) {
            throw new IllegalArgumentException("block 不能为null");
        }
    }

    /**
     * 本段最后一个全局文档ID，空块返回 -1。
     */
    public long lastRowId() {
        return block.docCount() == 0 ? -1L : baseRowId + block.lastDocId();
    }
}
