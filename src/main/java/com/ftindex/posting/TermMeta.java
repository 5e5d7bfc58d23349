package com.ftindex.posting;

/**
 * 词项摘要：文档频次、总词频与词项 payload。
 *
 * @param docFreq 包含该词项的不同文档数
 * @param totalTermFreq 各文档词频之和
 * @param payload 词项级 payload，格式不记录时为 0
 */
public record TermMeta(int docFreq, long totalTermFreq, int payload) {

    public TermMeta {
        if (docFreq < 0) {
            throw new IllegalArgumentException("docFreq 不能为负数: " + docFreq);
        }
        if (totalTermFreq < 0) {
            throw new IllegalArgumentException("totalTermFreq 不能为负数: " + totalTermFreq);
        }
        if (docFreq > totalTermFreq) {
            throw new IllegalArgumentException("docFreq 不能大于 totalTermFreq: " + docFreq + " > " + totalTermFreq);
        }
    }

    public static TermMeta empty() {
        return new TermMeta(0, 0L, 0);
    }
}
