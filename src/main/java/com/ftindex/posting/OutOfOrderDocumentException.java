package com.ftindex.posting;

/**
 * 文档ID违反严格递增约束。属于调用方的编程错误，当前构建过程应直接中止。
 */
public class OutOfOrderDocumentException extends RuntimeException {
    private final String term;
    private final long previousDocId;
    private final long docId;

    public OutOfOrderDocumentException(String term, long previousDocId, long docId) {
        super("文档ID必须严格递增: term=" + term + ", previousDocId=" + previousDocId + ", docId=" + docId);
        this.term = term;
        this.previousDocId = previousDocId;
        this.docId = docId;
    }

    public String getTerm() {
        return term;
    }

    public long getPreviousDocId() {
        return previousDocId;
    }

    public long getDocId() {
        return docId;
    }
}
