package com.ftindex.text;

/**
 * 分词失败。由分词器抛出，列倒排器补充行号后向上传播。
 */
public class AnalyzerException extends RuntimeException {
    private final int rowIndex;

    public AnalyzerException(String message) {
        this(message, -1, null);
    }

    public AnalyzerException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public AnalyzerException(String message, int rowIndex, Throwable cause) {
        super(rowIndex < 0 ? message : message + ", row=" + rowIndex, cause);
        this.rowIndex = rowIndex;
    }

    /**
     * 失败行号，未知时为 -1。
     */
    public int getRowIndex() {
        return rowIndex;
    }
}
