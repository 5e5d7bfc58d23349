package com.ftindex.invert;

import java.io.IOException;

/**
 * 一个分区的列长度落盘任务，负责 [startRowId, startRowId + rowCount) 区间。
 *
 * <p>创建时向文件登记区间，与仍存活的任务重叠会失败；{@link #close()} 注销登记。
 */
public final class ColumnLengthUpdateJob implements AutoCloseable {
    private final ColumnLengthFileHandler handler;
    private final int rowCount;
    private final int startRowId;
    private final ColumnLengthArray columnLengthArray;
    private boolean closed;

    public ColumnLengthUpdateJob(ColumnLengthFileHandler handler, int rowCount, int startRowId, ColumnLengthArray columnLengthArray) {
        if (handler == null || columnLengthArray == null) {
            throw new IllegalArgumentException("handler 与 columnLengthArray 不能为null");
        }
        if (rowCount < 0 || startRowId < 0) {
            throw new IllegalArgumentException("区间非法: startRowId=" + startRowId + ", rowCount=" + rowCount);
        }
        if (rowCount > 0) {
            handler.register(startRowId, rowCount);
        }
        this.handler = handler;
        this.rowCount = rowCount;
        this.startRowId = startRowId;
        this.columnLengthArray = columnLengthArray;
    }

    /**
     * 倒排器通过 {@link ColumnInverter#getTermListLength(ColumnLengthArray)} 写入的目标数组。
     */
    public ColumnLengthArray getColumnLengthArray() {
        return columnLengthArray;
    }

    /**
     * 把本任务区间的长度写入文件。
     *
     * @throws IllegalStateException 本任务区间内仍有文档的长度未写入
     */
    public void dumpToFile() throws IOException {
        if (closed) {
            throw new IllegalStateException("更新任务已关闭: startRowId=" + startRowId);
        }
        if (rowCount == 0) {
            return;
        }
        if (!columnLengthArray.isWritten(startRowId, rowCount)) {
            throw new IllegalStateException("列长度尚未写入: startRowId=" + startRowId + ", rowCount=" + rowCount
                + ", arraySize=" + columnLengthArray.size());
        }
        handler.writeRange(startRowId, columnLengthArray.snapshot(startRowId, rowCount));
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getStartRowId() {
        return startRowId;
    }

    @Override
    public void close() {
        if (!closed) {
            if (rowCount > 0) {
                handler.unregister(startRowId);
            }
            closed = true;
        }
    }
}
