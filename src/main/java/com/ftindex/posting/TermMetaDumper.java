package com.ftindex.posting;

import com.ftindex.storage.IndexFileWriter;

import java.io.IOException;

/**
 * 按格式选项把 {@link TermMeta} 写成定长记录：
 * {@code int32 docFreq}，记录词频时 {@code int64 totalTermFreq}，记录 payload 时 {@code int32 payload}。
 *
 * <p>布局没有版本号，跨版本兼容由调用方保证。
 */
public final class TermMetaDumper {
    private final PostingFormatOption option;

    public TermMetaDumper(PostingFormatOption option) {
        if (option == null) {
            throw new IllegalArgumentException("option 不能为null");
        }
        this.option = option;
    }

    public void dump(IndexFileWriter writer, TermMeta termMeta) throws IOException {
        writer.writeInt(termMeta.docFreq());
        if (option.hasTermFrequency()) {
            writer.writeLong(termMeta.totalTermFreq());
        }
        if (option.hasTermPayload()) {
            writer.writeInt(termMeta.payload());
        }
    }

    /**
     * 单条记录的字节数。
     */
    public int recordSize() {
        return recordSize(option);
    }

    static int recordSize(PostingFormatOption option) {
        int size = Integer.BYTES;
        if (option.hasTermFrequency()) {
            size += Long.BYTES;
        }
        if (option.hasTermPayload()) {
            size += Integer.BYTES;
        }
        return size;
    }
}
