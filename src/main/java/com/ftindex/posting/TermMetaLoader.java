package com.ftindex.posting;

import com.ftindex.storage.IndexFileReader;

import java.io.IOException;

/**
 * 读取 {@link TermMetaDumper} 写出的定长记录。格式不记录词频时 totalTermFreq 取 docFreq。
 */
public final class TermMetaLoader {
    private final PostingFormatOption option;

    public TermMetaLoader(PostingFormatOption option) {
        if (option == null) {
            throw new IllegalArgumentException("option 不能为null");
        }
        this.option = option;
    }

    public TermMeta load(IndexFileReader reader) throws IOException {
        int docFreq = reader.readInt();
        long totalTermFreq = option.hasTermFrequency() ? reader.readLong() : docFreq;
        int payload = option.hasTermPayload() ? reader.readInt() : 0;
        if (docFreq < 0 || totalTermFreq < docFreq) {
            throw new IOException("词项摘要损坏: docFreq=" + docFreq + ", totalTermFreq=" + totalTermFreq
                + ", file=" + reader.path());
        }
        return new TermMeta(docFreq, totalTermFreq, payload);
    }

    public int recordSize() {
        return TermMetaDumper.recordSize(option);
    }
}
