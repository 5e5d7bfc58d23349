package com.ftindex.memory;

import java.io.InputStream;

/**
 * {@link ByteSliceOutput} 的顺序读取视图，读到创建时的长度为止。
 */
public final class ByteSliceInput extends InputStream {
    private final ByteSliceOutput source;
    private final long limit;
    private long position;
    private int sliceIndex;
    private int offsetInSlice;

    ByteSliceInput(ByteSliceOutput source, long limit) {
        this.source = source;
        this.limit = limit;
    }

    @Override
    public int read() {
        if (position >= limit) {
            return -1;
        }
        if (offsetInSlice == source.sliceLength(sliceIndex)) {
            sliceIndex++;
            offsetInSlice = 0;
        }
        position++;
        return source.readByte(sliceIndex, offsetInSlice++) & 0xFF;
    }

    @Override
    public int available() {
        return (int) Math.min(Integer.MAX_VALUE, limit - position);
    }

    public long position() {
        return position;
    }

    public boolean eof() {
        return position >= limit;
    }
}
