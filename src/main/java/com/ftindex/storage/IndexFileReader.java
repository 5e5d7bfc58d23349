package com.ftindex.storage;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link IndexFileWriter} 的顺序读取端，数据不足时抛出 {@link java.io.EOFException}。
 */
public final class IndexFileReader implements AutoCloseable {
    private static final int DEFAULT_BUFFER_SIZE = 8 * 1024;

    private final Path path;
    private final DataInputStream in;
    private long position;
    private boolean closed;

    public IndexFileReader(Path path) throws IOException {
        this(path, DEFAULT_BUFFER_SIZE);
    }

    public IndexFileReader(Path path, int bufferSize) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("文件路径不能为空");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize 必须为正数: " + bufferSize);
        }
        this.path = path;
        this.in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path), bufferSize));
    }

    public byte readByte() throws IOException {
        ensureOpen();
        byte value = in.readByte();
        position += Byte.BYTES;
        return value;
    }

    public short readShort() throws IOException {
        ensureOpen();
        short value = in.readShort();
        position += Short.BYTES;
        return value;
    }

    public int readInt() throws IOException {
        ensureOpen();
        int value = in.readInt();
        position += Integer.BYTES;
        return value;
    }

    public long readLong() throws IOException {
        ensureOpen();
        long value = in.readLong();
        position += Long.BYTES;
        return value;
    }

    public int readVarInt() throws IOException {
        ensureOpen();
        int value = VarIntCodec.readVarInt(in);
        position += VarIntCodec.varIntSize(value);
        return value;
    }

    public void readFully(byte[] bytes) throws IOException {
        ensureOpen();
        in.readFully(bytes);
        position += bytes.length;
    }

    public long position() {
        return position;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        in.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileReader 已关闭: " + path);
        }
    }
}
