package com.ftindex.storage;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * 顺序二进制写入器，大端定长整数 + VarInt，{@link #sync()} 刷盘。
 */
public final class IndexFileWriter implements AutoCloseable {
    private static final int DEFAULT_BUFFER_SIZE = 8 * 1024;

    private final Path path;
    private final FileOutputStream fileOutputStream;
    private final DataOutputStream out;
    private long position;
    private boolean closed;

    public IndexFileWriter(Path path) throws IOException {
        this(path, DEFAULT_BUFFER_SIZE);
    }

    /**
     * 创建写入器，已存在的文件会被截断。
     *
     * @param path 目标文件
     * @param bufferSize 写缓冲字节数
     * @throws IOException 打开文件失败时抛出
     */
    public IndexFileWriter(Path path, int bufferSize) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("文件路径不能为空");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize 必须为正数: " + bufferSize);
        }
        this.path = path;
        this.fileOutputStream = new FileOutputStream(path.toFile());
        this.out = new DataOutputStream(new BufferedOutputStream(fileOutputStream, bufferSize));
    }

    public void writeByte(int value) throws IOException {
        ensureOpen();
        out.writeByte(value);
        position += Byte.BYTES;
    }

    public void writeShort(short value) throws IOException {
        ensureOpen();
        out.writeShort(value);
        position += Short.BYTES;
    }

    public void writeInt(int value) throws IOException {
        ensureOpen();
        out.writeInt(value);
        position += Integer.BYTES;
    }

    public void writeLong(long value) throws IOException {
        ensureOpen();
        out.writeLong(value);
        position += Long.BYTES;
    }

    public void writeVarInt(int value) throws IOException {
        ensureOpen();
        VarIntCodec.writeVarInt(value, out);
        position += VarIntCodec.varIntSize(value);
    }

    public void writeBytes(byte[] bytes) throws IOException {
        ensureOpen();
        out.write(bytes);
        position += bytes.length;
    }

    /**
     * 写出缓冲区 position 到 limit 之间的字节，不改变传入缓冲区的状态。
     */
    public void writeBytes(ByteBuffer buffer) throws IOException {
        ensureOpen();
        ByteBuffer view = buffer.duplicate();
        byte[] chunk = new byte[Math.min(view.remaining(), DEFAULT_BUFFER_SIZE)];
        while (view.hasRemaining()) {
            int length = Math.min(chunk.length, view.remaining());
            view.get(chunk, 0, length);
            out.write(chunk, 0, length);
            position += length;
        }
    }

    /**
     * 已写出字节数，即下一字节的文件偏移。
     */
    public long position() {
        return position;
    }

    public Path path() {
        return path;
    }

    /**
     * 刷出缓冲并强制落盘。
     *
     * @throws IOException 刷盘失败时抛出
     */
    public void sync() throws IOException {
        ensureOpen();
        out.flush();
        FileChannel channel = fileOutputStream.getChannel();
        channel.force(true);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileWriter 已关闭: " + path);
        }
    }
}
