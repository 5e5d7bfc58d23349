package com.ftindex.invert;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 列长度文件：按文档ID定长存放 int32，docId 的值位于偏移 docId * 4。
 *
 * <p>打开时截断已存在的文件，每次构建从空文件开始写。
 * 多个更新任务可以并发写入不相交的区间，同一时刻登记的区间不得重叠。
 */
public final class ColumnLengthFileHandler implements Closeable {
    private final Path path;
    private final RandomAccessFile file;
    private final List<long[]> liveRanges = new ArrayList<>();

    public ColumnLengthFileHandler(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("列长度文件路径不能为null");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.path = path;
        this.file = new RandomAccessFile(path.toFile(), "rw");
        try {
            file.setLength(0L);
        } catch (IOException exception) {
            try {
                file.close();
            } catch (IOException closeException) {
                exception.addSuppressed(closeException);
            }
            throw new IOException("截断列长度文件失败: " + path, exception);
        }
    }

    /**
     * 把 lengths 写到 [startDocId, startDocId + lengths.length)。
     */
    public synchronized void writeRange(long startDocId, int[] lengths) throws IOException {
        if (startDocId < 0) {
            throw new IllegalArgumentException("startDocId 不能为负数: " + startDocId);
        }
        ByteBuffer buffer = ByteBuffer.allocate(lengths.length * Integer.BYTES);
        for (int length : lengths) {
            buffer.putInt(length);
        }
        file.seek(startDocId * Integer.BYTES);
        file.write(buffer.array());
    }

    /**
     * 读取全部已写入的长度。
     */
    public synchronized int[] readAll() throws IOException {
        long fileLength = file.length();
        if (fileLength % Integer.BYTES != 0) {
            throw new IOException("列长度文件长度非法: " + path + ", length=" + fileLength);
        }
        byte[] bytes = new byte[Math.toIntExact(fileLength)];
        file.seek(0L);
        file.readFully(bytes);
        return decode(bytes);
    }

    /**
     * 已写入的文档数。
     */
    public synchronized long size() throws IOException {
        return file.length() / Integer.BYTES;
    }

    public synchronized void sync() throws IOException {
        file.getFD().sync();
    }

    public Path path() {
        return path;
    }

    synchronized void register(long startRowId, long rowCount) {
        long end = startRowId + rowCount;
        for (long[] range : liveRanges) {
            if (startRowId < range[1] && range[0] < end) {
                throw new IllegalStateException("列长度更新区间重叠: [" + startRowId + ", " + end
                    + ") 与 [" + range[0] + ", " + range[1] + ")");
            }
        }
        liveRanges.add(new long[] {startRowId, end});
    }

    synchronized void unregister(long startRowId) {
        liveRanges.removeIf(range -> range[0] == startRowId);
    }

    @Override
    public synchronized void close() throws IOException {
        file.close();
    }

    /**
     * 只读方式读取已落盘的列长度文件。
     */
    public static int[] readFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("列长度文件不存在: " + path);
        }
        byte[] bytes = Files.readAllBytes(path);
        if (bytes.length % Integer.BYTES != 0) {
            throw new IOException("列长度文件长度非法: " + path + ", length=" + bytes.length);
        }
        return decode(bytes);
    }

    private static int[] decode(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int[] lengths = new int[bytes.length / Integer.BYTES];
        for (int index = 0; index < lengths.length; index++) {
            lengths[index] = buffer.getInt();
        }
        return lengths;
    }
}
