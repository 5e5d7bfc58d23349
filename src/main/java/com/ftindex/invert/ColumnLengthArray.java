package com.ftindex.invert;

import java.util.Arrays;
import java.util.BitSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 按文档ID索引的列长度（每文档词元数）数组，读写锁保护。
 *
 * <p>多个构建分区并发写入各自不相交的区间，写入时持有独占锁；下游读取持有共享锁。
 * 由一个所有者创建，再以引用交给各写入方。
 */
public final class ColumnLengthArray {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final BitSet written = new BitSet();
    private int[] lengths = new int[0];
    private int size;

    /**
     * 把一段长度写到 [offset, offset + values.length)。
     */
    public void writeRange(int offset, int[] values) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset 不能为负数: " + offset);
        }
        if (values == null) {
            throw new IllegalArgumentException("values 不能为null");
        }
        int end = Math.addExact(offset, values.length);
        lock.writeLock().lock();
        try {
            if (end > lengths.length) {
                lengths = Arrays.copyOf(lengths, Math.max(end, lengths.length * 2));
            }
            System.arraycopy(values, 0, lengths, offset, values.length);
            written.set(offset, end);
            size = Math.max(size, end);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int read(int docId) {
        lock.readLock().lock();
        try {
            if (docId < 0 || docId >= size) {
                throw new IndexOutOfBoundsException("docId 越界: " + docId + ", size=" + size);
            }
            return lengths[docId];
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 复制 [offset, offset + count) 区间。
     */
    public int[] snapshot(int offset, int count) {
        lock.readLock().lock();
        try {
            if (offset < 0 || count < 0 || offset + count > size) {
                throw new IndexOutOfBoundsException("区间越界: offset=" + offset + ", count=" + count + ", size=" + size);
            }
            return Arrays.copyOfRange(lengths, offset, offset + count);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * [offset, offset + count) 中的每个文档是否都已被 {@link #writeRange(int, int[])} 写入过。
     */
    public boolean isWritten(int offset, int count) {
        if (offset < 0 || count < 0) {
            throw new IllegalArgumentException("区间非法: offset=" + offset + ", count=" + count);
        }
        lock.readLock().lock();
        try {
            return count == 0 || written.nextClearBit(offset) >= offset + count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }
}
