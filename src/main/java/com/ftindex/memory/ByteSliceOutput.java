package com.ftindex.memory;

import java.io.OutputStream;
import java.util.Arrays;

/**
 * 基于 {@link BlockArena} 共享切片的可增长字节流。
 *
 * <p>首个切片只有几个字节，写满后按级别申请更大的切片，最大不超过块大小。
 * 切片从内存池的当前块中切出，许多词项的流共用同一块。
 * {@link #release()} 把全部切片还给内存池，之后不可再用。
 */
public final class ByteSliceOutput extends OutputStream {
    /** 各级切片大小，最后一级重复使用 */
    static final int[] LEVEL_SIZES = {5, 14, 20, 30, 40, 40, 80, 80, 120, 200};

    private final BlockArena arena;

    private long[] slices = new long[2];
    private int[] sliceLengths = new int[2];
    private int sliceCount;
    private int level;

    private byte[] current;
    private int currentOffset;
    private int currentLength;
    private int upto;
    private long length;
    private boolean released;

    public ByteSliceOutput(BlockArena arena) {
        if (arena == null) {
            throw new IllegalArgumentException("内存池不能为null");
        }
        this.arena = arena;
    }

    @Override
    public void write(int b) {
        ensureNotReleased();
        if (current == null || upto == currentLength) {
            nextSlice();
        }
        current[currentOffset + upto++] = (byte) b;
        length++;
    }

    @Override
    public void write(byte[] bytes, int offset, int len) {
        ensureNotReleased();
        while (len > 0) {
            if (current == null || upto == currentLength) {
                nextSlice();
            }
            int chunk = Math.min(len, currentLength - upto);
            System.arraycopy(bytes, offset, current, currentOffset + upto, chunk);
            upto += chunk;
            offset += chunk;
            len -= chunk;
            length += chunk;
        }
    }

    /**
     * 已写入字节数，同时也是下一字节的流内偏移。
     */
    public long length() {
        return length;
    }

    /**
     * 复制出全部已写入字节。
     */
    public byte[] toByteArray() {
        ensureNotReleased();
        if (length > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("切片流过大，无法复制: length=" + length);
        }
        byte[] result = new byte[(int) length];
        int copied = 0;
        for (int index = 0; index < sliceCount && copied < result.length; index++) {
            int chunk = Math.min(sliceLengths[index], result.length - copied);
            long address = slices[index];
            System.arraycopy(arena.block(BlockArena.sliceBlock(address)), BlockArena.sliceOffset(address),
                result, copied, chunk);
            copied += chunk;
        }
        return result;
    }

    /**
     * 创建从流起点读取的输入流，只能看到创建时已写入的字节。
     */
    public ByteSliceInput newInput() {
        ensureNotReleased();
        return new ByteSliceInput(this, length);
    }

    /**
     * 把全部切片归还给内存池。
     */
    public void release() {
        if (released) {
            return;
        }
        for (int index = 0; index < sliceCount; index++) {
            arena.releaseSlice(slices[index]);
        }
        sliceCount = 0;
        current = null;
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    int sliceCount() {
        return sliceCount;
    }

    int sliceLength(int index) {
        return sliceLengths[index];
    }

    byte readByte(int sliceIndex, int offsetInSlice) {
        ensureNotReleased();
        long address = slices[sliceIndex];
        return arena.block(BlockArena.sliceBlock(address))[BlockArena.sliceOffset(address) + offsetInSlice];
    }

    private void nextSlice() {
        int size = Math.min(LEVEL_SIZES[level], arena.blockSize());
        long address = arena.allocSlice(size);
        if (level < LEVEL_SIZES.length - 1) {
            level++;
        }
        if (sliceCount == slices.length) {
            slices = Arrays.copyOf(slices, sliceCount * 2);
            sliceLengths = Arrays.copyOf(sliceLengths, sliceCount * 2);
        }
        slices[sliceCount] = address;
        sliceLengths[sliceCount] = size;
        sliceCount++;
        current = arena.block(BlockArena.sliceBlock(address));
        currentOffset = BlockArena.sliceOffset(address);
        currentLength = size;
        upto = 0;
    }

    private void ensureNotReleased() {
        if (released) {
            throw new IllegalStateException("ByteSliceOutput 已释放");
        }
    }
}
