package com.ftindex.memory;

import java.util.Arrays;

/**
 * 固定块大小的内存池，以下标句柄对外分配块。
 *
 * <p>块表容量固定为 {@code maxBlocks}，块一旦分配便常驻在块表中：释放的块进入空闲栈，
 * 后续 {@link #acquire(int)} 优先复用并清零。句柄只在所属内存池内有效，
 * {@link #reset()} 之后全部失效。
 *
 * <p>除整块分配外，还可以用 {@link #allocSlice(int)} 从共享的当前块中切出小切片，
 * 多个切片流交错写入同一块。块按切片引用计数，最后一个切片归还时块回到空闲栈。
 *
 * <p>非线程安全，每个构建分区持有自己的实例。
 */
public final class BlockArena {
    private static final int INITIAL_TABLE_SIZE = 16;

    private final int blockSize;
    private final int maxBlocks;

    private byte[][] blocks = new byte[INITIAL_TABLE_SIZE][];
    private boolean[] live = new boolean[INITIAL_TABLE_SIZE];
    private int allocatedBlocks;
    private int liveBlocks;

    private int[] freeHandles = new int[INITIAL_TABLE_SIZE];
    private int freeCount;

    private int[] sliceRefs = new int[INITIAL_TABLE_SIZE];
    private int sliceHandle = -1;
    private int sliceUpto;

    /**
     * @param blockSize 单块字节数
     * @param maxBlocks 块表容量上限
     */
    public BlockArena(int blockSize, int maxBlocks) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize 必须为正数: " + blockSize);
        }
        if (maxBlocks <= 0) {
            throw new IllegalArgumentException("maxBlocks 必须为正数: " + maxBlocks);
        }
        this.blockSize = blockSize;
        this.maxBlocks = maxBlocks;
    }

    /**
     * 申请一个至少容纳 size 字节的块。
     *
     * @param size 需要的字节数，范围 [1, blockSize]
     * @return 块句柄
     * @throws ArenaExhaustedException 块表已满或底层分配失败
     */
    public int acquire(int size) {
        if (size <= 0 || size > blockSize) {
            throw new IllegalArgumentException("申请大小超出块大小: size=" + size + ", blockSize=" + blockSize);
        }
        if (freeCount > 0) {
            int handle = freeHandles[--freeCount];
            Arrays.fill(blocks[handle], (byte) 0);
            markLive(handle);
            return handle;
        }
        if (allocatedBlocks == maxBlocks) {
            throw new ArenaExhaustedException(blockSize, maxBlocks, null);
        }

        byte[] block;
        try {
            block = new byte[blockSize];
        } catch (OutOfMemoryError error) {
            throw new ArenaExhaustedException(blockSize, maxBlocks, error);
        }
        ensureTableCapacity(allocatedBlocks + 1);
        int handle = allocatedBlocks++;
        blocks[handle] = block;
        markLive(handle);
        return handle;
    }

    /**
     * 归还块，块进入空闲栈等待复用。
     *
     * @throws IllegalStateException 句柄无效或已被归还
     */
    public void release(int handle) {
        checkLive(handle);
        if (sliceRefs[handle] > 0) {
            throw new IllegalStateException("块仍被切片引用: handle=" + handle + ", slices=" + sliceRefs[handle]);
        }
        live[handle] = false;
        liveBlocks--;
        if (freeCount == freeHandles.length) {
            freeHandles = Arrays.copyOf(freeHandles, freeHandles.length * 2);
        }
        freeHandles[freeCount++] = handle;
    }

    /**
     * 从当前切片块切出 size 字节，当前块剩余空间不足时换一块新块。
     *
     * @param size 切片字节数，范围 [1, blockSize]
     * @return 切片地址，高 32 位为块句柄，低 32 位为块内偏移
     * @throws ArenaExhaustedException 需要新块但块表已满
     */
    public long allocSlice(int size) {
        if (size <= 0 || size > blockSize) {
            throw new IllegalArgumentException("切片大小超出块大小: size=" + size + ", blockSize=" + blockSize);
        }
        if (sliceHandle < 0 || blockSize - sliceUpto < size) {
            sliceHandle = acquire(blockSize);
            sliceUpto = 0;
        }
        int offset = sliceUpto;
        sliceUpto += size;
        sliceRefs[sliceHandle]++;
        return ((long) sliceHandle << 32) | offset;
    }

    /**
     * 归还 {@link #allocSlice(int)} 得到的切片，所在块不再被任何切片引用时归还该块。
     *
     * @throws IllegalStateException 切片所在块无效或已无切片引用
     */
    public void releaseSlice(long address) {
        int handle = sliceBlock(address);
        checkLive(handle);
        if (sliceRefs[handle] == 0) {
            throw new IllegalStateException("切片已归还: handle=" + handle + ", offset=" + sliceOffset(address));
        }
        if (--sliceRefs[handle] == 0) {
            if (handle == sliceHandle) {
                sliceHandle = -1;
            }
            release(handle);
        }
    }

    public static int sliceBlock(long address) {
        return (int) (address >>> 32);
    }

    public static int sliceOffset(long address) {
        return (int) address;
    }

    /**
     * 访问存活块的底层数组。
     */
    public byte[] block(int handle) {
        checkLive(handle);
        return blocks[handle];
    }

    /**
     * 使全部句柄失效，所有已分配块回到空闲栈。
     */
    public void reset() {
        if (freeHandles.length < allocatedBlocks) {
            freeHandles = new int[allocatedBlocks];
        }
        freeCount = 0;
        for (int handle = allocatedBlocks - 1; handle >= 0; handle--) {
            live[handle] = false;
            sliceRefs[handle] = 0;
            freeHandles[freeCount++] = handle;
        }
        liveBlocks = 0;
        sliceHandle = -1;
    }

    public int blockSize() {
        return blockSize;
    }

    public int maxBlocks() {
        return maxBlocks;
    }

    public int liveBlocks() {
        return liveBlocks;
    }

    public int freeBlocks() {
        return freeCount;
    }

    /**
     * 已从 JVM 申请的字节数（含空闲块）。
     */
    public long bytesUsed() {
        return (long) allocatedBlocks * blockSize;
    }

    private void markLive(int handle) {
        live[handle] = true;
        liveBlocks++;
    }

    private void checkLive(int handle) {
        if (handle < 0 || handle >= allocatedBlocks || !live[handle]) {
            throw new IllegalStateException("无效的块句柄: " + handle);
        }
    }

    private void ensureTableCapacity(int required) {
        if (required <= blocks.length) {
            return;
        }
        int newSize = (int) Math.min((long) maxBlocks, Math.max(required, (long) blocks.length * 2));
        blocks = Arrays.copyOf(blocks, newSize);
        live = Arrays.copyOf(live, newSize);
        sliceRefs = Arrays.copyOf(sliceRefs, newSize);
    }
}
