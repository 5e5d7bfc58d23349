package com.ftindex.memory;

/**
 * 内存池耗尽：所有块均被占用且无法再分配新块。对当前构建过程是致命错误。
 */
public class ArenaExhaustedException extends RuntimeException {
    private final int blockSize;
    private final int maxBlocks;

    public ArenaExhaustedException(int blockSize, int maxBlocks, Throwable cause) {
        super("内存池已耗尽: blockSize=" + blockSize + ", maxBlocks=" + maxBlocks, cause);
        this.blockSize = blockSize;
        this.maxBlocks = maxBlocks;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public int getMaxBlocks() {
        return maxBlocks;
    }
}
