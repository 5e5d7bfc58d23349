package com.ftindex.memory;

import com.ftindex.config.IndexConfig;

/**
 * 单个构建分区私有的一对内存池：小块切片池承载文档流，可回收缓冲池承载位置流。
 */
public record PostingArenas(BlockArena byteSlicePool, BlockArena bufferPool) {

    public PostingArenas {
        if (byteSlicePool == null || bufferPool == null) {
            throw new IllegalArgumentException("内存池不能为null");
        }
    }

    /**
     * 按配置创建一对新内存池。
     */
    public static PostingArenas create(IndexConfig config) {
        return new PostingArenas(
            new BlockArena(config.getByteSliceBlockSize(), config.getByteSliceMaxBlocks()),
            new BlockArena(config.getBufferBlockSize(), config.getBufferMaxBlocks()));
    }

    /**
     * 两个池合计从 JVM 申请的字节数。
     */
    public long bytesUsed() {
        return byteSlicePool.bytesUsed() + bufferPool.bytesUsed();
    }
}
