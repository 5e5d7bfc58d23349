package com.ftindex.config;

/**
 * 全局常量定义
 *
 * 包含段文件魔数、倒排编码参数、内存池参数与哨兵值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 段文件魔数 ====================
    /** 词典文件魔数 "FTDI" */
    public static final int DICT_MAGIC = 0x46544449;
    /** 倒排文件魔数 "FTPS" */
    public static final int POSTINGS_MAGIC = 0x46545053;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 段文件后缀 ====================
    public static final String DICT_SUFFIX = ".dic";
    public static final String POSTINGS_SUFFIX = ".pst";
    /** 列长度文件后缀，读写双方必须一致 */
    public static final String LENGTH_SUFFIX = ".len";
    public static final String META_SUFFIX = ".meta.json";

    // ==================== 倒排参数 ====================
    /** 跳表间隔，每128个文档记录一个skip point */
    public static final int SKIP_INTERVAL = 128;

    // ==================== 哨兵值 ====================
    /** 迭代器耗尽时返回的无效文档ID */
    public static final long INVALID_ROW_ID = -1L;
    /** 当前文档位置耗尽时返回的无效位置 */
    public static final int INVALID_POSITION = -1;

    // ==================== 内存池参数 ====================
    /** 小块切片池块大小（字节），承载文档流 */
    public static final int BYTE_SLICE_BLOCK_SIZE = 256;
    /** 小块切片池最大块数 */
    public static final int BYTE_SLICE_MAX_BLOCKS = 1 << 18;
    /** 可回收缓冲池块大小（字节），承载位置流 */
    public static final int BUFFER_BLOCK_SIZE = 1024;
    /** 可回收缓冲池最大块数 */
    public static final int BUFFER_MAX_BLOCKS = 1 << 16;

    // ==================== 构建参数 ====================
    /** 分区数安全上限 */
    public static final int MAX_PARTITIONS = 64;
    /** 默认构建分区数 */
    public static final int DEFAULT_PARTITIONS = Math.min(Runtime.getRuntime().availableProcessors(), MAX_PARTITIONS);
    /** 默认分词器名称 */
    public static final String DEFAULT_ANALYZER = "standard";
}
