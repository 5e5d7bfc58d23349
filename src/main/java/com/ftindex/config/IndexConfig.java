package com.ftindex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 索引构建运行时配置
 *
 * 支持从 JSON 配置文件或 CLI 参数注入，覆盖 Constants 默认值
 */
public class IndexConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private String analyzer = Constants.DEFAULT_ANALYZER;
    private int partitions = Constants.DEFAULT_PARTITIONS;
    private int skipInterval = Constants.SKIP_INTERVAL;
    private int byteSliceBlockSize = Constants.BYTE_SLICE_BLOCK_SIZE;
    private int byteSliceMaxBlocks = Constants.BYTE_SLICE_MAX_BLOCKS;
    private int bufferBlockSize = Constants.BUFFER_BLOCK_SIZE;
    private int bufferMaxBlocks = Constants.BUFFER_MAX_BLOCKS;

    public String getAnalyzer() {
        return analyzer;
    }

    public void setAnalyzer(String analyzer) {
        this.analyzer = analyzer;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }

    public int getSkipInterval() {
        return skipInterval;
    }

    public void setSkipInterval(int skipInterval) {
        this.skipInterval = skipInterval;
    }

    public int getByteSliceBlockSize() {
        return byteSliceBlockSize;
    }

    public void setByteSliceBlockSize(int byteSliceBlockSize) {
        this.byteSliceBlockSize = byteSliceBlockSize;
    }

    public int getByteSliceMaxBlocks() {
        return byteSliceMaxBlocks;
    }

    public void setByteSliceMaxBlocks(int byteSliceMaxBlocks) {
        this.byteSliceMaxBlocks = byteSliceMaxBlocks;
    }

    public int getBufferBlockSize() {
        return bufferBlockSize;
    }

    public void setBufferBlockSize(int bufferBlockSize) {
        this.bufferBlockSize = bufferBlockSize;
    }

    public int getBufferMaxBlocks() {
        return bufferMaxBlocks;
    }

    public void setBufferMaxBlocks(int bufferMaxBlocks) {
        this.bufferMaxBlocks = bufferMaxBlocks;
    }

    /**
     * 校验配置取值范围，非法时抛出 IllegalArgumentException。
     */
    public IndexConfig validate() {
        if (analyzer == null || analyzer.isBlank()) {
            throw new IllegalArgumentException("analyzer 不能为空");
        }
        if (partitions <= 0 || partitions > Constants.MAX_PARTITIONS) {
            throw new IllegalArgumentException("partitions 超出范围 [1, " + Constants.MAX_PARTITIONS + "]: " + partitions);
        }
        if (skipInterval <= 0) {
            throw new IllegalArgumentException("skipInterval 必须为正数: " + skipInterval);
        }
        if (byteSliceBlockSize <= 0 || bufferBlockSize <= 0) {
            throw new IllegalArgumentException("块大小必须为正数");
        }
        if (byteSliceMaxBlocks <= 0 || bufferMaxBlocks <= 0) {
            throw new IllegalArgumentException("最大块数必须为正数");
        }
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }

    /**
     * 从 JSON 文件读取配置，未出现的字段保持默认值。
     *
     * @param file 配置文件
     * @return 校验通过的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(Files.readAllBytes(file), IndexConfig.class).validate();
        } catch (IOException exception) {
            throw new IOException("读取索引配置失败: " + file.toAbsolutePath(), exception);
        }
    }
}
