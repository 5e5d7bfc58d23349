package com.ftindex.segment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 段元数据，描述段的行区间、倒排格式与基础统计。
 */
public record SegmentMeta(
    String segmentName,
    long baseRowId,
    int docCount,
    int termCount,
    int optionFlags,
    int skipInterval,
    String analyzer,
    long sizeBytes,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 将当前段元数据写入指定 JSON 文件。
     *
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
        } catch (IOException exception) {
            throw new IOException("写入段元数据失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取段元数据。
     *
     * @throws IOException 读取或解析失败时抛出
     */
    public static SegmentMeta readFrom(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), SegmentMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取段元数据失败: " + file.toAbsolutePath(), exception);
        }
    }
}
