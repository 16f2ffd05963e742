package com.segmentengine.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 段元数据：不可变段的标识、创建序号与统计信息。
 *
 * @param segmentId 段唯一标识，也是段目录名的后缀
 * @param sequence 索引内单调递增的创建序号，合并时序号小者视为更旧
 * @param docCount 段内文档数
 * @param termCount 段内词项数
 * @param sizeBytes 段数据文件总字节数
 * @param createTime 创建时间
 */
public record SegmentMeta(
    String segmentId,
    long sequence,
    int docCount,
    int termCount,
    long sizeBytes,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public SegmentMeta {
        if (segmentId == null || segmentId.isBlank()) {
            throw new IllegalArgumentException("segmentId不能为空");
        }
        if (sequence < 0 || docCount < 0 || termCount < 0 || sizeBytes < 0) {
            throw new IllegalArgumentException("段统计值不能为负数: " + segmentId);
        }
    }

    /**
     * 将当前段元数据写入指定 JSON 文件。
     *
     * @param file 元数据文件
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
     * @param file 元数据文件
     * @return 反序列化后的段元数据
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
