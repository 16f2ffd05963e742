package com.segmentengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.IntSupplier;

/**
 * 索引级合并策略选项，随索引持久化，可在任意时刻修改。
 *
 * @param targetSegmentCount 期望的稳态段数量
 * @param mergeOnInsert 语句结束前是否同步合并
 */
public record IndexOptions(int targetSegmentCount, boolean mergeOnInsert) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public IndexOptions {
        ConfigurationException.requirePositive("targetSegmentCount", targetSegmentCount);
    }

    /**
     * 默认选项：目标段数取当前主机可用处理器数。
     *
     * @param availableProcessors 主机并行度来源
     * @return 默认选项
     */
    public static IndexOptions defaults(IntSupplier availableProcessors) {
        return new IndexOptions(Math.max(availableProcessors.getAsInt(), 1), Constants.DEFAULT_MERGE_ON_INSERT);
    }

    /**
     * 合并修改项，未设置的项保留原值；目标段数显式置 0 时按当前主机处理器数重新取默认值。
     *
     * @param targetSegmentCount 新目标段数，null 表示不修改
     * @param mergeOnInsert 新的插入即合并开关，null 表示不修改
     * @param availableProcessors 主机并行度来源
     * @return 新选项
     */
    public IndexOptions alter(Integer targetSegmentCount, Boolean mergeOnInsert, IntSupplier availableProcessors) {
        int nextTarget = this.targetSegmentCount;
        if (targetSegmentCount != null) {
            ConfigurationException.requireNonNegative("targetSegmentCount", targetSegmentCount);
            nextTarget = targetSegmentCount == 0
                ? Math.max(availableProcessors.getAsInt(), 1)
                : targetSegmentCount;
        }
        boolean nextMergeOnInsert = mergeOnInsert == null ? this.mergeOnInsert : mergeOnInsert;
        return new IndexOptions(nextTarget, nextMergeOnInsert);
    }

    /**
     * 将选项写入 JSON 文件（先写临时文件再原子替换）。
     *
     * @param file 目标文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        Path tempFile = file.resolveSibling(file.getFileName() + Constants.TEMP_SUFFIX);
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), this);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException exception) {
            Files.deleteIfExists(tempFile);
            throw new IOException("写入索引选项失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从 JSON 文件读取选项。
     *
     * @param file 选项文件
     * @return 选项
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexOptions readFrom(Path file) throws IOException {
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), IndexOptions.class);
        } catch (IOException exception) {
            throw new IOException("读取索引选项失败: " + file.toAbsolutePath(), exception);
        }
    }
}
