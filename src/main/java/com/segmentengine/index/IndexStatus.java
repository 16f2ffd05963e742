package com.segmentengine.index;

import com.segmentengine.config.IndexOptions;

/**
 * 索引状态概要。
 *
 * @param version 段集合版本
 * @param segmentCount 存活段数
 * @param docCount 文档总数
 * @param sizeBytes 存活段字节数
 * @param pendingDeletes 等待回收的段数
 * @param options 当前索引选项
 */
public record IndexStatus(
    long version,
    int segmentCount,
    long docCount,
    long sizeBytes,
    int pendingDeletes,
    IndexOptions options
) {
}
