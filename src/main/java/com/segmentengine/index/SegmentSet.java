package com.segmentengine.index;

import com.segmentengine.storage.SegmentMeta;

import java.util.List;

/**
 * 某一版本的存活段集合快照，不可变。
 *
 * @param version 版本号，每次成功变更加一
 * @param segments 按创建序号排列的存活段
 */
public record SegmentSet(long version, List<SegmentMeta> segments) {
    public static final SegmentSet EMPTY = new SegmentSet(0L, List.of());

    public SegmentSet {
        segments = List.copyOf(segments);
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public long docCount() {
        return segments.stream().mapToLong(SegmentMeta::docCount).sum();
    }

    public long sizeBytes() {
        return segments.stream().mapToLong(SegmentMeta::sizeBytes).sum();
    }

    public boolean contains(String segmentId) {
        return segments.stream().anyMatch(segment -> segment.segmentId().equals(segmentId));
    }
}
