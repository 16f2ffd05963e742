package com.segmentengine.index;

import com.segmentengine.config.ConfigurationException;
import com.segmentengine.storage.SegmentMeta;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 最小优先合并策略。
 *
 * <p>段数不超过目标时不合并；否则按文档数、字节数、创建序号升序排列，
 * 取最小的 {@code count - target + 1} 个合并为一个，一次合并后段数恰好等于目标。
 * 大小相同时序号小（更旧）的段优先。
 */
public final class SmallestFirstMergePolicy implements MergePolicy {
    static final Comparator<SegmentMeta> SMALLEST_OLDEST_FIRST = Comparator
        .comparingInt(SegmentMeta::docCount)
        .thenComparingLong(SegmentMeta::sizeBytes)
        .thenComparingLong(SegmentMeta::sequence);

    @Override
    public List<SegmentMeta> findMerge(List<SegmentMeta> segments, int targetSegmentCount) {
        ConfigurationException.requirePositive("targetSegmentCount", targetSegmentCount);
        if (segments.size() <= targetSegmentCount) {
            return List.of();
        }
        List<SegmentMeta> ordered = new ArrayList<>(segments);
        ordered.sort(SMALLEST_OLDEST_FIRST);
        int mergeCount = segments.size() - targetSegmentCount + 1;
        return List.copyOf(ordered.subList(0, mergeCount));
    }
}
