package com.segmentengine.index;

import com.segmentengine.storage.SegmentMeta;

import java.util.List;

/**
 * 合并策略：决定一次合并选哪些段。
 */
public interface MergePolicy {

    /**
     * 选出一次合并的源段。
     *
     * @param segments 当前存活段
     * @param targetSegmentCount 目标段数
     * @return 待合并的段，少于两个表示无需合并
     */
    List<SegmentMeta> findMerge(List<SegmentMeta> segments, int targetSegmentCount);
}
