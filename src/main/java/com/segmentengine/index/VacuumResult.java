package com.segmentengine.index;

/**
 * 一次维护的结果。
 *
 * @param segments 维护结束时的段集合
 * @param merged 本次是否执行了合并
 * @param reclaimedSegments 回收的段目录数（待删除段与孤儿段）
 */
public record VacuumResult(SegmentSet segments, boolean merged, int reclaimedSegments) {
}
