package com.segmentengine.index;

import com.segmentengine.storage.SegmentMeta;

/**
 * 接收 worker 落盘产生的段。实现必须线程安全，多个 worker 会并发调用。
 */
@FunctionalInterface
public interface SegmentSink {

    void accept(SegmentMeta segment);
}
