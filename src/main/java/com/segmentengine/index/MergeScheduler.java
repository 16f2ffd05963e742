package com.segmentengine.index;

import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 合并调度器。
 *
 * <p>每次调用最多执行一轮合并：由 {@link MergePolicy} 选出源段，合并为一个新段后原子替换。
 * 合并失败时存活集合不变，已写出的合并段被删除，可在下次触发时重试。
 * 同一索引上的合并互斥执行。
 */
public final class MergeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(MergeScheduler.class);

    private final MergePolicy policy;
    private final SegmentMerger merger;
    private final ReentrantLock mergeLock = new ReentrantLock();
    private final AtomicLong invocationCount = new AtomicLong();
    private final AtomicLong mergeCount = new AtomicLong();

    public MergeScheduler(SegmentStore store, MergePolicy policy) {
        this.policy = policy;
        this.merger = new SegmentMerger(store);
    }

    /**
     * 段数超过目标时执行一轮合并，否则什么都不做。
     *
     * @param liveSet 存活段集合
     * @param targetSegmentCount 目标段数
     * @return 调用结束时的快照
     * @throws MergeFailureException 合并未能完成，集合保持不变
     */
    public SegmentSet maybeMerge(LiveSegmentSet liveSet, int targetSegmentCount) throws MergeFailureException {
        mergeLock.lock();
        try {
            invocationCount.incrementAndGet();
            SegmentSet snapshot = liveSet.snapshot();
            List<SegmentMeta> sources = policy.findMerge(snapshot.segments(), targetSegmentCount);
            if (sources.size() < 2) {
                return snapshot;
            }

            long startNanos = System.nanoTime();
            SegmentMeta merged = merger.merge(sources, liveSet.nextSequence());
            SegmentSet next;
            try {
                next = liveSet.replace(sources, merged);
            } catch (MergeFailureException exception) {
                merger.discard(merged, exception);
                throw exception;
            } catch (IOException exception) {
                MergeFailureException failure = new MergeFailureException("发布合并结果失败: " + merged.segmentId(), exception);
                merger.discard(merged, failure);
                throw failure;
            }
            mergeCount.incrementAndGet();
            logger.info("合并完成: sources={}, docs={}, segment={}, segments {} -> {}, elapsed={}ms",
                sources.size(), merged.docCount(), merged.segmentId(), snapshot.size(), next.size(),
                (System.nanoTime() - startNanos) / 1_000_000);
            return next;
        } finally {
            mergeLock.unlock();
        }
    }

    /**
     * {@link #maybeMerge} 被调用的次数。
     */
    public long invocationCount() {
        return invocationCount.get();
    }

    /**
     * 实际完成的合并次数。
     */
    public long mergeCount() {
        return mergeCount.get();
    }
}
