package com.segmentengine.index;

import com.segmentengine.config.WriterResources;
import com.segmentengine.storage.SegmentMeta;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次并行构建作业：一次全量建索引、一条语句或一次维护。
 *
 * <p>并行度与单 worker 预算在作业开始时解析并固定。取消是协作式的，worker 在文档之间检查标志。
 */
public final class BuildJob {
    private final WriterResources kind;
    private final int parallelism;
    private final long memoryBudgetBytes;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final Queue<SegmentMeta> produced = new ConcurrentLinkedQueue<>();
    private volatile int workerCount;

    BuildJob(WriterResources kind, int parallelism, long memoryBudgetBytes) {
        this.kind = kind;
        this.parallelism = parallelism;
        this.memoryBudgetBytes = memoryBudgetBytes;
    }

    public WriterResources kind() {
        return kind;
    }

    /**
     * 作业开始时解析出的并行度。
     */
    public int parallelism() {
        return parallelism;
    }

    public long memoryBudgetBytes() {
        return memoryBudgetBytes;
    }

    /**
     * 实际启动的 worker 数，不超过行数。
     */
    public int workerCount() {
        return workerCount;
    }

    void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    /**
     * 请求取消。正在运行的 worker 在处理下一行之前停止，作业产出的段全部丢弃。
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 记录 worker 失败并取消其余 worker，只保留第一个失败原因。
     */
    void fail(Throwable cause) {
        if (!failure.compareAndSet(null, cause)) {
            Throwable first = failure.get();
            if (first != cause) {
                first.addSuppressed(cause);
            }
        }
        cancelled.set(true);
    }

    Throwable failure() {
        return failure.get();
    }

    void addSegment(SegmentMeta segment) {
        produced.add(segment);
    }

    /**
     * 作业已产出的段，按创建序号排序。
     */
    public List<SegmentMeta> segments() {
        List<SegmentMeta> segments = new ArrayList<>(produced);
        segments.sort(Comparator.comparingLong(SegmentMeta::sequence));
        return segments;
    }
}
