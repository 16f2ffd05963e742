package com.segmentengine.index;

/**
 * 单个 worker 的内存预算记账器。
 *
 * <p>只被所属 worker 线程访问，不加锁。累计字节数达到预算的瞬间返回 {@link FlushDecision#FLUSH_REQUIRED}，
 * 落盘后由调用方 {@link #reset()} 清零。
 */
public final class MemoryBudgetTracker {
    private final long budgetBytes;
    private long usedBytes;

    public MemoryBudgetTracker(long budgetBytes) {
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException("内存预算必须为正数: " + budgetBytes);
        }
        this.budgetBytes = budgetBytes;
    }

    /**
     * 记录新增占用。
     *
     * @param bytesAdded 新增字节数
     * @return 是否需要落盘
     */
    public FlushDecision record(long bytesAdded) {
        if (bytesAdded < 0) {
            throw new IllegalArgumentException("新增字节数不能为负数: " + bytesAdded);
        }
        usedBytes += bytesAdded;
        return usedBytes >= budgetBytes ? FlushDecision.FLUSH_REQUIRED : FlushDecision.CONTINUE;
    }

    public void reset() {
        usedBytes = 0;
    }

    public long usedBytes() {
        return usedBytes;
    }

    public long budgetBytes() {
        return budgetBytes;
    }
}
