package com.segmentengine.config;

import java.util.function.IntSupplier;

/**
 * 写入资源档位：建索引、单条语句、维护（vacuum）三种场景各自读取不同的并行度与内存设置。
 */
public enum WriterResources {
    /** 全量建索引：读取建索引设置，构建后总是合并 */
    CREATE_INDEX("create-index"),
    /** 语句级增量：读取语句设置，是否合并由索引选项决定 */
    STATEMENT("statement"),
    /** 维护：读取语句设置，总是合并 */
    VACUUM("vacuum");

    private final String label;

    WriterResources(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 本档位读取的并行度设置（未解析，0 表示自动）。
     */
    public int requestedParallelism(EngineConfig config) {
        return this == CREATE_INDEX ? config.getCreateIndexParallelism() : config.getStatementParallelism();
    }

    /**
     * 本档位读取的单 worker 内存预算设置（MB，未解析，0 表示推导）。
     */
    public int requestedMemoryBudgetMb(EngineConfig config) {
        return this == CREATE_INDEX ? config.getCreateIndexMemoryBudgetMb() : config.getStatementMemoryBudgetMb();
    }

    /**
     * 作业提交后是否执行合并。
     *
     * @param options 当前索引选项
     * @return 建索引与维护总是合并，语句按 mergeOnInsert 决定
     */
    public boolean doMerging(IndexOptions options) {
        return switch (this) {
            case CREATE_INDEX, VACUUM -> true;
            case STATEMENT -> options.mergeOnInsert();
        };
    }

    /**
     * 解析并行度：0 表示自动，取主机可用处理器数。
     *
     * @param requested 请求值
     * @param availableProcessors 主机并行度来源
     * @return 不小于 1 的并行度
     */
    public static int resolveParallelism(int requested, IntSupplier availableProcessors) {
        ConfigurationException.requireNonNegative("parallelism", requested);
        if (requested > 0) {
            return requested;
        }
        return Math.max(availableProcessors.getAsInt(), 1);
    }

    /**
     * 解析单 worker 内存预算：未设置时取 maintenance_work_mem / max(parallelism, 1)。
     *
     * @param requestedMb 请求值（MB），0 表示推导
     * @param maintenanceWorkMemMb 维护内存（MB）
     * @param parallelism 已解析的并行度
     * @return 预算字节数
     */
    public static long resolveMemoryBudgetBytes(int requestedMb, int maintenanceWorkMemMb, int parallelism) {
        ConfigurationException.requireNonNegative("memoryBudgetMb", requestedMb);
        if (requestedMb > 0) {
            return requestedMb * Constants.BYTES_PER_MB;
        }
        ConfigurationException.requirePositive("maintenanceWorkMemMb", maintenanceWorkMemMb);
        long derivedMb = Math.max(maintenanceWorkMemMb / Math.max(parallelism, 1), Constants.MIN_DERIVED_MEMORY_BUDGET_MB);
        return derivedMb * Constants.BYTES_PER_MB;
    }
}
