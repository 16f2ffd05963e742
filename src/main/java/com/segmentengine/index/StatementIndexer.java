package com.segmentengine.index;

import com.segmentengine.config.IndexOptions;
import com.segmentengine.config.WriterResources;
import com.segmentengine.document.Row;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;

/**
 * 语句级增量索引：每条变更语句一个构建作业，使用语句级并行度与预算，
 * 产出的段原子追加到存活集合，不触碰已有段。
 *
 * <p>索引开启 mergeOnInsert 时，语句结束前同步执行一次合并。
 */
public final class StatementIndexer {
    private static final Logger logger = LoggerFactory.getLogger(StatementIndexer.class);

    private final ParallelBuildCoordinator coordinator;
    private final SegmentStore store;
    private final LiveSegmentSet liveSet;
    private final MergeScheduler mergeScheduler;
    private final Supplier<IndexOptions> options;

    /**
     * @param coordinator 构建协调器，每条语句创建独立作业与线程池
     * @param store 段存储，追加失败时用于丢弃本语句的段
     * @param liveSet 存活段集合
     * @param mergeScheduler 合并调度器
     * @param options 当前索引选项，每次合并决策前重新读取
     */
    public StatementIndexer(ParallelBuildCoordinator coordinator, SegmentStore store, LiveSegmentSet liveSet,
                            MergeScheduler mergeScheduler, Supplier<IndexOptions> options) {
        this.coordinator = coordinator;
        this.store = store;
        this.liveSet = liveSet;
        this.mergeScheduler = mergeScheduler;
        this.options = options;
    }

    /**
     * 索引一条语句影响的行。
     *
     * @param affectedRows 受影响的行
     * @param parallelism 语句级并行度，0 表示自动
     * @param memoryBudgetMb 语句级单 worker 预算（MB），0 表示推导
     * @return 本语句新增的段
     * @throws IOException 构建或追加失败，语句失败且已有段不受影响
     */
    public List<SegmentMeta> indexStatement(List<Row> affectedRows, int parallelism, int memoryBudgetMb) throws IOException {
        BuildJob job = coordinator.prepare(WriterResources.STATEMENT, parallelism, memoryBudgetMb);
        List<SegmentMeta> delta = coordinator.execute(job, affectedRows);
        if (delta.isEmpty()) {
            return delta;
        }
        try {
            liveSet.append(delta);
        } catch (IOException | RuntimeException exception) {
            for (SegmentMeta segment : delta) {
                try {
                    store.delete(segment.segmentId());
                } catch (IOException cleanupException) {
                    exception.addSuppressed(cleanupException);
                }
            }
            throw exception;
        }

        IndexOptions current = options.get();
        if (WriterResources.STATEMENT.doMerging(current)) {
            try {
                mergeScheduler.maybeMerge(liveSet, current.targetSegmentCount());
            } catch (MergeFailureException exception) {
                logger.warn("插入后合并失败，留待下次合并: {}", exception.getMessage(), exception);
            }
        }
        return delta;
    }
}
