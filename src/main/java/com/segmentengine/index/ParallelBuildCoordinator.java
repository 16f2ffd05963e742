package com.segmentengine.index;

import com.segmentengine.config.WriterResources;
import com.segmentengine.document.Row;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import com.segmentengine.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * 并行构建协调器：按位置把行切成连续分片，每个分片交给独立 worker 上的 {@link SegmentBuilder}，
 * 等待全部 worker 结束后汇总产出的段。
 *
 * <p>作业是全有或全无的：任一 worker 失败或作业被取消时，本作业写出的所有段都会被删除。
 */
public final class ParallelBuildCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ParallelBuildCoordinator.class);

    private final SegmentStore store;
    private final Tokenizer tokenizer;
    private final LongSupplier sequenceSource;
    private final IntSupplier availableProcessors;
    private final int maintenanceWorkMemMb;
    private final ProgressReporter.ProgressListener progressListener;

    /**
     * @param store 段存储
     * @param tokenizer 分词器，被所有 worker 共享
     * @param sequenceSource 段创建序号来源，必须线程安全
     * @param availableProcessors 主机并行度来源，自动并行度时每个作业只读取一次
     * @param maintenanceWorkMemMb 推导预算使用的维护内存
     * @param progressListener 建索引进度接收方，为 null 时不汇报进度
     */
    public ParallelBuildCoordinator(SegmentStore store, Tokenizer tokenizer, LongSupplier sequenceSource,
                                    IntSupplier availableProcessors, int maintenanceWorkMemMb,
                                    ProgressReporter.ProgressListener progressListener) {
        this.store = store;
        this.tokenizer = tokenizer;
        this.sequenceSource = sequenceSource;
        this.availableProcessors = availableProcessors;
        this.maintenanceWorkMemMb = maintenanceWorkMemMb;
        this.progressListener = progressListener;
    }

    /**
     * 全量构建：准备一个建索引作业并执行。
     *
     * @param rows 全部行
     * @param parallelism 并行度，0 表示自动
     * @param memoryBudgetMb 单 worker 预算（MB），0 表示推导
     * @return 本作业产出的段集合
     * @throws IOException 作业失败，已丢弃全部产出
     */
    public SegmentSet build(List<Row> rows, int parallelism, int memoryBudgetMb) throws IOException {
        BuildJob job = prepare(WriterResources.CREATE_INDEX, parallelism, memoryBudgetMb);
        return new SegmentSet(0L, execute(job, rows));
    }

    /**
     * 解析并行度与预算并创建作业，参数非法时作业不会开始。
     *
     * @param kind 作业档位
     * @param parallelism 请求的并行度，0 表示自动
     * @param memoryBudgetMb 请求的单 worker 预算（MB），0 表示推导
     * @return 作业
     */
    public BuildJob prepare(WriterResources kind, int parallelism, int memoryBudgetMb) {
        int resolvedParallelism = WriterResources.resolveParallelism(parallelism, availableProcessors);
        long budgetBytes = WriterResources.resolveMemoryBudgetBytes(memoryBudgetMb, maintenanceWorkMemMb, resolvedParallelism);
        return new BuildJob(kind, resolvedParallelism, budgetBytes);
    }

    /**
     * 执行作业并等待全部 worker 结束。
     *
     * @param job 由 {@link #prepare} 创建的作业
     * @param rows 作业的全部行
     * @return 按创建序号排序的段
     * @throws IndexFlushException 落盘失败
     * @throws BuildCancelledException 作业被取消
     * @throws IndexBuildException 其他 worker 失败
     */
    public List<SegmentMeta> execute(BuildJob job, List<Row> rows) throws IOException {
        int workerCount = Math.min(job.parallelism(), rows.size());
        job.setWorkerCount(workerCount);
        List<List<Row>> shards = partition(rows, workerCount);
        long startNanos = System.nanoTime();
        logger.info("构建作业开始: kind={}, rows={}, workers={}, budget={} bytes",
            job.kind().label(), rows.size(), workerCount, job.memoryBudgetBytes());

        try (IndexWorkerPool pool = new IndexWorkerPool(job.kind().label(), workerCount);
             ProgressReporter reporter = openReporter(job.kind(), workerCount)) {
            List<Future<?>> futures = new ArrayList<>(workerCount);
            for (int workerIndex = 0; workerIndex < workerCount; workerIndex++) {
                List<Row> shard = shards.get(workerIndex);
                ProgressReporter.WorkerCounter counter = reporter.counter(workerIndex);
                futures.add(pool.submit(() -> {
                    runWorker(job, shard, counter);
                    return null;
                }));
            }
            awaitAll(job, futures);
        }

        List<SegmentMeta> segments = job.segments();
        if (job.isCancelled()) {
            discard(job, segments);
            throw failureOf(job);
        }
        long totalDocs = segments.stream().mapToLong(SegmentMeta::docCount).sum();
        logger.info("构建作业完成: kind={}, docs={}, segments={}, elapsed={}ms",
            job.kind().label(), totalDocs, segments.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return segments;
    }

    private ProgressReporter openReporter(WriterResources kind, int workerCount) {
        if (kind != WriterResources.CREATE_INDEX || progressListener == null || workerCount == 0) {
            return ProgressReporter.disabled();
        }
        return ProgressReporter.start(workerCount, progressListener);
    }

    private void runWorker(BuildJob job, List<Row> shard, ProgressReporter.WorkerCounter counter) {
        SegmentBuilder builder = new SegmentBuilder(
            store, tokenizer, new MemoryBudgetTracker(job.memoryBudgetBytes()), sequenceSource, job::addSegment);
        try {
            for (Row row : shard) {
                if (job.isCancelled()) {
                    return;
                }
                builder.ingest(row);
                counter.increment();
            }
            if (!job.isCancelled()) {
                builder.finish();
            }
        } catch (IOException | RuntimeException exception) {
            job.fail(exception);
        }
    }

    /**
     * 等待全部 worker；等待期间被中断时取消作业并继续等待 worker 退出，最后恢复中断标志。
     */
    private void awaitAll(BuildJob job, List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException exception) {
                    interrupted = true;
                    job.cancel();
                } catch (ExecutionException exception) {
                    job.fail(exception.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void discard(BuildJob job, List<SegmentMeta> segments) {
        logger.warn("构建作业失败，丢弃已产出的段: kind={}, segments={}", job.kind().label(), segments.size());
        for (SegmentMeta segment : segments) {
            try {
                store.delete(segment.segmentId());
            } catch (IOException exception) {
                logger.warn("删除段失败，留待维护清理: segment={}", segment.segmentId(), exception);
            }
        }
    }

    private IOException failureOf(BuildJob job) {
        Throwable failure = job.failure();
        if (failure == null) {
            return new BuildCancelledException("构建作业已取消: kind=" + job.kind().label());
        }
        if (failure instanceof IndexFlushException flushException) {
            return flushException;
        }
        return new IndexBuildException("构建作业失败: kind=" + job.kind().label() + ", cause=" + failure.getMessage(), failure);
    }

    /**
     * 按位置切分为 shardCount 个连续分片，分片大小相差不超过 1。
     */
    static List<List<Row>> partition(List<Row> rows, int shardCount) {
        List<List<Row>> shards = new ArrayList<>(shardCount);
        if (shardCount == 0) {
            return shards;
        }
        int base = rows.size() / shardCount;
        int remainder = rows.size() % shardCount;
        int from = 0;
        for (int index = 0; index < shardCount; index++) {
            int size = base + (index < remainder ? 1 : 0);
            shards.add(rows.subList(from, from + size));
            from += size;
        }
        return shards;
    }
}
