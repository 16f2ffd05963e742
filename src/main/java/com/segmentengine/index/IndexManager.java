package com.segmentengine.index;

import com.segmentengine.config.Constants;
import com.segmentengine.config.EngineConfig;
import com.segmentengine.config.IndexOptions;
import com.segmentengine.config.WriterResources;
import com.segmentengine.document.Row;
import com.segmentengine.document.RowSource;
import com.segmentengine.storage.FileSegmentStore;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import com.segmentengine.text.MixedScriptTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntSupplier;

/**
 * 单个索引的入口：全量建索引、语句级增量、维护与选项修改。
 *
 * <p>语句插入与维护合并持有维护锁的读锁，可以并发；全量建索引从扫描到整体替换持有写锁，
 * 期间的语句插入被阻塞，直到新段集合发布后再追加。清理孤儿段目录同样需要写锁，
 * 保证没有正在写入、尚未发布的段。
 */
public final class IndexManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IndexManager.class);

    private final EngineConfig config;
    private final Path indexDir;
    private final SegmentStore store;
    private final IntSupplier availableProcessors;
    private final LiveSegmentSet liveSet;
    private final ParallelBuildCoordinator coordinator;
    private final MergeScheduler mergeScheduler;
    private final StatementIndexer statementIndexer;
    private final ReentrantReadWriteLock maintenanceLock = new ReentrantReadWriteLock();
    private final ExecutorService maintenanceExecutor;
    private volatile IndexOptions options;

    /**
     * 按配置打开（或创建）索引目录。
     *
     * @param config 引擎配置
     * @throws IOException 索引目录不可用或清单损坏时抛出
     */
    public IndexManager(EngineConfig config) throws IOException {
        this(config, new FileSegmentStore(config.validate().getIndexDir()), Runtime.getRuntime()::availableProcessors);
    }

    /**
     * @param config 引擎配置
     * @param store 段存储
     * @param availableProcessors 主机并行度来源
     * @throws IOException 清单或选项文件损坏时抛出
     */
    public IndexManager(EngineConfig config, SegmentStore store, IntSupplier availableProcessors) throws IOException {
        this.config = config.validate();
        this.indexDir = config.getIndexDir();
        this.store = store;
        this.availableProcessors = availableProcessors;
        Files.createDirectories(indexDir);
        this.liveSet = new LiveSegmentSet(indexDir.resolve(Constants.MANIFEST_FILE));
        this.options = loadOptions();
        this.coordinator = new ParallelBuildCoordinator(
            store,
            new MixedScriptTokenizer(true),
            liveSet::nextSequence,
            availableProcessors,
            config.getMaintenanceWorkMemMb(),
            config.isLogCreateIndexProgress() ? ProgressReporter.LOGGING : null);
        this.mergeScheduler = new MergeScheduler(store, new SmallestFirstMergePolicy());
        this.statementIndexer = new StatementIndexer(coordinator, store, liveSet, mergeScheduler, this::getOptions);
        this.maintenanceExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "segment-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    private IndexOptions loadOptions() throws IOException {
        Path optionsFile = indexDir.resolve(Constants.INDEX_OPTIONS_FILE);
        if (Files.exists(optionsFile)) {
            return IndexOptions.readFrom(optionsFile);
        }
        IndexOptions defaults = IndexOptions.defaults(availableProcessors);
        defaults.writeTo(optionsFile);
        return defaults;
    }

    /**
     * 全量建索引：扫描全部行并行构建，整体替换现有段，然后合并到目标段数并回收旧段文件。
     * 整个过程独占维护锁，并发的语句插入在新段集合发布后才追加。
     *
     * @param source 行来源
     * @return 建索引完成后的段集合
     * @throws IOException 构建失败时抛出，原有段集合保持不变
     */
    public SegmentSet createIndex(RowSource source) throws IOException {
        maintenanceLock.writeLock().lock();
        try {
            List<Row> rows = source.scan();
            BuildJob job = coordinator.prepare(
                WriterResources.CREATE_INDEX,
                WriterResources.CREATE_INDEX.requestedParallelism(config),
                WriterResources.CREATE_INDEX.requestedMemoryBudgetMb(config));
            List<SegmentMeta> segments = coordinator.execute(job, rows);
            try {
                liveSet.replaceAll(segments);
            } catch (IOException exception) {
                deleteAll(segments, exception);
                throw exception;
            }
            try {
                mergeAfter(WriterResources.CREATE_INDEX);
            } catch (MergeFailureException exception) {
                logger.warn("建索引后合并失败，留待维护合并: {}", exception.getMessage(), exception);
            }
            collectGarbage(false);
            return liveSet.snapshot();
        } finally {
            maintenanceLock.writeLock().unlock();
        }
    }

    /**
     * 索引一条语句插入的行。
     *
     * @param rows 受影响的行
     * @return 本语句新增的段
     * @throws IOException 构建失败时抛出，语句失败且已有段不受影响
     */
    public List<SegmentMeta> insert(List<Row> rows) throws IOException {
        maintenanceLock.readLock().lock();
        try {
            return statementIndexer.indexStatement(
                rows,
                WriterResources.STATEMENT.requestedParallelism(config),
                WriterResources.STATEMENT.requestedMemoryBudgetMb(config));
        } finally {
            maintenanceLock.readLock().unlock();
        }
    }

    /**
     * 在调用线程上执行维护：合并到目标段数，回收待删除段与孤儿段目录。
     *
     * @return 维护结果
     * @throws IOException 合并或回收失败时抛出
     */
    public VacuumResult vacuum() throws IOException {
        long versionBefore;
        boolean merged;
        maintenanceLock.readLock().lock();
        try {
            versionBefore = liveSet.snapshot().version();
            merged = mergeAfter(WriterResources.VACUUM);
        } finally {
            maintenanceLock.readLock().unlock();
        }
        int reclaimed = collectGarbage(true);
        SegmentSet segments = liveSet.snapshot();
        logger.info("维护完成: segments={}, merged={}, reclaimed={}, version {} -> {}",
            segments.size(), merged, reclaimed, versionBefore, segments.version());
        return new VacuumResult(segments, merged, reclaimed);
    }

    /**
     * 在维护线程上执行 {@link #vacuum()}，不阻塞调用方。
     */
    public CompletableFuture<VacuumResult> vacuumAsync() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return vacuum();
            } catch (IOException exception) {
                throw new UncheckedIOException(exception);
            }
        }, maintenanceExecutor);
    }

    private boolean mergeAfter(WriterResources kind) throws MergeFailureException {
        IndexOptions current = options;
        if (!kind.doMerging(current)) {
            return false;
        }
        long before = mergeScheduler.mergeCount();
        mergeScheduler.maybeMerge(liveSet, current.targetSegmentCount());
        return mergeScheduler.mergeCount() > before;
    }

    /**
     * 回收待删除段；sweepOrphans 为真时还清理清单未引用的段目录与临时目录。
     *
     * @return 回收的段目录数
     */
    private int collectGarbage(boolean sweepOrphans) throws IOException {
        maintenanceLock.writeLock().lock();
        try {
            List<String> pending = liveSet.pendingDeletes();
            List<String> reclaimed = new ArrayList<>();
            for (String segmentId : pending) {
                try {
                    store.delete(segmentId);
                    reclaimed.add(segmentId);
                } catch (IOException exception) {
                    logger.warn("回收段失败，留待下次维护: segment={}", segmentId, exception);
                }
            }
            liveSet.clearPendingDeletes(reclaimed);
            int count = reclaimed.size();
            if (!sweepOrphans) {
                return count;
            }

            SegmentSet live = liveSet.snapshot();
            Set<String> known = new HashSet<>(liveSet.pendingDeletes());
            for (String segmentId : store.listSegmentIds()) {
                if (live.contains(segmentId) || known.contains(segmentId)) {
                    continue;
                }
                try {
                    store.delete(segmentId);
                    count++;
                    logger.info("已清理孤儿段: segment={}", segmentId);
                } catch (IOException exception) {
                    logger.warn("清理孤儿段失败: segment={}", segmentId, exception);
                }
            }
            count += store.sweepTemporary();
            return count;
        } finally {
            maintenanceLock.writeLock().unlock();
        }
    }

    private void deleteAll(List<SegmentMeta> segments, IOException primary) {
        for (SegmentMeta segment : segments) {
            try {
                store.delete(segment.segmentId());
            } catch (IOException exception) {
                primary.addSuppressed(exception);
            }
        }
    }

    /**
     * 修改索引选项并持久化，未设置的项保留原值。
     *
     * @param targetSegmentCount 新目标段数，0 表示按当前主机处理器数重新取默认值
     * @param mergeOnInsert 新的插入即合并开关
     * @return 修改后的选项
     * @throws IOException 写入选项文件失败
     */
    public synchronized IndexOptions alterOptions(Integer targetSegmentCount, Boolean mergeOnInsert) throws IOException {
        IndexOptions altered = options.alter(targetSegmentCount, mergeOnInsert, availableProcessors);
        altered.writeTo(indexDir.resolve(Constants.INDEX_OPTIONS_FILE));
        options = altered;
        logger.info("索引选项已修改: targetSegmentCount={}, mergeOnInsert={}",
            altered.targetSegmentCount(), altered.mergeOnInsert());
        return altered;
    }

    public IndexOptions getOptions() {
        return options;
    }

    /**
     * 当前存活段，供查询层读取。
     */
    public List<SegmentMeta> getActiveSegments() {
        return liveSet.snapshot().segments();
    }

    public SegmentSet snapshot() {
        return liveSet.snapshot();
    }

    public IndexStatus getStatus() {
        SegmentSet segments = liveSet.snapshot();
        return new IndexStatus(
            segments.version(),
            segments.size(),
            segments.docCount(),
            segments.sizeBytes(),
            liveSet.pendingDeletes().size(),
            options);
    }

    MergeScheduler mergeScheduler() {
        return mergeScheduler;
    }

    @Override
    public void close() {
        maintenanceExecutor.shutdown();
        try {
            if (!maintenanceExecutor.awaitTermination(Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("维护线程未能按时退出，强制中断");
                maintenanceExecutor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            maintenanceExecutor.shutdownNow();
        }
    }
}
