package com.segmentengine.index;

import com.segmentengine.config.EngineConfig;
import com.segmentengine.config.IndexOptions;
import com.segmentengine.document.Row;
import com.segmentengine.storage.FileSegmentStore;
import com.segmentengine.storage.SegmentMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 索引生命周期集成测试：建索引、语句插入、选项修改、维护与重新打开。
 */
class IndexManagerTest {

    @TempDir
    Path tempDir;

    private EngineConfig config;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        config.setIndexDir(tempDir.resolve("index"));
        config.setStatementMemoryBudgetMb(1);
    }

    private IndexManager open() throws IOException {
        return new IndexManager(config, new FileSegmentStore(config.getIndexDir()), () -> 4);
    }

    private Set<String> liveIds(IndexManager manager) {
        return manager.getActiveSegments().stream().map(SegmentMeta::segmentId).collect(Collectors.toSet());
    }

    private Set<String> idsOnDisk() throws IOException {
        return new HashSet<>(new FileSegmentStore(config.getIndexDir()).listSegmentIds());
    }

    @Test
    @DisplayName("新索引使用默认选项：目标段数等于主机处理器数")
    void testDefaultOptions() throws IOException {
        try (IndexManager manager = open()) {
            assertEquals(new IndexOptions(4, true), manager.getOptions());
            assertEquals(0, manager.getStatus().segmentCount());
            assertTrue(Files.exists(config.getIndexDir().resolve("index-options.json")));
        }
    }

    @Test
    @DisplayName("建索引后段数不超过目标且文档守恒")
    void testCreateIndexMergesToTarget() throws IOException {
        config.setCreateIndexParallelism(8);
        try (IndexManager manager = open()) {
            SegmentSet segments = manager.createIndex(() -> TestRows.generate(2_000));

            assertEquals(4, segments.size());
            assertEquals(2_000L, segments.docCount());
            assertEquals(TestRows.expectedRowIds(2_000), TestRows.collectRowIds(
                new FileSegmentStore(config.getIndexDir()), segments.segments()));
            assertEquals(liveIds(manager), idsOnDisk());
            assertEquals(0, manager.getStatus().pendingDeletes());
        }
    }

    @Test
    @DisplayName("重新建索引整体替换旧段并回收旧段文件")
    void testRebuildReplacesSegments() throws IOException {
        try (IndexManager manager = open()) {
            manager.createIndex(() -> TestRows.generate(500));
            Set<String> first = liveIds(manager);

            SegmentSet rebuilt = manager.createIndex(() -> TestRows.generate(300));

            assertEquals(300L, rebuilt.docCount());
            Set<String> second = liveIds(manager);
            assertTrue(second.stream().noneMatch(first::contains));
            assertEquals(second, idsOnDisk());
        }
    }

    @Test
    @DisplayName("语句插入追加段，开启插入即合并时段数保持在目标内")
    void testInsertAppendsAndMerges() throws IOException {
        try (IndexManager manager = open()) {
            manager.createIndex(() -> TestRows.generate(100));
            long versionBefore = manager.snapshot().version();

            for (int statement = 0; statement < 6; statement++) {
                List<SegmentMeta> delta = manager.insert(List.of(Row.of(1_000L + statement, "new-" + statement, "inserted row")));
                assertEquals(1, delta.size());
                assertTrue(manager.getStatus().segmentCount() <= 4);
            }

            assertEquals(106L, manager.getStatus().docCount());
            assertTrue(manager.snapshot().version() > versionBefore);
        }
    }

    @Test
    @DisplayName("关闭插入即合并后段累积，维护合并到目标并回收源段")
    void testAlterThenVacuum() throws IOException {
        try (IndexManager manager = open()) {
            manager.alterOptions(2, false);
            for (int statement = 0; statement < 5; statement++) {
                manager.insert(TestRows.generate(statement + 1).subList(statement, statement + 1));
            }
            assertEquals(5, manager.getStatus().segmentCount());

            VacuumResult result = manager.vacuum();

            assertTrue(result.merged());
            assertEquals(2, result.segments().size());
            assertEquals(4, result.reclaimedSegments());
            assertEquals(5L, result.segments().docCount());
            assertEquals(liveIds(manager), idsOnDisk());

            VacuumResult again = manager.vacuum();
            assertFalse(again.merged());
            assertEquals(0, again.reclaimedSegments());
            assertEquals(result.segments().version(), again.segments().version());
        }
    }

    @Test
    @DisplayName("alter 目标段数为 0 时按主机处理器数重置")
    void testAlterResetsTarget() throws IOException {
        try (IndexManager manager = open()) {
            manager.alterOptions(2, null);
            assertEquals(new IndexOptions(2, true), manager.getOptions());

            manager.alterOptions(0, false);
            assertEquals(new IndexOptions(4, false), manager.getOptions());
        }
    }

    @Test
    @DisplayName("维护清理未被清单引用的段目录与临时目录")
    void testVacuumSweepsOrphans() throws IOException {
        try (IndexManager manager = open()) {
            manager.createIndex(() -> TestRows.generate(50));
            Files.createDirectories(config.getIndexDir().resolve("seg-9999999999-deadbeef"));
            Files.createDirectories(config.getIndexDir().resolve("seg-9999999998-cafebabe.tmp"));

            VacuumResult result = manager.vacuum();

            assertEquals(2, result.reclaimedSegments());
            assertFalse(Files.exists(config.getIndexDir().resolve("seg-9999999999-deadbeef")));
            assertFalse(Files.exists(config.getIndexDir().resolve("seg-9999999998-cafebabe.tmp")));
            assertEquals(liveIds(manager), idsOnDisk());
        }
    }

    @Test
    @DisplayName("异步维护在维护线程上完成")
    void testVacuumAsync() throws Exception {
        try (IndexManager manager = open()) {
            manager.alterOptions(1, false);
            manager.insert(TestRows.generate(3));
            manager.insert(TestRows.generate(6).subList(3, 6));

            VacuumResult result = manager.vacuumAsync().get(30, TimeUnit.SECONDS);

            assertTrue(result.merged());
            assertEquals(1, manager.getStatus().segmentCount());
            assertEquals(6L, manager.getStatus().docCount());
        }
    }

    @Test
    @DisplayName("重新打开后段集合与选项保持一致")
    void testReopen() throws IOException {
        SegmentSet before;
        try (IndexManager manager = open()) {
            manager.createIndex(() -> TestRows.generate(400));
            manager.alterOptions(3, false);
            manager.insert(List.of(Row.of(401L, "key-400", "after create")));
            before = manager.snapshot();
        }

        try (IndexManager reopened = new IndexManager(config)) {
            assertEquals(before, reopened.snapshot());
            assertEquals(new IndexOptions(3, false), reopened.getOptions());
            assertEquals(401L, reopened.getStatus().docCount());
        }
    }

    @Test
    @DisplayName("建索引失败时原有段集合保持不变")
    void testCreateIndexFailureKeepsExistingSegments() throws IOException {
        FailingSegmentStore failing = new FailingSegmentStore(new FileSegmentStore(config.getIndexDir()));
        try (IndexManager manager = new IndexManager(config, failing, () -> 4)) {
            manager.createIndex(() -> TestRows.generate(200));
            SegmentSet before = manager.snapshot();

            failing.failOnWrite(2);
            assertThrows(IndexFlushException.class, () -> manager.createIndex(() -> TestRows.generate(400)));

            assertEquals(before, manager.snapshot());
            assertEquals(liveIds(manager), idsOnDisk());
        }
    }

    @Test
    @DisplayName("建索引期间的语句插入在新段集合发布后追加，不会被整体替换丢弃")
    void testInsertDuringCreateIndexIsKept() throws Exception {
        config.setCreateIndexParallelism(1);
        try (IndexManager manager = open()) {
            List<Row> base = TestRows.generate(100);
            CompletableFuture<List<SegmentMeta>> inserted = new CompletableFuture<>();
            CountDownLatch insertFinished = new CountDownLatch(1);
            AtomicBoolean started = new AtomicBoolean();
            List<Row> rows = new AbstractList<>() {
                @Override
                public Row get(int index) {
                    if (index == 50 && started.compareAndSet(false, true)) {
                        Thread writer = new Thread(() -> {
                            try {
                                inserted.complete(manager.insert(List.of(Row.of(101L, "key-100", "inserted during rebuild"))));
                            } catch (IOException | RuntimeException exception) {
                                inserted.completeExceptionally(exception);
                            } finally {
                                insertFinished.countDown();
                            }
                        }, "concurrent-insert");
                        writer.start();
                        try {
                            // 给插入足够时间抢在整体替换之前完成
                            insertFinished.await(500, TimeUnit.MILLISECONDS);
                        } catch (InterruptedException exception) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return base.get(index);
                }

                @Override
                public int size() {
                    return base.size();
                }
            };

            manager.createIndex(() -> rows);
            assertTrue(started.get());
            assertEquals(1, inserted.get(30, TimeUnit.SECONDS).size());

            SegmentSet live = manager.snapshot();
            assertEquals(101L, live.docCount());
            assertEquals(TestRows.expectedRowIds(101), TestRows.collectRowIds(
                new FileSegmentStore(config.getIndexDir()), live.segments()));
            assertEquals(liveIds(manager), idsOnDisk());
        }
    }
}
