package com.segmentengine.index;

import com.segmentengine.config.IndexOptions;
import com.segmentengine.document.Row;
import com.segmentengine.storage.FileSegmentStore;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import com.segmentengine.text.MixedScriptTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementIndexerTest {

    @TempDir
    Path tempDir;

    private FileSegmentStore store;
    private LiveSegmentSet liveSet;
    private MergeScheduler scheduler;
    private final AtomicReference<IndexOptions> options = new AtomicReference<>(new IndexOptions(2, true));

    @BeforeEach
    void setUp() throws IOException {
        store = new FileSegmentStore(tempDir.resolve("segments"));
        liveSet = new LiveSegmentSet(tempDir.resolve("segments.json"));
        scheduler = new MergeScheduler(store, new SmallestFirstMergePolicy());
    }

    private StatementIndexer indexer(SegmentStore target) {
        ParallelBuildCoordinator coordinator = new ParallelBuildCoordinator(
            target, new MixedScriptTokenizer(true), liveSet::nextSequence, () -> 2, 64, null);
        return new StatementIndexer(coordinator, target, liveSet, scheduler, options::get);
    }

    @Test
    void testMergeOnInsertKeepsTarget() throws IOException {
        StatementIndexer indexer = indexer(store);

        for (int statement = 0; statement < 5; statement++) {
            List<SegmentMeta> delta = indexer.indexStatement(
                TestRows.generate(statement + 1).subList(statement, statement + 1), 1, 1);
            assertEquals(1, delta.size());
            assertTrue(liveSet.snapshot().size() <= 2);
        }

        assertEquals(5L, scheduler.invocationCount());
        assertEquals(5L, liveSet.snapshot().docCount());
        assertEquals(TestRows.expectedRowIds(5), TestRows.collectRowIds(store, liveSet.snapshot().segments()));
    }

    @Test
    void testSegmentsAccumulateWithoutMergeOnInsert() throws IOException {
        options.set(new IndexOptions(2, false));
        StatementIndexer indexer = indexer(store);

        for (int statement = 0; statement < 5; statement++) {
            indexer.indexStatement(TestRows.generate(statement + 1).subList(statement, statement + 1), 1, 1);
        }

        assertEquals(5, liveSet.snapshot().size());
        assertEquals(0L, scheduler.invocationCount());
    }

    @Test
    void testOptionsReadPerStatement() throws IOException {
        options.set(new IndexOptions(2, false));
        StatementIndexer indexer = indexer(store);
        for (int statement = 0; statement < 3; statement++) {
            indexer.indexStatement(TestRows.generate(statement + 1).subList(statement, statement + 1), 1, 1);
        }

        options.set(new IndexOptions(1, true));
        indexer.indexStatement(TestRows.generate(4).subList(3, 4), 1, 1);

        assertEquals(1, liveSet.snapshot().size());
        assertEquals(4L, liveSet.snapshot().docCount());
    }

    @Test
    void testStatementParallelism() throws IOException {
        options.set(new IndexOptions(8, true));
        StatementIndexer indexer = indexer(store);

        List<SegmentMeta> delta = indexer.indexStatement(TestRows.generate(10), 2, 1);

        assertEquals(2, delta.size());
        assertEquals(2, liveSet.snapshot().size());
        assertEquals(1L, scheduler.invocationCount());
        assertEquals(0L, scheduler.mergeCount());
    }

    @Test
    void testEmptyStatementDoesNothing() throws IOException {
        StatementIndexer indexer = indexer(store);

        assertTrue(indexer.indexStatement(List.of(), 1, 1).isEmpty());

        assertEquals(0L, liveSet.snapshot().version());
        assertEquals(0L, scheduler.invocationCount());
    }

    @Test
    void testFlushFailureLeavesSetUnchanged() throws IOException {
        StatementIndexer indexer = indexer(store);
        indexer.indexStatement(TestRows.generate(3), 1, 1);
        SegmentSet before = liveSet.snapshot();

        FailingSegmentStore failing = new FailingSegmentStore(store);
        failing.failOnWrite(1);
        StatementIndexer failingIndexer = indexer(failing);

        assertThrows(IndexFlushException.class, () -> failingIndexer.indexStatement(TestRows.generate(5), 1, 1));

        assertEquals(before, liveSet.snapshot());
        assertEquals(before.size(), store.listSegmentIds().size());
    }

    @Test
    void testConcurrentStatementsWithMergeOnInsert() throws Exception {
        int writers = 4;
        int statementsPerWriter = 8;
        int totalRows = writers * statementsPerWriter;
        List<Row> rows = TestRows.generate(totalRows);
        StatementIndexer indexer = indexer(store);

        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicReference<Throwable> readerFailure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            long lastDocCount = 0;
            try {
                while (writing.get()) {
                    SegmentSet snapshot = liveSet.snapshot();
                    if (snapshot.docCount() < lastDocCount) {
                        throw new AssertionError("文档数回退: " + lastDocCount + " -> " + snapshot.docCount());
                    }
                    lastDocCount = snapshot.docCount();
                    Set<Long> rowIds = TestRows.collectRowIds(store, snapshot.segments());
                    if (rowIds.size() != snapshot.docCount()) {
                        throw new AssertionError("快照文档数与段内容不一致: version=" + snapshot.version());
                    }
                }
            } catch (Throwable failure) {
                readerFailure.set(failure);
            }
        }, "snapshot-reader");
        reader.start();

        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int writer = 0; writer < writers; writer++) {
                int first = writer * statementsPerWriter;
                futures.add(pool.submit(() -> {
                    for (int index = first; index < first + statementsPerWriter; index++) {
                        indexer.indexStatement(rows.subList(index, index + 1), 1, 1);
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            writing.set(false);
            pool.shutdown();
            reader.join(TimeUnit.SECONDS.toMillis(30));
        }

        assertNull(readerFailure.get());
        SegmentSet last = liveSet.snapshot();
        assertEquals((long) totalRows, last.docCount());
        assertTrue(last.size() <= 2);
        assertEquals(TestRows.expectedRowIds(totalRows), TestRows.collectRowIds(store, last.segments()));
        assertEquals((long) totalRows, scheduler.invocationCount());
    }
}
