package com.segmentengine.index;

import com.segmentengine.document.Row;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentStore;
import com.segmentengine.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * 单个 worker 的段构建器。
 *
 * <p>文档先进入内存倒排缓冲，内存预算用尽时同步落盘为一个不可变段并交给所属作业的
 * {@link SegmentSink}。构建器只被一个线程使用。
 */
public final class SegmentBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SegmentBuilder.class);

    private final SegmentStore store;
    private final Tokenizer tokenizer;
    private final MemoryBudgetTracker tracker;
    private final LongSupplier sequenceSource;
    private final SegmentSink sink;
    private DocumentInverter inverter;
    private long lastDocumentBytes;
    private long bytesAtLastFlush;
    private int flushCount;
    private long ingestedCount;
    private boolean finished;

    /**
     * @param store 段存储
     * @param tokenizer 分词器
     * @param tracker 本 worker 独占的预算记账器
     * @param sequenceSource 段创建序号来源，落盘时取号
     * @param sink 段接收方
     */
    public SegmentBuilder(SegmentStore store, Tokenizer tokenizer, MemoryBudgetTracker tracker,
                          LongSupplier sequenceSource, SegmentSink sink) {
        this.store = store;
        this.tokenizer = tokenizer;
        this.tracker = tracker;
        this.sequenceSource = sequenceSource;
        this.sink = sink;
        this.inverter = new DocumentInverter(tokenizer);
    }

    /**
     * 接收一行，必要时同步落盘。
     *
     * @param row 行
     * @throws IndexFlushException 落盘失败
     * @throws IllegalArgumentException 键字段为空
     */
    public void ingest(Row row) throws IndexFlushException {
        ensureOpen();
        row.requireKey();
        lastDocumentBytes = inverter.addDocument(row);
        ingestedCount++;
        if (tracker.record(lastDocumentBytes) == FlushDecision.FLUSH_REQUIRED) {
            flush();
        }
    }

    /**
     * 落盘剩余文档并结束。没有缓冲文档时不产生段。
     *
     * @return 最后一次落盘产生的段
     * @throws IndexFlushException 落盘失败
     */
    public Optional<SegmentMeta> finish() throws IndexFlushException {
        ensureOpen();
        finished = true;
        if (inverter.docCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(flush());
    }

    private SegmentMeta flush() throws IndexFlushException {
        DocumentInverter pending = inverter;
        long buffered = tracker.usedBytes();
        SegmentMeta segment;
        try {
            segment = store.write(sequenceSource.getAsLong(), pending);
        } catch (IOException exception) {
            throw new IndexFlushException("段落盘失败: docs=" + pending.docCount() + ", bytes=" + buffered, exception);
        }
        sink.accept(segment);
        bytesAtLastFlush = buffered;
        flushCount++;
        inverter = new DocumentInverter(tokenizer);
        tracker.reset();
        logger.debug("worker 落盘: segment={}, docs={}, terms={}, buffered={} bytes",
            segment.segmentId(), segment.docCount(), segment.termCount(), buffered);
        return segment;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("SegmentBuilder 已结束");
        }
    }

    /**
     * 当前缓冲的字节数。
     */
    public long bufferedBytes() {
        return tracker.usedBytes();
    }

    public long lastDocumentBytes() {
        return lastDocumentBytes;
    }

    /**
     * 最近一次落盘时缓冲的字节数。
     */
    public long bytesAtLastFlush() {
        return bytesAtLastFlush;
    }

    public int flushCount() {
        return flushCount;
    }

    public long ingestedCount() {
        return ingestedCount;
    }
}
