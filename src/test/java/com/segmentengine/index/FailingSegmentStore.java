package com.segmentengine.index;

import com.segmentengine.storage.SegmentContent;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentReader;
import com.segmentengine.storage.SegmentStore;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 包装真实存储，在第 N 次写入时模拟 I/O 失败。
 */
class FailingSegmentStore implements SegmentStore {
    private final SegmentStore delegate;
    private final AtomicInteger writes = new AtomicInteger();
    private volatile int failOnWrite;

    FailingSegmentStore(SegmentStore delegate) {
        this.delegate = delegate;
    }

    /**
     * 第 n 次写入（从 1 开始）失败，0 表示不失败。
     */
    void failOnWrite(int n) {
        writes.set(0);
        this.failOnWrite = n;
    }

    int writeCount() {
        return writes.get();
    }

    @Override
    public SegmentMeta write(long sequence, SegmentContent content) throws IOException {
        int current = writes.incrementAndGet();
        if (failOnWrite > 0 && current == failOnWrite) {
            throw new IOException("模拟磁盘写入失败: write=" + current);
        }
        return delegate.write(sequence, content);
    }

    @Override
    public SegmentReader open(SegmentMeta meta) throws IOException {
        return delegate.open(meta);
    }

    @Override
    public void delete(String segmentId) throws IOException {
        delegate.delete(segmentId);
    }

    @Override
    public List<String> listSegmentIds() throws IOException {
        return delegate.listSegmentIds();
    }

    @Override
    public int sweepTemporary() throws IOException {
        return delegate.sweepTemporary();
    }
}
