package com.segmentengine.index;

import com.segmentengine.storage.SegmentMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 索引的存活段集合。
 *
 * <p>读者通过 {@link #snapshot()} 拿到完整快照，不加锁。变更由单写者锁串行化，
 * 每次变更先原子写入清单文件，成功后才发布新版本；写清单失败时当前版本保持不变。
 * 变更粒度只有两种：追加 N 个新段，或用 1 个段替换 K 个段。
 */
public final class LiveSegmentSet {
    private static final Logger logger = LoggerFactory.getLogger(LiveSegmentSet.class);

    private final Path manifestFile;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<SegmentSet> current;
    private final AtomicLong nextSequence;
    private List<String> pendingDeletes;

    /**
     * 打开清单，文件不存在时从空集合开始。
     *
     * @param manifestFile 清单文件
     * @throws IOException 清单损坏时抛出
     */
    public LiveSegmentSet(Path manifestFile) throws IOException {
        this.manifestFile = manifestFile;
        if (Files.exists(manifestFile)) {
            SegmentManifest manifest = SegmentManifest.readFrom(manifestFile);
            this.current = new AtomicReference<>(new SegmentSet(manifest.version(), manifest.segments()));
            this.nextSequence = new AtomicLong(manifest.nextSequence());
            this.pendingDeletes = manifest.pendingDeletes();
            logger.info("已加载段清单: version={}, segments={}, pendingDeletes={}",
                manifest.version(), manifest.segments().size(), manifest.pendingDeletes().size());
        } else {
            this.current = new AtomicReference<>(SegmentSet.EMPTY);
            this.nextSequence = new AtomicLong(1L);
            this.pendingDeletes = List.of();
        }
    }

    /**
     * 当前快照。
     */
    public SegmentSet snapshot() {
        return current.get();
    }

    /**
     * 分配一个段创建序号，线程安全。
     */
    public long nextSequence() {
        return nextSequence.getAndIncrement();
    }

    /**
     * 追加新段。
     *
     * @param segments 新段
     * @return 新快照
     * @throws IOException 写清单失败，集合保持不变
     */
    public SegmentSet append(List<SegmentMeta> segments) throws IOException {
        writeLock.lock();
        try {
            SegmentSet base = current.get();
            for (SegmentMeta segment : segments) {
                if (base.contains(segment.segmentId())) {
                    throw new IllegalArgumentException("段已存在: " + segment.segmentId());
                }
            }
            List<SegmentMeta> next = new ArrayList<>(base.segments());
            next.addAll(segments);
            return publish(base, next, pendingDeletes);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 用合并结果替换源段，源段进入待删除列表。
     *
     * @param sources 源段
     * @param merged 合并结果
     * @return 新快照
     * @throws MergeFailureException 任一源段已不在集合中
     * @throws IOException 写清单失败，集合保持不变
     */
    public SegmentSet replace(Collection<SegmentMeta> sources, SegmentMeta merged) throws IOException {
        writeLock.lock();
        try {
            SegmentSet base = current.get();
            Set<String> sourceIds = new HashSet<>();
            for (SegmentMeta source : sources) {
                if (!base.contains(source.segmentId())) {
                    throw new MergeFailureException("源段已不在存活集合中: " + source.segmentId());
                }
                sourceIds.add(source.segmentId());
            }
            List<SegmentMeta> next = new ArrayList<>();
            for (SegmentMeta segment : base.segments()) {
                if (!sourceIds.contains(segment.segmentId())) {
                    next.add(segment);
                }
            }
            next.add(merged);
            Set<String> deletes = new LinkedHashSet<>(pendingDeletes);
            deletes.addAll(sourceIds);
            return publish(base, next, new ArrayList<>(deletes));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 整体替换为全量构建的结果，原有段全部进入待删除列表。
     *
     * @param segments 新段
     * @return 新快照
     * @throws IOException 写清单失败，集合保持不变
     */
    public SegmentSet replaceAll(List<SegmentMeta> segments) throws IOException {
        writeLock.lock();
        try {
            SegmentSet base = current.get();
            Set<String> deletes = new LinkedHashSet<>(pendingDeletes);
            for (SegmentMeta segment : base.segments()) {
                deletes.add(segment.segmentId());
            }
            return publish(base, segments, new ArrayList<>(deletes));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 待删除段标识的快照。
     */
    public List<String> pendingDeletes() {
        writeLock.lock();
        try {
            return List.copyOf(pendingDeletes);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 文件已被回收的段从待删除列表中移除。
     *
     * @param segmentIds 已回收的段
     * @throws IOException 写清单失败
     */
    public void clearPendingDeletes(Collection<String> segmentIds) throws IOException {
        if (segmentIds.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            List<String> remaining = new ArrayList<>(pendingDeletes);
            remaining.removeAll(segmentIds);
            SegmentSet base = current.get();
            SegmentManifest manifest = new SegmentManifest(base.version(), nextSequence.get(), base.segments(), remaining);
            manifest.writeTo(manifestFile);
            pendingDeletes = List.copyOf(remaining);
        } finally {
            writeLock.unlock();
        }
    }

    private SegmentSet publish(SegmentSet base, List<SegmentMeta> segments, List<String> deletes) throws IOException {
        List<SegmentMeta> ordered = new ArrayList<>(segments);
        ordered.sort(Comparator.comparingLong(SegmentMeta::sequence));
        SegmentSet next = new SegmentSet(base.version() + 1, ordered);
        new SegmentManifest(next.version(), nextSequence.get(), next.segments(), deletes).writeTo(manifestFile);
        pendingDeletes = List.copyOf(deletes);
        current.set(next);
        return next;
    }
}
