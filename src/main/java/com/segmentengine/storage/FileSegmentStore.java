package com.segmentengine.storage;

import com.segmentengine.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 基于目录的段存储：每个段对应索引目录下的 {@code seg-<id>} 子目录。
 *
 * <p>段先写入 {@code seg-<id>.tmp}，全部文件落盘后原子重命名发布。
 */
public final class FileSegmentStore implements SegmentStore {
    private static final Logger logger = LoggerFactory.getLogger(FileSegmentStore.class);

    private final Path rootDirectory;

    public FileSegmentStore(Path rootDirectory) throws IOException {
        if (rootDirectory == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        this.rootDirectory = rootDirectory;
        Files.createDirectories(rootDirectory);
    }

    public Path rootDirectory() {
        return rootDirectory;
    }

    @Override
    public SegmentMeta write(long sequence, SegmentContent content) throws IOException {
        String segmentId = String.format("%010d-%s", sequence, UUID.randomUUID().toString().substring(0, 8));
        Path finalDirectory = segmentDirectory(segmentId);
        Path tempDirectory = rootDirectory.resolve(Constants.SEGMENT_DIR_PREFIX + segmentId + Constants.TEMP_SUFFIX);
        try {
            Files.createDirectories(tempDirectory);
            SegmentWriter.Result result;
            try (SegmentWriter writer = new SegmentWriter(tempDirectory)) {
                content.writeTo(writer);
                result = writer.finish();
            }
            if (result.docCount() != content.docCount()) {
                throw new IOException("段文档数与内容不一致: expected=" + content.docCount() + ", actual=" + result.docCount());
            }
            SegmentMeta meta = new SegmentMeta(segmentId, sequence, result.docCount(), result.termCount(), result.sizeBytes(), Instant.now());
            meta.writeTo(tempDirectory.resolve(Constants.SEGMENT_META_FILE));
            Files.move(tempDirectory, finalDirectory, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("段已写入: id={}, docs={}, terms={}, bytes={}", segmentId, meta.docCount(), meta.termCount(), meta.sizeBytes());
            return meta;
        } catch (IOException | RuntimeException exception) {
            try {
                StorageFileUtil.deleteRecursively(tempDirectory);
            } catch (IOException cleanupException) {
                exception.addSuppressed(cleanupException);
            }
            throw exception;
        }
    }

    @Override
    public SegmentReader open(SegmentMeta meta) throws IOException {
        Path directory = segmentDirectory(meta.segmentId());
        if (!Files.isDirectory(directory)) {
            throw new IOException("段不存在: " + meta.segmentId());
        }
        SegmentReader reader = new SegmentReader(directory, meta.segmentId());
        if (reader.docCount() != meta.docCount()) {
            throw new IOException("段文档数与元数据不一致: " + meta.segmentId()
                + ", meta=" + meta.docCount() + ", actual=" + reader.docCount());
        }
        return reader;
    }

    @Override
    public void delete(String segmentId) throws IOException {
        StorageFileUtil.deleteRecursively(segmentDirectory(segmentId));
    }

    @Override
    public List<String> listSegmentIds() throws IOException {
        List<String> segmentIds = new ArrayList<>();
        try (Stream<Path> children = Files.list(rootDirectory)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                String name = child.getFileName().toString();
                if (Files.isDirectory(child) && name.startsWith(Constants.SEGMENT_DIR_PREFIX) && !name.endsWith(Constants.TEMP_SUFFIX)) {
                    segmentIds.add(name.substring(Constants.SEGMENT_DIR_PREFIX.length()));
                }
            }
        }
        segmentIds.sort(null);
        return segmentIds;
    }

    @Override
    public int sweepTemporary() throws IOException {
        List<Path> temporary = new ArrayList<>();
        try (Stream<Path> children = Files.list(rootDirectory)) {
            children.filter(Files::isDirectory)
                .filter(child -> {
                    String name = child.getFileName().toString();
                    return name.startsWith(Constants.SEGMENT_DIR_PREFIX) && name.endsWith(Constants.TEMP_SUFFIX);
                })
                .forEach(temporary::add);
        }
        for (Path directory : temporary) {
            StorageFileUtil.deleteRecursively(directory);
        }
        return temporary.size();
    }

    private Path segmentDirectory(String segmentId) {
        return rootDirectory.resolve(Constants.SEGMENT_DIR_PREFIX + segmentId);
    }
}
