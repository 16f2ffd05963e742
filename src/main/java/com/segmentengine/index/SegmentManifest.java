package com.segmentengine.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.segmentengine.config.Constants;
import com.segmentengine.storage.SegmentMeta;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * 段集合清单（segments.json）：版本、下一个段序号、存活段以及等待删除的段。
 */
public record SegmentManifest(
    long version,
    long nextSequence,
    List<SegmentMeta> segments,
    List<String> pendingDeletes
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public SegmentManifest {
        segments = segments == null ? List.of() : List.copyOf(segments);
        pendingDeletes = pendingDeletes == null ? List.of() : List.copyOf(pendingDeletes);
    }

    /**
     * 先写临时文件并落盘，再原子替换清单。
     *
     * @param file 清单文件
     * @throws IOException 写入失败时抛出，原清单保持不变
     */
    public void writeTo(Path file) throws IOException {
        Path tempFile = file.resolveSibling(file.getFileName() + Constants.TEMP_SUFFIX);
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), this);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException exception) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupException) {
                exception.addSuppressed(cleanupException);
            }
            throw new IOException("写入段清单失败: " + file.toAbsolutePath(), exception);
        }
    }

    public static SegmentManifest readFrom(Path file) throws IOException {
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), SegmentManifest.class);
        } catch (IOException exception) {
            throw new IOException("读取段清单失败: " + file.toAbsolutePath(), exception);
        }
    }
}
