package com.segmentengine.storage;

import com.segmentengine.config.Constants;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法：段文件的 CRC32 页脚校验、文件头校验与目录递归删除。
 */
final class StorageFileUtil {
    static final int HEADER_BYTES = Integer.BYTES + Short.BYTES;

    private StorageFileUtil() {
    }

    /**
     * 读取整个段文件，校验尾部 CRC32、magic 与版本号。
     *
     * @param file 段文件
     * @param expectedMagic 期望的 magic
     * @return 不含 CRC 页脚的数据缓冲区，position 指向文件头之后
     * @throws IOException 文件损坏、过短或版本不兼容时抛出
     */
    static ByteBuffer readVerified(Path file, int expectedMagic) throws IOException {
        String fileName = file.getFileName().toString();
        byte[] bytes = Files.readAllBytes(file);
        if (bytes.length < HEADER_BYTES + Integer.BYTES) {
            throw new IOException("文件过短，缺少文件头或 CRC32 页脚: " + fileName);
        }
        int dataLength = bytes.length - Integer.BYTES;
        CRC32 crc32 = new CRC32();
        crc32.update(bytes, 0, dataLength);
        long expectedCrc32 = Integer.toUnsignedLong(ByteBuffer.wrap(bytes, dataLength, Integer.BYTES).getInt());
        if (crc32.getValue() != expectedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + crc32.getValue());
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, dataLength);
        int magic = buffer.getInt();
        if (magic != expectedMagic) {
            throw new IOException("文件 magic 不匹配: " + fileName);
        }
        short version = buffer.getShort();
        if (version != Constants.FORMAT_VERSION) {
            throw new IOException("文件版本不支持: " + fileName + ", version=" + version);
        }
        return buffer;
    }

    /**
     * 读取数据区末尾的 int 计数（写入器在 CRC 页脚前追加）。
     */
    static int readTrailerCount(ByteBuffer buffer, String fileName) throws IOException {
        if (buffer.limit() - Integer.BYTES < HEADER_BYTES) {
            throw new IOException("文件缺少计数尾: " + fileName);
        }
        int count = buffer.getInt(buffer.limit() - Integer.BYTES);
        if (count < 0) {
            throw new IOException("计数尾非法: " + fileName + ", count=" + count);
        }
        return count;
    }

    /**
     * 递归删除目录，目录不存在时直接返回。
     *
     * @param directory 目标目录
     * @throws IOException 任一文件删除失败时抛出
     */
    static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
