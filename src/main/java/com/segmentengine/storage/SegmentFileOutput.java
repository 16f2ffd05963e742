package com.segmentengine.storage;

import com.segmentengine.config.Constants;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * 顺序写入的段文件：写入文件头，边写边累计 CRC32，结束时追加页脚并落盘。
 */
final class SegmentFileOutput implements AutoCloseable {
    private static final int BUFFER_BYTES = 64 * 1024;

    private final String fileName;
    private final FileOutputStream fileStream;
    private final CheckedOutputStream checkedStream;
    private final DataOutputStream out;
    private long position;
    private boolean closed;

    SegmentFileOutput(Path file, int magic) throws IOException {
        this.fileName = file.getFileName().toString();
        this.fileStream = new FileOutputStream(file.toFile());
        this.checkedStream = new CheckedOutputStream(new BufferedOutputStream(fileStream, BUFFER_BYTES), new CRC32());
        this.out = new DataOutputStream(checkedStream);
        try {
            writeInt(magic);
            out.writeShort(Constants.FORMAT_VERSION);
            position += Short.BYTES;
        } catch (IOException exception) {
            try {
                close();
            } catch (IOException closeException) {
                exception.addSuppressed(closeException);
            }
            throw new IOException("写入段文件头失败: " + fileName, exception);
        }
    }

    /**
     * 当前写入偏移（相对文件起始）。
     */
    long position() {
        return position;
    }

    void writeInt(int value) throws IOException {
        out.writeInt(value);
        position += Integer.BYTES;
    }

    void writeVarInt(int value) throws IOException {
        VarIntCodec.writeVarInt(value, out);
        position += VarIntCodec.varIntSize(value);
    }

    void writeVarLong(long value) throws IOException {
        VarIntCodec.writeVarLong(value, out);
        position += VarIntCodec.varLongSize(value);
    }

    void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
        position += bytes.length;
    }

    /**
     * 追加 CRC32 页脚、刷盘并关闭。
     *
     * @return 文件总长度
     * @throws IOException 写入或 fsync 失败时抛出
     */
    long finish() throws IOException {
        try {
            int crc32 = (int) checkedStream.getChecksum().getValue();
            out.writeInt(crc32);
            out.flush();
            fileStream.getFD().sync();
        } catch (IOException exception) {
            throw new IOException("写入段文件页脚失败: " + fileName, exception);
        } finally {
            close();
        }
        return position + Integer.BYTES;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
    }
}
