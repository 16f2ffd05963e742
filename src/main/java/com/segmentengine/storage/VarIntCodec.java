package com.segmentengine.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 * 
 * 编码规则：每字节7位有效数据，最高位为续接标志（1 表示后续还有字节）。
 * 写入面向流，读取面向已校验过 CRC 的内存缓冲区。
 */
public final class VarIntCodec {
    
    private VarIntCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 将非负 int 编码为VarInt写入输出流
     * 
     * @param value 要编码的值
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value);
    }
    
    /**
     * 将非负 long 编码为VarLong写入输出流
     * 
     * @param value 要编码的值
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void writeVarLong(long value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }
    
    /**
     * 从缓冲区当前位置读取VarInt
     * 
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 缓冲区不足或超过32位时抛出
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            if (!buf.hasRemaining()) {
                throw new IOException("缓冲区不足，无法读取完整VarInt");
            }
            int b = buf.get() & 0xFF;
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarInt超过32位范围");
    }
    
    /**
     * 从缓冲区当前位置读取VarLong
     * 
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 缓冲区不足或超过64位时抛出
     */
    public static long readVarLong(ByteBuffer buf) throws IOException {
        long result = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            if (!buf.hasRemaining()) {
                throw new IOException("缓冲区不足，无法读取完整VarLong");
            }
            int b = buf.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarLong超过64位范围");
    }
    
    /**
     * 计算VarInt编码字节数
     */
    public static int varIntSize(int value) {
        return varLongSize(value);
    }
    
    /**
     * 计算VarLong编码字节数
     */
    public static int varLongSize(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
