package com.segmentengine.index;

import com.segmentengine.config.Constants;

import java.util.Arrays;

/**
 * 可增长的 int 缓冲，按容量而不是元素个数统计内存占用。
 */
final class IntArrayBuffer {
    private int[] values;
    private int size;

    IntArrayBuffer(int initialCapacity) {
        this.values = new int[initialCapacity];
    }

    /**
     * 追加一个值。
     *
     * @return 本次扩容新增的字节数，未扩容时为 0
     */
    long add(int value) {
        long grownBytes = 0;
        if (size == values.length) {
            int newCapacity = Math.max(values.length + (values.length >> 1), values.length + 1);
            grownBytes = (long) (newCapacity - values.length) * Integer.BYTES;
            values = Arrays.copyOf(values, newCapacity);
        }
        values[size++] = value;
        return grownBytes;
    }

    int get(int index) {
        return values[index];
    }

    void set(int index, int value) {
        values[index] = value;
    }

    int last() {
        return values[size - 1];
    }

    int size() {
        return size;
    }

    int[] toArray() {
        return Arrays.copyOf(values, size);
    }

    long ramBytesUsed() {
        return Constants.OBJECT_HEADER_BYTES + Constants.ARRAY_HEADER_BYTES + (long) values.length * Integer.BYTES;
    }

    static long initialRamBytes(int initialCapacity) {
        return Constants.OBJECT_HEADER_BYTES + Constants.ARRAY_HEADER_BYTES + (long) initialCapacity * Integer.BYTES;
    }
}
