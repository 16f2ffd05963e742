package com.segmentengine.storage;

/**
 * Delta编码器
 * 
 * 将严格递增的整数序列（段内文档序号、文档内位置）转换为相邻差值，
 * 配合VarInt编码减少存储空间。示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {
    
    private DeltaCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 对 values[from, from + length) 做Delta编码，结果写入新数组
     * 
     * @param values 源数组
     * @param from 起始下标
     * @param length 元素个数
     * @return Delta数组
     * @throws IllegalArgumentException 区间内不是非负严格递增序列时抛出
     */
    public static int[] encode(int[] values, int from, int length) {
        int[] deltas = new int[length];
        int previous = 0;
        for (int i = 0; i < length; i++) {
            int current = values[from + i];
            if (current < 0 || (i > 0 && current <= previous)) {
                throw new IllegalArgumentException("输入必须是非负严格递增序列，在位置 " + (from + i) + " 处违反");
            }
            deltas[i] = i == 0 ? current : current - previous;
            previous = current;
        }
        return deltas;
    }
    
    /**
     * 原地把Delta数组还原为绝对值
     * 
     * @param deltas Delta编码后的数组
     * @return 同一数组，已还原
     */
    public static int[] decodeInPlace(int[] deltas) {
        for (int i = 1; i < deltas.length; i++) {
            deltas[i] += deltas[i - 1];
        }
        return deltas;
    }
}
