package com.segmentengine.storage;

import java.util.Arrays;

/**
 * 单个词项的倒排列表：段内文档序号、词频与扁平化的位置表。
 *
 * <p>第 i 个文档的位置占据 positions 中连续 termFreqs[i] 个元素，文档内位置严格递增。
 * 构造与读取时都复制数组，外部修改不影响已校验的内容。
 *
 * @param docIds 严格递增的段内文档序号
 * @param termFreqs 与docIds同长度的词频数组
 * @param positions 所有文档的位置，按文档顺序拼接
 */
public record PostingList(int[] docIds, int[] termFreqs, int[] positions) {
    public PostingList {
        if (docIds == null || termFreqs == null || positions == null) {
            throw new IllegalArgumentException("docIds、termFreqs与positions不能为null");
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
        positions = Arrays.copyOf(positions, positions.length);
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds与termFreqs长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        long totalFreq = 0;
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] <= 0) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
            totalFreq += termFreqs[index];
        }
        if (totalFreq != positions.length) {
            throw new IllegalArgumentException("位置数量与词频总和不一致: " + positions.length + " vs " + totalFreq);
        }
    }

    /**
     * 返回倒排项数量。
     */
    public int size() {
        return docIds.length;
    }

    public int docId(int index) {
        return docIds[index];
    }

    public int termFreq(int index) {
        return termFreqs[index];
    }

    public int positionCount() {
        return positions.length;
    }

    /**
     * 把全部位置复制到 target 的 offset 处。
     */
    public void copyPositionsTo(int[] target, int offset) {
        System.arraycopy(positions, 0, target, offset, positions.length);
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public int[] positions() {
        return Arrays.copyOf(positions, positions.length);
    }
}
