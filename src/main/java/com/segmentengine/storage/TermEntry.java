package com.segmentengine.storage;

/**
 * 段词典中的一个词条。
 *
 * @param term 字段限定的词项，形如 {@code body:merge}
 * @param docFreq 包含该词项的段内文档数
 * @param postingsOffset 倒排在 postings.inv 中的起始偏移
 * @param positionsOffset 位置在 positions.pos 中的起始偏移
 */
public record TermEntry(String term, int docFreq, long postingsOffset, long positionsOffset) {

    public TermEntry {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (docFreq <= 0 || postingsOffset < 0 || positionsOffset < 0) {
            throw new IllegalArgumentException("词条统计非法: term=" + term + ", docFreq=" + docFreq);
        }
    }
}
