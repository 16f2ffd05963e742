package com.segmentengine.index;

import com.segmentengine.config.Constants;
import com.segmentengine.document.Row;
import com.segmentengine.storage.PostingList;
import com.segmentengine.storage.SegmentContent;
import com.segmentengine.storage.SegmentWriter;
import com.segmentengine.text.Token;
import com.segmentengine.text.Tokenizer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存倒排缓冲：一个未落盘段的全部文档与倒排。
 *
 * <p>词项按 {@code 字段:词} 限定。{@link #addDocument} 返回本次新增的保留字节数，
 * 包括词项字符串、哈希表条目、倒排数组的容量增长以及文档的行 ID 与键。
 */
final class DocumentInverter implements SegmentContent {
    private static final int INITIAL_DOC_CAPACITY = 16;
    private static final long TERM_BUFFER_BYTES = Constants.OBJECT_HEADER_BYTES
        + 3L * Constants.REFERENCE_BYTES
        + 3L * IntArrayBuffer.initialRamBytes(Constants.INITIAL_POSTING_CAPACITY);

    private final Tokenizer tokenizer;
    private final Map<String, TermBuffer> postings = new HashMap<>();
    private final List<String> keys = new ArrayList<>();
    private long[] rowIds = new long[INITIAL_DOC_CAPACITY];
    private long ramBytesUsed;

    DocumentInverter(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * 倒排一行。
     *
     * @param row 已校验键字段的行
     * @return 新增保留字节数
     */
    long addDocument(Row row) {
        int ordinal = keys.size();
        long added = growRowIds(ordinal);
        rowIds[ordinal] = row.rowId();
        keys.add(row.key());
        added += Constants.REFERENCE_BYTES + stringBytes(row.key());

        for (Map.Entry<String, String> field : row.fields().entrySet()) {
            if (field.getValue() == null) {
                continue;
            }
            for (Token token : tokenizer.tokenize(field.getValue())) {
                added += addOccurrence(field.getKey() + ":" + token.term(), ordinal, token.position());
            }
        }
        ramBytesUsed += added;
        return added;
    }

    private long addOccurrence(String term, int ordinal, int position) {
        long added = 0;
        TermBuffer buffer = postings.get(term);
        if (buffer == null) {
            buffer = new TermBuffer();
            postings.put(term, buffer);
            added += Constants.HASH_ENTRY_BYTES + stringBytes(term) + TERM_BUFFER_BYTES;
        }
        if (buffer.docIds.size() == 0 || buffer.docIds.last() != ordinal) {
            added += buffer.docIds.add(ordinal);
            added += buffer.termFreqs.add(1);
        } else {
            int last = buffer.termFreqs.size() - 1;
            buffer.termFreqs.set(last, buffer.termFreqs.get(last) + 1);
        }
        added += buffer.positions.add(position);
        return added;
    }

    private long growRowIds(int ordinal) {
        if (ordinal < rowIds.length) {
            return 0;
        }
        int newCapacity = rowIds.length + (rowIds.length >> 1);
        long grown = (long) (newCapacity - rowIds.length) * Long.BYTES;
        rowIds = Arrays.copyOf(rowIds, newCapacity);
        return grown;
    }

    private static long stringBytes(String value) {
        return Constants.STRING_HEADER_BYTES + (long) value.length() * Character.BYTES;
    }

    @Override
    public int docCount() {
        return keys.size();
    }

    int termCount() {
        return postings.size();
    }

    long ramBytesUsed() {
        return ramBytesUsed;
    }

    @Override
    public void writeTo(SegmentWriter writer) throws IOException {
        for (int ordinal = 0; ordinal < keys.size(); ordinal++) {
            writer.addDocument(rowIds[ordinal], keys.get(ordinal));
        }
        List<String> terms = new ArrayList<>(postings.keySet());
        terms.sort(null);
        for (String term : terms) {
            TermBuffer buffer = postings.get(term);
            writer.addTerm(term, new PostingList(
                buffer.docIds.toArray(), buffer.termFreqs.toArray(), buffer.positions.toArray()));
        }
    }

    private static final class TermBuffer {
        private final IntArrayBuffer docIds = new IntArrayBuffer(Constants.INITIAL_POSTING_CAPACITY);
        private final IntArrayBuffer termFreqs = new IntArrayBuffer(Constants.INITIAL_POSTING_CAPACITY);
        private final IntArrayBuffer positions = new IntArrayBuffer(Constants.INITIAL_POSTING_CAPACITY);
    }
}
