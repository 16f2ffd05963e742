package com.segmentengine.index;

import com.segmentengine.storage.PostingList;
import com.segmentengine.storage.SegmentContent;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentReader;
import com.segmentengine.storage.SegmentStore;
import com.segmentengine.storage.SegmentWriter;
import com.segmentengine.storage.TermEntry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 把若干段合并为一个新段：源段按创建序号排列，文档依次拼接，
 * 倒排按词项合并并把文档序号平移到新段内。
 */
final class SegmentMerger {
    private final SegmentStore store;

    SegmentMerger(SegmentStore store) {
        this.store = store;
    }

    /**
     * 合并并写出新段。失败时不留下新段。
     *
     * @param sources 源段
     * @param sequence 新段序号
     * @return 新段
     * @throws MergeFailureException 源段缺失、损坏或写出失败
     */
    SegmentMeta merge(List<SegmentMeta> sources, long sequence) throws MergeFailureException {
        List<SegmentMeta> ordered = new ArrayList<>(sources);
        ordered.sort(Comparator.comparingLong(SegmentMeta::sequence));
        List<SegmentReader> readers = new ArrayList<>(ordered.size());
        for (SegmentMeta source : ordered) {
            try {
                readers.add(store.open(source));
            } catch (IOException exception) {
                throw new MergeFailureException("无法打开源段: " + source.segmentId(), exception);
            }
        }

        MergedContent content = new MergedContent(readers);
        SegmentMeta merged;
        try {
            merged = store.write(sequence, content);
        } catch (IOException exception) {
            throw new MergeFailureException("写出合并段失败: sources=" + ordered.size(), exception);
        }
        if (merged.docCount() != content.docCount()) {
            MergeFailureException failure = new MergeFailureException(
                "合并段文档数不一致: expected=" + content.docCount() + ", actual=" + merged.docCount());
            discard(merged, failure);
            throw failure;
        }
        return merged;
    }

    /**
     * 删除合并产出的段，删除失败附加到主异常上。
     */
    void discard(SegmentMeta merged, Exception primary) {
        try {
            store.delete(merged.segmentId());
        } catch (IOException exception) {
            primary.addSuppressed(exception);
        }
    }

    private static final class MergedContent implements SegmentContent {
        private final List<SegmentReader> readers;
        private final int[] docBases;
        private final int docCount;

        private MergedContent(List<SegmentReader> readers) {
            this.readers = readers;
            this.docBases = new int[readers.size()];
            int total = 0;
            for (int index = 0; index < readers.size(); index++) {
                docBases[index] = total;
                total = Math.addExact(total, readers.get(index).docCount());
            }
            this.docCount = total;
        }

        @Override
        public int docCount() {
            return docCount;
        }

        @Override
        public void writeTo(SegmentWriter writer) throws IOException {
            Map<String, List<SourceTerm>> terms = new TreeMap<>();
            for (int readerIndex = 0; readerIndex < readers.size(); readerIndex++) {
                SegmentReader reader = readers.get(readerIndex);
                for (int ordinal = 0; ordinal < reader.docCount(); ordinal++) {
                    writer.addDocument(reader.rowId(ordinal), reader.key(ordinal));
                }
                for (TermEntry entry : reader.terms()) {
                    terms.computeIfAbsent(entry.term(), term -> new ArrayList<>()).add(new SourceTerm(readerIndex, entry));
                }
            }
            for (Map.Entry<String, List<SourceTerm>> term : terms.entrySet()) {
                writer.addTerm(term.getKey(), mergePostings(term.getValue()));
            }
        }

        private PostingList mergePostings(List<SourceTerm> sourceTerms) throws IOException {
            List<PostingList> lists = new ArrayList<>(sourceTerms.size());
            int size = 0;
            int positionCount = 0;
            for (SourceTerm sourceTerm : sourceTerms) {
                PostingList list = readers.get(sourceTerm.readerIndex()).readPostings(sourceTerm.entry());
                lists.add(list);
                size += list.size();
                positionCount += list.positionCount();
            }
            int[] docIds = new int[size];
            int[] termFreqs = new int[size];
            int[] positions = new int[positionCount];
            int docOffset = 0;
            int positionOffset = 0;
            for (int index = 0; index < lists.size(); index++) {
                PostingList list = lists.get(index);
                int base = docBases[sourceTerms.get(index).readerIndex()];
                for (int posting = 0; posting < list.size(); posting++) {
                    docIds[docOffset] = list.docId(posting) + base;
                    termFreqs[docOffset] = list.termFreq(posting);
                    docOffset++;
                }
                list.copyPositionsTo(positions, positionOffset);
                positionOffset += list.positionCount();
            }
            return new PostingList(docIds, termFreqs, positions);
        }
    }

    private record SourceTerm(int readerIndex, TermEntry entry) {
    }
}
