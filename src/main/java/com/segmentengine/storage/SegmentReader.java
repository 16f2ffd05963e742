package com.segmentengine.storage;

import com.segmentengine.config.Constants;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 段读取器。打开时一次性读入并校验四个段文件，之后的读取都在内存中完成。
 */
public final class SegmentReader {
    private final String segmentId;
    private final long[] rowIds;
    private final String[] keys;
    private final List<TermEntry> terms;
    private final ByteBuffer postingsBuffer;
    private final ByteBuffer positionsBuffer;

    /**
     * 打开段目录。
     *
     * @param directory 段目录
     * @param segmentId 段标识，用于错误信息
     * @throws IOException 文件缺失、校验失败或内容不一致时抛出
     */
    public SegmentReader(Path directory, String segmentId) throws IOException {
        this.segmentId = segmentId;
        ByteBuffer docsBuffer = StorageFileUtil.readVerified(directory.resolve(Constants.DOCS_FILE), Constants.DOCS_MAGIC);
        int docCount = StorageFileUtil.readTrailerCount(docsBuffer, Constants.DOCS_FILE);
        this.rowIds = new long[docCount];
        this.keys = new String[docCount];
        readDocuments(docsBuffer);

        ByteBuffer termsBuffer = StorageFileUtil.readVerified(directory.resolve(Constants.TERMS_FILE), Constants.TERMS_MAGIC);
        int termCount = StorageFileUtil.readTrailerCount(termsBuffer, Constants.TERMS_FILE);
        this.terms = Collections.unmodifiableList(readTerms(termsBuffer, termCount));

        this.postingsBuffer = StorageFileUtil.readVerified(directory.resolve(Constants.POSTINGS_FILE), Constants.POSTINGS_MAGIC);
        this.positionsBuffer = StorageFileUtil.readVerified(directory.resolve(Constants.POSITIONS_FILE), Constants.POSITIONS_MAGIC);
    }

    private void readDocuments(ByteBuffer buffer) throws IOException {
        int end = buffer.limit() - Integer.BYTES;
        for (int ordinal = 0; ordinal < rowIds.length; ordinal++) {
            rowIds[ordinal] = VarIntCodec.readVarLong(buffer);
            int keyLength = VarIntCodec.readVarInt(buffer);
            if (keyLength > end - buffer.position()) {
                throw new IOException("文档键长度越界: segment=" + segmentId + ", ordinal=" + ordinal);
            }
            byte[] keyBytes = new byte[keyLength];
            buffer.get(keyBytes);
            keys[ordinal] = new String(keyBytes, StandardCharsets.UTF_8);
        }
        if (buffer.position() != end) {
            throw new IOException("文档表长度与计数不一致: segment=" + segmentId);
        }
    }

    private List<TermEntry> readTerms(ByteBuffer buffer, int termCount) throws IOException {
        int end = buffer.limit() - Integer.BYTES;
        List<TermEntry> entries = new ArrayList<>(termCount);
        for (int index = 0; index < termCount; index++) {
            int termLength = VarIntCodec.readVarInt(buffer);
            if (termLength > end - buffer.position()) {
                throw new IOException("词项长度越界: segment=" + segmentId + ", index=" + index);
            }
            byte[] termBytes = new byte[termLength];
            buffer.get(termBytes);
            int docFreq = VarIntCodec.readVarInt(buffer);
            long postingsOffset = VarIntCodec.readVarLong(buffer);
            long positionsOffset = VarIntCodec.readVarLong(buffer);
            try {
                entries.add(new TermEntry(new String(termBytes, StandardCharsets.UTF_8), docFreq, postingsOffset, positionsOffset));
            } catch (IllegalArgumentException exception) {
                throw new IOException("词典数据损坏: segment=" + segmentId + ", index=" + index, exception);
            }
        }
        if (buffer.position() != end) {
            throw new IOException("词典长度与计数不一致: segment=" + segmentId);
        }
        return entries;
    }

    public String segmentId() {
        return segmentId;
    }

    public int docCount() {
        return rowIds.length;
    }

    public int termCount() {
        return terms.size();
    }

    public long rowId(int ordinal) {
        return rowIds[ordinal];
    }

    public String key(int ordinal) {
        return keys[ordinal];
    }

    /**
     * 按字典序排列的全部词条。
     */
    public List<TermEntry> terms() {
        return terms;
    }

    /**
     * 读取词条对应的倒排与位置。
     *
     * @param entry 本段词典中的词条
     * @return 倒排列表
     * @throws IOException 偏移非法或数据损坏时抛出
     */
    public PostingList readPostings(TermEntry entry) throws IOException {
        ByteBuffer postings = slice(postingsBuffer, entry.postingsOffset(), entry.term());
        int size = VarIntCodec.readVarInt(postings);
        if (size != entry.docFreq() || size == 0) {
            throw new IOException("倒排长度与词典不一致: segment=" + segmentId + ", term=" + entry.term());
        }
        int[] docIds = new int[size];
        for (int index = 0; index < size; index++) {
            docIds[index] = VarIntCodec.readVarInt(postings);
        }
        DeltaCodec.decodeInPlace(docIds);
        if (docIds[size - 1] >= rowIds.length || docIds[size - 1] < 0) {
            throw new IOException("倒排引用了不存在的文档: segment=" + segmentId + ", term=" + entry.term());
        }
        int[] termFreqs = new int[size];
        long totalFreq = 0;
        for (int index = 0; index < size; index++) {
            termFreqs[index] = VarIntCodec.readVarInt(postings);
            totalFreq += termFreqs[index];
        }
        if (totalFreq > Integer.MAX_VALUE) {
            throw new IOException("词频总和溢出: segment=" + segmentId + ", term=" + entry.term());
        }

        ByteBuffer positionsSlice = slice(positionsBuffer, entry.positionsOffset(), entry.term());
        int[] positions = new int[(int) totalFreq];
        int offset = 0;
        for (int index = 0; index < size; index++) {
            int previous = 0;
            for (int occurrence = 0; occurrence < termFreqs[index]; occurrence++) {
                previous += VarIntCodec.readVarInt(positionsSlice);
                positions[offset++] = previous;
            }
        }
        try {
            return new PostingList(docIds, termFreqs, positions);
        } catch (IllegalArgumentException exception) {
            throw new IOException("倒排数据损坏: segment=" + segmentId + ", term=" + entry.term(), exception);
        }
    }

    private ByteBuffer slice(ByteBuffer source, long offset, String term) throws IOException {
        if (offset < StorageFileUtil.HEADER_BYTES || offset >= source.limit()) {
            throw new IOException("无效偏移: segment=" + segmentId + ", term=" + term + ", offset=" + offset);
        }
        ByteBuffer view = source.duplicate();
        view.position((int) offset);
        return view;
    }
}
