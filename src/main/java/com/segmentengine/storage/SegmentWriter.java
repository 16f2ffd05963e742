package com.segmentengine.storage;

import com.segmentengine.config.Constants;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * 段写入器，把一个段的文档表、词典、倒排与位置顺序写入段目录下的四个文件。
 *
 * <p>调用顺序：先 {@link #addDocument} 写完全部文档，再按字典序严格递增调用 {@link #addTerm}，
 * 最后 {@link #finish}。任一文件写入失败时调用方负责删除整个目录。
 */
public final class SegmentWriter implements AutoCloseable {
    private final SegmentFileOutput docsOutput;
    private final SegmentFileOutput termsOutput;
    private final SegmentFileOutput postingsOutput;
    private final SegmentFileOutput positionsOutput;
    private int docCount;
    private int termCount;
    private String lastTerm;
    private boolean finished;

    /**
     * 在目录下创建四个段文件并写入文件头。
     *
     * @param directory 已存在的段目录
     * @throws IOException 创建文件失败时抛出
     */
    public SegmentWriter(Path directory) throws IOException {
        if (directory == null) {
            throw new IllegalArgumentException("段目录不能为空");
        }
        SegmentFileOutput docs = null;
        SegmentFileOutput terms = null;
        SegmentFileOutput postings = null;
        try {
            docs = new SegmentFileOutput(directory.resolve(Constants.DOCS_FILE), Constants.DOCS_MAGIC);
            terms = new SegmentFileOutput(directory.resolve(Constants.TERMS_FILE), Constants.TERMS_MAGIC);
            postings = new SegmentFileOutput(directory.resolve(Constants.POSTINGS_FILE), Constants.POSTINGS_MAGIC);
            this.positionsOutput = new SegmentFileOutput(directory.resolve(Constants.POSITIONS_FILE), Constants.POSITIONS_MAGIC);
        } catch (IOException exception) {
            closeQuietly(exception, docs, terms, postings);
            throw exception;
        }
        this.docsOutput = docs;
        this.termsOutput = terms;
        this.postingsOutput = postings;
    }

    /**
     * 追加一个文档，返回其段内序号。
     *
     * @param rowId 宿主表行标识
     * @param key 键字段值
     * @return 段内文档序号，从 0 开始
     * @throws IOException 写入失败时抛出
     */
    public int addDocument(long rowId, String key) throws IOException {
        ensureWritable();
        if (termCount > 0) {
            throw new IllegalStateException("文档必须在词项之前写入");
        }
        if (key == null) {
            throw new IllegalArgumentException("键字段不能为 NULL");
        }
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        docsOutput.writeVarLong(rowId);
        docsOutput.writeVarInt(keyBytes.length);
        docsOutput.writeBytes(keyBytes);
        return docCount++;
    }

    /**
     * 写入一个词项及其倒排与位置。
     *
     * @param term 词项，必须大于上一个写入的词项
     * @param postings 倒排列表，文档序号必须小于已写入文档数
     * @throws IOException 写入失败时抛出
     */
    public void addTerm(String term, PostingList postings) throws IOException {
        ensureWritable();
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (lastTerm != null && term.compareTo(lastTerm) <= 0) {
            throw new IllegalArgumentException("term 必须严格递增，last=" + lastTerm + ", current=" + term);
        }
        if (postings.size() == 0) {
            throw new IllegalArgumentException("倒排列表不能为空: " + term);
        }
        if (postings.docId(postings.size() - 1) >= docCount) {
            throw new IllegalArgumentException("倒排引用了不存在的文档: term=" + term);
        }

        long postingsOffset = postingsOutput.position();
        long positionsOffset = positionsOutput.position();
        writePostings(postings);
        writePositions(postings);

        byte[] termBytes = term.getBytes(StandardCharsets.UTF_8);
        termsOutput.writeVarInt(termBytes.length);
        termsOutput.writeBytes(termBytes);
        termsOutput.writeVarInt(postings.size());
        termsOutput.writeVarLong(postingsOffset);
        termsOutput.writeVarLong(positionsOffset);

        termCount++;
        lastTerm = term;
    }

    private void writePostings(PostingList postings) throws IOException {
        int size = postings.size();
        postingsOutput.writeVarInt(size);
        int[] docDeltas = DeltaCodec.encode(postings.docIds(), 0, size);
        for (int delta : docDeltas) {
            postingsOutput.writeVarInt(delta);
        }
        for (int index = 0; index < size; index++) {
            postingsOutput.writeVarInt(postings.termFreq(index));
        }
    }

    private void writePositions(PostingList postings) throws IOException {
        int[] positions = postings.positions();
        int offset = 0;
        for (int index = 0; index < postings.size(); index++) {
            int freq = postings.termFreq(index);
            for (int delta : DeltaCodec.encode(positions, offset, freq)) {
                positionsOutput.writeVarInt(delta);
            }
            offset += freq;
        }
    }

    /**
     * 写入计数尾与 CRC32 页脚并落盘。
     *
     * @return 写入统计
     * @throws IOException 落盘失败时抛出
     */
    public Result finish() throws IOException {
        ensureWritable();
        finished = true;
        docsOutput.writeInt(docCount);
        termsOutput.writeInt(termCount);
        long sizeBytes = docsOutput.finish()
            + termsOutput.finish()
            + postingsOutput.finish()
            + positionsOutput.finish();
        return new Result(docCount, termCount, sizeBytes);
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (SegmentFileOutput output : new SegmentFileOutput[] {docsOutput, termsOutput, postingsOutput, positionsOutput}) {
            try {
                output.close();
            } catch (IOException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void ensureWritable() {
        if (finished) {
            throw new IllegalStateException("SegmentWriter 已完成写入");
        }
    }

    private static void closeQuietly(IOException primary, SegmentFileOutput... outputs) {
        for (SegmentFileOutput output : outputs) {
            if (output == null) {
                continue;
            }
            try {
                output.close();
            } catch (IOException exception) {
                primary.addSuppressed(exception);
            }
        }
    }

    /**
     * 段写入统计。
     *
     * @param docCount 文档数
     * @param termCount 词项数
     * @param sizeBytes 四个数据文件的总字节数
     */
    public record Result(int docCount, int termCount, long sizeBytes) {
    }
}
