package com.segmentengine.storage;

import java.io.IOException;

/**
 * 可落盘为一个段的内容来源：内存中的倒排缓冲或待合并的若干段。
 */
public interface SegmentContent {

    /**
     * 将写入的文档数。
     */
    int docCount();

    /**
     * 依次写出全部文档与词项。文档须先于词项写出，词项按字典序严格递增。
     *
     * @param writer 段写入器
     * @throws IOException 读取来源或写入失败时抛出
     */
    void writeTo(SegmentWriter writer) throws IOException;
}
