package com.segmentengine.storage;

import java.io.IOException;
import java.util.List;

/**
 * 段的持久化存储。写入成功返回时段已完整落盘且不可再修改。
 */
public interface SegmentStore {

    /**
     * 将内容写为一个新段。失败时不留下任何可见的段。
     *
     * @param sequence 段创建序号
     * @param content 段内容
     * @return 新段元数据
     * @throws IOException 写入失败时抛出
     */
    SegmentMeta write(long sequence, SegmentContent content) throws IOException;

    /**
     * 打开已持久化的段。
     *
     * @param meta 段元数据
     * @return 段读取器
     * @throws IOException 段缺失或损坏时抛出
     */
    SegmentReader open(SegmentMeta meta) throws IOException;

    /**
     * 删除段的全部文件，段不存在时静默返回。
     *
     * @param segmentId 段标识
     * @throws IOException 删除失败时抛出
     */
    void delete(String segmentId) throws IOException;

    /**
     * 列出存储中全部已完成写入的段标识。
     *
     * @return 段标识列表
     * @throws IOException 列目录失败时抛出
     */
    List<String> listSegmentIds() throws IOException;

    /**
     * 清理写入中断留下的临时段目录。
     *
     * @return 清理的目录数
     * @throws IOException 删除失败时抛出
     */
    int sweepTemporary() throws IOException;
}
