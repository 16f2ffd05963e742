package com.segmentengine.document;

import java.io.IOException;
import java.util.List;

/**
 * 宿主存储引擎提供的行来源，全量建索引时扫描一次。
 */
@FunctionalInterface
public interface RowSource {

    /**
     * 按宿主表物理顺序返回全部行。
     */
    List<Row> scan() throws IOException;
}
