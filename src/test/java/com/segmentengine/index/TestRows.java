package com.segmentengine.index;

import com.segmentengine.document.Row;
import com.segmentengine.storage.SegmentMeta;
import com.segmentengine.storage.SegmentReader;
import com.segmentengine.storage.SegmentStore;

import java.io.IOException;
import java.util.AbstractList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 测试数据：按需生成的行列表，以及从段中收集行 ID。
 */
final class TestRows {
    private static final String[] WORDS = {
        "segment", "merge", "budget", "flush", "worker", "parallel", "index", "table",
        "postgres", "search", "vacuum", "statement", "shard", "memory", "writer", "reader"
    };

    private TestRows() {
    }

    /**
     * 行 ID 从 1 开始的惰性行列表，不预先分配全部行。
     */
    static List<Row> generate(int count) {
        return new AbstractList<>() {
            @Override
            public Row get(int index) {
                if (index < 0 || index >= count) {
                    throw new IndexOutOfBoundsException(index);
                }
                return Row.of(index + 1L, "key-" + index, body(index));
            }

            @Override
            public int size() {
                return count;
            }
        };
    }

    static String body(int index) {
        return WORDS[index % WORDS.length] + " " + WORDS[(index / 3) % WORDS.length]
            + " term" + (index % 1000) + " 全文索引";
    }

    /**
     * 读出段中全部行 ID，重复出现时抛出断言错误。
     */
    static Set<Long> collectRowIds(SegmentStore store, List<SegmentMeta> segments) throws IOException {
        Set<Long> rowIds = new HashSet<>();
        for (SegmentMeta segment : segments) {
            SegmentReader reader = store.open(segment);
            for (int ordinal = 0; ordinal < reader.docCount(); ordinal++) {
                if (!rowIds.add(reader.rowId(ordinal))) {
                    throw new AssertionError("行重复出现: rowId=" + reader.rowId(ordinal));
                }
            }
        }
        return rowIds;
    }

    static Set<Long> expectedRowIds(int count) {
        Set<Long> rowIds = new HashSet<>();
        for (long rowId = 1; rowId <= count; rowId++) {
            rowIds.add(rowId);
        }
        return rowIds;
    }
}
