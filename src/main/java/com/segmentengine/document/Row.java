package com.segmentengine.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 宿主表中的一行：行 ID、键字段值以及需要建立全文索引的文本字段。
 *
 * @param rowId 宿主表行 ID
 * @param key 键字段值，不能为空
 * @param fields 字段名到文本的有序映射
 */
public record Row(long rowId, String key, Map<String, String> fields) {

    public Row {
        if (fields == null) {
            fields = Map.of();
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 创建只有 body 字段的行。
     */
    public static Row of(long rowId, String key, String body) {
        return new Row(rowId, key, Map.of(HostTable.BODY_COLUMN, body));
    }

    /**
     * 校验键字段非空。
     *
     * @throws IllegalArgumentException 键为空时抛出
     */
    public void requireKey() {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("键字段不能为 NULL, rowId=" + rowId);
        }
    }
}
