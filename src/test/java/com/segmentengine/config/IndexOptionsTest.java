package com.segmentengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexOptionsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("默认目标段数取主机处理器数，默认开启插入即合并")
    void testDefaults() {
        IndexOptions options = IndexOptions.defaults(() -> 6);

        assertEquals(6, options.targetSegmentCount());
        assertTrue(options.mergeOnInsert());
    }

    @Test
    @DisplayName("目标段数必须为正数")
    void testRejectsNonPositiveTarget() {
        assertThrows(ConfigurationException.class, () -> new IndexOptions(0, true));
        assertThrows(ConfigurationException.class, () -> new IndexOptions(-3, false));
    }

    @Test
    @DisplayName("alter 只修改指定项，目标段数置 0 时重新取处理器数")
    void testAlter() {
        IndexOptions options = new IndexOptions(4, true);

        IndexOptions onlyMerge = options.alter(null, false, () -> 16);
        assertEquals(4, onlyMerge.targetSegmentCount());
        assertFalse(onlyMerge.mergeOnInsert());

        IndexOptions rederived = options.alter(0, null, () -> 16);
        assertEquals(16, rederived.targetSegmentCount());
        assertTrue(rederived.mergeOnInsert());

        assertThrows(ConfigurationException.class, () -> options.alter(-1, null, () -> 16));
    }

    @Test
    @DisplayName("选项写入后可读回")
    void testPersistence() throws IOException {
        Path file = tempDir.resolve(Constants.INDEX_OPTIONS_FILE);
        IndexOptions options = new IndexOptions(7, false);

        options.writeTo(file);

        assertEquals(options, IndexOptions.readFrom(file));
    }
}
