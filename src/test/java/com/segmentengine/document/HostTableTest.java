package com.segmentengine.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HostTableTest {

    @TempDir
    Path tempDir;

    @Test
    void testInsertAndFind() {
        try (HostTable table = new HostTable(tempDir.resolve("rows.db"))) {
            Row inserted = table.insert("doc-1", "标题", "hello segment");

            assertTrue(inserted.rowId() > 0);
            Optional<Row> found = table.findByRowId(inserted.rowId());
            assertTrue(found.isPresent());
            assertEquals("doc-1", found.get().key());
            assertEquals("标题", found.get().fields().get(HostTable.TITLE_COLUMN));
            assertEquals("hello segment", found.get().fields().get(HostTable.BODY_COLUMN));
            assertFalse(table.findByRowId(inserted.rowId() + 100).isPresent());
        }
    }

    @Test
    void testInsertAllAssignsIncreasingRowIds() {
        try (HostTable table = new HostTable(tempDir.resolve("rows.db"))) {
            List<Row> inserted = table.insertAll(List.of(
                Row.of(0, "a", "first"),
                Row.of(0, "b", "second"),
                Row.of(0, "c", "third")));

            assertEquals(3, inserted.size());
            assertTrue(inserted.get(0).rowId() < inserted.get(1).rowId());
            assertTrue(inserted.get(1).rowId() < inserted.get(2).rowId());
            assertEquals(3, table.count());
        }
    }

    @Test
    void testNullKeyRejectedWithoutPartialInsert() {
        try (HostTable table = new HostTable(tempDir.resolve("rows.db"))) {
            List<Row> rows = List.of(
                Row.of(0, "a", "first"),
                new Row(0, null, Map.of(HostTable.BODY_COLUMN, "no key")));

            assertThrows(IllegalArgumentException.class, () -> table.insertAll(rows));
            assertEquals(0, table.count());
        }
    }

    @Test
    void testScanReturnsRowsInRowIdOrder() {
        try (HostTable table = new HostTable(tempDir.resolve("rows.db"))) {
            table.insert("k1", null, "one");
            table.insert("k2", "t", "two");

            List<Row> rows = table.scan();

            assertEquals(List.of("k1", "k2"), rows.stream().map(Row::key).toList());
            assertFalse(rows.get(0).fields().containsKey(HostTable.TITLE_COLUMN));
        }
    }
}
