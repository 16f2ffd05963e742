package com.segmentengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WriterResourcesTest {

    @Test
    @DisplayName("并行度 0 取主机处理器数，显式值原样返回")
    void testResolveParallelism() {
        assertEquals(12, WriterResources.resolveParallelism(0, () -> 12));
        assertEquals(3, WriterResources.resolveParallelism(3, () -> 12));
        assertEquals(1, WriterResources.resolveParallelism(0, () -> 0));
        assertThrows(ConfigurationException.class, () -> WriterResources.resolveParallelism(-1, () -> 12));
    }

    @Test
    @DisplayName("预算未设置时由维护内存按并行度均分，且不少于 1MB")
    void testResolveMemoryBudget() {
        assertEquals(16 * Constants.BYTES_PER_MB, WriterResources.resolveMemoryBudgetBytes(16, 64, 4));
        assertEquals(16 * Constants.BYTES_PER_MB, WriterResources.resolveMemoryBudgetBytes(0, 64, 4));
        assertEquals(64 * Constants.BYTES_PER_MB, WriterResources.resolveMemoryBudgetBytes(0, 64, 1));
        assertEquals(Constants.BYTES_PER_MB, WriterResources.resolveMemoryBudgetBytes(0, 4, 16));
        assertThrows(ConfigurationException.class, () -> WriterResources.resolveMemoryBudgetBytes(-1, 64, 4));
    }

    @Test
    @DisplayName("建索引读取建索引设置，语句与维护读取语句设置")
    void testProfilesReadTheirOwnSettings() {
        EngineConfig config = EngineConfig.defaults();
        config.setCreateIndexParallelism(8);
        config.setCreateIndexMemoryBudgetMb(100);
        config.setStatementParallelism(2);
        config.setStatementMemoryBudgetMb(5);

        assertEquals(8, WriterResources.CREATE_INDEX.requestedParallelism(config));
        assertEquals(100, WriterResources.CREATE_INDEX.requestedMemoryBudgetMb(config));
        assertEquals(2, WriterResources.STATEMENT.requestedParallelism(config));
        assertEquals(5, WriterResources.STATEMENT.requestedMemoryBudgetMb(config));
        assertEquals(2, WriterResources.VACUUM.requestedParallelism(config));
        assertEquals(5, WriterResources.VACUUM.requestedMemoryBudgetMb(config));
    }

    @Test
    @DisplayName("只有语句档位受 mergeOnInsert 控制")
    void testDoMerging() {
        IndexOptions deferred = new IndexOptions(4, false);
        IndexOptions eager = new IndexOptions(4, true);

        assertTrue(WriterResources.CREATE_INDEX.doMerging(deferred));
        assertTrue(WriterResources.VACUUM.doMerging(deferred));
        assertFalse(WriterResources.STATEMENT.doMerging(deferred));
        assertTrue(WriterResources.STATEMENT.doMerging(eager));
    }
}
