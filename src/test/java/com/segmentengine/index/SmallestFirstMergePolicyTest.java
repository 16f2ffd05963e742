package com.segmentengine.index;

import com.segmentengine.config.ConfigurationException;
import com.segmentengine.storage.SegmentMeta;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmallestFirstMergePolicyTest {

    private final SmallestFirstMergePolicy policy = new SmallestFirstMergePolicy();

    static SegmentMeta meta(long sequence, int docCount, long sizeBytes) {
        return new SegmentMeta("s" + sequence, sequence, docCount, docCount, sizeBytes, Instant.EPOCH);
    }

    @Test
    void testNoMergeAtOrBelowTarget() {
        List<SegmentMeta> segments = List.of(meta(1, 10, 100), meta(2, 5, 50));

        assertTrue(policy.findMerge(segments, 2).isEmpty());
        assertTrue(policy.findMerge(segments, 5).isEmpty());
        assertTrue(policy.findMerge(List.of(), 1).isEmpty());
    }

    @Test
    void testSelectsSmallestSegments() {
        List<SegmentMeta> segments = List.of(
            meta(1, 1000, 10_000), meta(2, 10, 100), meta(3, 500, 5_000), meta(4, 20, 200), meta(5, 30, 300));

        List<SegmentMeta> selected = policy.findMerge(segments, 3);

        assertEquals(List.of("s2", "s4", "s5"), selected.stream().map(SegmentMeta::segmentId).toList());
    }

    @Test
    void testTieBreakFavoursOldest() {
        List<SegmentMeta> segments = List.of(
            meta(7, 10, 100), meta(3, 10, 100), meta(5, 10, 100), meta(1, 10, 100));

        List<SegmentMeta> selected = policy.findMerge(segments, 3);

        assertEquals(List.of("s1", "s3"), selected.stream().map(SegmentMeta::segmentId).toList());
    }

    @Test
    void testSizeBreaksDocCountTie() {
        List<SegmentMeta> segments = List.of(meta(1, 10, 300), meta(2, 10, 100), meta(3, 10, 200));

        List<SegmentMeta> selected = policy.findMerge(segments, 2);

        assertEquals(List.of("s2", "s3"), selected.stream().map(SegmentMeta::segmentId).toList());
    }

    @Test
    void testInvalidTarget() {
        assertThrows(ConfigurationException.class, () -> policy.findMerge(List.of(meta(1, 1, 1)), 0));
    }
}
