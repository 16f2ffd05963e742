package com.segmentengine.index;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressReporterTest {

    @Test
    void testDisabledReporterIsNoOp() {
        ProgressReporter reporter = ProgressReporter.disabled();

        assertFalse(reporter.isEnabled());
        reporter.counter(0).increment();
        reporter.counter(3).increment();
        assertEquals(0L, reporter.totalRows());
        reporter.close();
    }

    @Test
    void testReportsEveryIntervalAcrossWorkers() throws InterruptedException {
        List<Long> reported = new CopyOnWriteArrayList<>();
        List<Double> rates = new CopyOnWriteArrayList<>();
        ProgressReporter reporter = ProgressReporter.start(2, 10, 5, (rows, elapsedSeconds, rowsPerSecond) -> {
            reported.add(rows);
            rates.add(rowsPerSecond);
        });
        assertTrue(reporter.isEnabled());

        Thread[] workers = new Thread[2];
        for (int workerIndex = 0; workerIndex < workers.length; workerIndex++) {
            ProgressReporter.WorkerCounter counter = reporter.counter(workerIndex);
            workers[workerIndex] = new Thread(() -> {
                for (int row = 0; row < 25; row++) {
                    counter.increment();
                }
            });
            workers[workerIndex].start();
        }
        for (Thread worker : workers) {
            worker.join();
        }
        reporter.close();

        assertEquals(List.of(10L, 20L, 30L, 40L, 50L), reported);
        assertEquals(50L, reporter.totalRows());
        assertTrue(rates.stream().allMatch(rate -> rate > 0));
    }

    @Test
    void testNoReportBelowInterval() {
        List<Long> reported = new CopyOnWriteArrayList<>();
        ProgressReporter reporter = ProgressReporter.start(1, 100, 5, (rows, elapsedSeconds, rowsPerSecond) -> reported.add(rows));

        ProgressReporter.WorkerCounter counter = reporter.counter(0);
        for (int row = 0; row < 99; row++) {
            counter.increment();
        }
        reporter.close();

        assertTrue(reported.isEmpty());
    }
}
