package com.segmentengine.index;

import com.segmentengine.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * 建索引进度汇报。
 *
 * <p>每个 worker 只写自己的计数槽；一个汇报线程定期汇总，每跨过一个行数边界输出一条记录。
 * 关闭时再汇总一次。{@link #disabled()} 不启动线程也不计数。
 */
public class ProgressReporter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    /** 默认输出到日志 */
    public static final ProgressListener LOGGING = (rows, elapsedSeconds, rowsPerSecond) ->
        logger.info("processed {} rows in {} seconds ({} per second)",
            rows, String.format("%.2f", elapsedSeconds), String.format("%.2f", rowsPerSecond));

    private static final WorkerCounter NO_OP_COUNTER = () -> {
    };

    private static final ProgressReporter DISABLED = new ProgressReporter();

    private final AtomicLongArray counts;
    private final long intervalRows;
    private final ProgressListener listener;
    private final long startNanos;
    private final ScheduledExecutorService poller;
    private long nextBoundary;

    private ProgressReporter() {
        this.counts = null;
        this.intervalRows = 0;
        this.listener = null;
        this.startNanos = 0;
        this.poller = null;
    }

    private ProgressReporter(int workerCount, long intervalRows, long pollIntervalMs, ProgressListener listener) {
        if (intervalRows <= 0) {
            throw new IllegalArgumentException("进度间隔必须为正数: " + intervalRows);
        }
        this.counts = new AtomicLongArray(Math.max(workerCount, 1));
        this.intervalRows = intervalRows;
        this.listener = listener;
        this.nextBoundary = intervalRows;
        this.startNanos = System.nanoTime();
        this.poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "segment-build-progress");
            thread.setDaemon(true);
            return thread;
        });
        this.poller.scheduleWithFixedDelay(this::poll, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 关闭的汇报器。
     */
    public static ProgressReporter disabled() {
        return DISABLED;
    }

    /**
     * 启动汇报器，每 {@link Constants#PROGRESS_LOG_INTERVAL_ROWS} 行输出一次。
     *
     * @param workerCount worker 数
     * @param listener 记录接收方
     * @return 汇报器
     */
    public static ProgressReporter start(int workerCount, ProgressListener listener) {
        return start(workerCount, Constants.PROGRESS_LOG_INTERVAL_ROWS, Constants.PROGRESS_POLL_INTERVAL_MS, listener);
    }

    static ProgressReporter start(int workerCount, long intervalRows, long pollIntervalMs, ProgressListener listener) {
        return new ProgressReporter(workerCount, intervalRows, pollIntervalMs, listener);
    }

    public boolean isEnabled() {
        return poller != null;
    }

    /**
     * 返回第 workerIndex 个 worker 的计数器，只能由该 worker 线程使用。
     */
    public WorkerCounter counter(int workerIndex) {
        if (!isEnabled()) {
            return NO_OP_COUNTER;
        }
        return new SlotCounter(counts, workerIndex);
    }

    /**
     * 已汇总的总行数。
     */
    public long totalRows() {
        if (!isEnabled()) {
            return 0;
        }
        long total = 0;
        for (int index = 0; index < counts.length(); index++) {
            total += counts.get(index);
        }
        return total;
    }

    private void poll() {
        try {
            drain();
        } catch (RuntimeException exception) {
            logger.warn("进度汇报失败", exception);
        }
    }

    private synchronized void drain() {
        long total = totalRows();
        while (total >= nextBoundary) {
            double elapsedSeconds = Math.max((System.nanoTime() - startNanos) / 1_000_000_000.0, 1e-9);
            listener.onProgress(nextBoundary, elapsedSeconds, nextBoundary / elapsedSeconds);
            nextBoundary += intervalRows;
        }
    }

    @Override
    public void close() {
        if (!isEnabled()) {
            return;
        }
        poller.shutdown();
        try {
            if (!poller.awaitTermination(Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            poller.shutdownNow();
        }
        drain();
    }

    /**
     * 进度记录接收方。
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(long rows, double elapsedSeconds, double rowsPerSecond);
    }

    /**
     * worker 私有的行计数器。
     */
    @FunctionalInterface
    public interface WorkerCounter {
        void increment();
    }

    private static final class SlotCounter implements WorkerCounter {
        private final AtomicLongArray counts;
        private final int slot;
        private long local;

        private SlotCounter(AtomicLongArray counts, int slot) {
            this.counts = counts;
            this.slot = slot;
        }

        @Override
        public void increment() {
            counts.lazySet(slot, ++local);
        }
    }
}
