package com.segmentengine.index;

import com.segmentengine.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个构建作业独占的固定大小线程池，作业结束时关闭。不同作业之间不共享线程。
 */
final class IndexWorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IndexWorkerPool.class);

    private final String name;
    private final ExecutorService executor;

    /**
     * @param name 线程名中段，例如 create-index
     * @param size 线程数，0 表示作业没有 worker
     */
    IndexWorkerPool(String name, int size) {
        this.name = name;
        this.executor = size == 0 ? null : Executors.newFixedThreadPool(size, new WorkerThreadFactory(name));
    }

    <T> Future<T> submit(Callable<T> task) {
        if (executor == null) {
            throw new IllegalStateException("线程池没有 worker: " + name);
        }
        return executor.submit(task);
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("worker 线程池未能按时退出，强制中断: pool={}", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerThreadFactory(String name) {
            this.prefix = "segment-build-" + name + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
