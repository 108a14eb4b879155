package com.xpt.worker.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link WorkerPool} over a fixed thread pool with named daemon threads.
 */
public final class ExecutorWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ExecutorWorkerPool.class);

    private static final long SHUTDOWN_WAIT_MINUTES = 5;

    private final ExecutorService executor;
    private final int size;

    public ExecutorWorkerPool(int size) {
        if (size < 1) throw new IllegalArgumentException("Worker count must be positive, got: " + size);
        this.size = size;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "xpt-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Worker pool started | workers={}", size);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MINUTES, TimeUnit.MINUTES)) {
                log.warn("Worker pool did not terminate in {} minutes; forcing shutdown", SHUTDOWN_WAIT_MINUTES);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
