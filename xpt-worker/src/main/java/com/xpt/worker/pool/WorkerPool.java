package com.xpt.worker.pool;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Bounded set of workers executing independent tasks.
 */
public interface WorkerPool extends AutoCloseable {

    <T> Future<T> submit(Callable<T> task);

    /** Number of workers. */
    int size();

    /** Stops accepting tasks and waits for running ones. */
    @Override
    void close();
}
