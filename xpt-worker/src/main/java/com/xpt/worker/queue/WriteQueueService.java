package com.xpt.worker.queue;

import com.xpt.storage.StorageCoordinator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Single-writer funnel in front of a {@link StorageCoordinator}.
 * <p>
 * Workers open a {@link Submitter} and submit {@link StoreRequest}s; one writer thread applies them
 * strictly in arrival order, each as one coordinator call. A failing request, including one that throws
 * an {@link Error}, completes its future exceptionally and the writer moves on to the next one.
 * {@link #submit} blocks while the queue is full.
 * <p>
 * {@link #close()} refuses new submitters, waits until every open submitter is closed and the queue
 * is drained, then stops the writer. There is no per-request timeout: a hung backend stalls the writer.
 */
public final class WriteQueueService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WriteQueueService.class);

    private static final String WRITER_THREAD_NAME = "xpt-writer";

    private final StorageCoordinator coordinator;
    private final BlockingQueue<Pending> queue;
    private final Counter applied;
    private final Counter failed;
    private final Object monitor = new Object();
    private final Thread writer;

    private QueueState state = QueueState.IDLE;
    private boolean closing;
    private int openSubmitters;
    private int outstanding;

    public WriteQueueService(StorageCoordinator coordinator, int capacity) {
        this(coordinator, capacity, new SimpleMeterRegistry());
    }

    public WriteQueueService(StorageCoordinator coordinator, int capacity, MeterRegistry registry) {
        if (capacity < 1) throw new IllegalArgumentException("Queue capacity must be positive, got: " + capacity);
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.applied = registry.counter("xpt.queue.applied");
        this.failed = registry.counter("xpt.queue.failed");
        registry.gauge("xpt.queue.depth", queue, BlockingQueue::size);
        this.writer = new Thread(this::drainLoop, WRITER_THREAD_NAME);
        this.writer.setDaemon(true);
        this.writer.start();
        log.info("Write queue started | capacity={} | location={}", capacity, coordinator.location());
    }

    public QueueState state() {
        synchronized (monitor) {
            return state;
        }
    }

    /** Requests queued and not yet applied. */
    public int depth() {
        return queue.size();
    }

    /**
     * Opens a submitter. The queue will not close while it is open.
     *
     * @throws WriteQueueClosedException if the queue is closing or closed
     */
    public Submitter openSubmitter() {
        synchronized (monitor) {
            if (closing) throw new WriteQueueClosedException("Write queue does not accept new submitters", state);
            openSubmitters++;
            return new Submitter();
        }
    }

    /** One-shot convenience: opens a submitter, submits {@code request}, closes the submitter. */
    public CompletableFuture<Integer> submit(StoreRequest request) {
        try (Submitter submitter = openSubmitter()) {
            return submitter.submit(request);
        }
    }

    /**
     * Waits for open submitters and queued requests, then stops the writer and enters {@code CLOSED}.
     * Idempotent.
     */
    @Override
    public void close() {
        synchronized (monitor) {
            if (state == QueueState.CLOSED) return;
            closing = true;
            log.info("Write queue closing | openSubmitters={} | outstanding={}", openSubmitters, outstanding);
            try {
                while (openSubmitters > 0 || outstanding > 0) {
                    monitor.wait();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while draining the write queue", e);
            }
            state = QueueState.CLOSED;
        }
        writer.interrupt();
        try {
            writer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Write queue closed | applied={} | failed={}", (long) applied.count(), (long) failed.count());
    }

    private void drainLoop() {
        while (true) {
            Pending pending;
            try {
                pending = queue.take();
            } catch (InterruptedException e) {
                if (state() == QueueState.CLOSED) return;
                log.warn("Writer interrupted while queue open; continuing");
                continue;
            }
            apply(pending);
        }
    }

    private void apply(Pending pending) {
        synchronized (monitor) {
            state = QueueState.DRAINING;
        }
        try {
            int written = pending.request.apply(coordinator);
            applied.increment();
            if (log.isDebugEnabled()) {
                log.debug("Write applied | request={} | written={}", pending.request.label(), written);
            }
            pending.result.complete(written);
        } catch (RuntimeException e) {
            failed.increment();
            log.warn("Write failed | request={} | error={}", pending.request.label(), e.toString());
            pending.result.completeExceptionally(e);
        } catch (Error e) {
            failed.increment();
            log.error("Write failed with error | request={}", pending.request.label(), e);
            pending.result.completeExceptionally(e);
        } finally {
            synchronized (monitor) {
                outstanding--;
                if (queue.isEmpty()) state = QueueState.IDLE;
                monitor.notifyAll();
            }
        }
    }

    private record Pending(StoreRequest request, CompletableFuture<Integer> result) {
    }

    /**
     * A worker's handle on the queue. Requests from one submitter are applied in submission order.
     * Not shared between threads.
     */
    public final class Submitter implements AutoCloseable {

        private boolean closed;

        private Submitter() {
        }

        /**
         * Queues {@code request}, blocking while the queue is full.
         *
         * @return future completed with the number of records written, or exceptionally with the
         * coordinator's error
         * @throws WriteQueueClosedException if this submitter is closed
         */
        public CompletableFuture<Integer> submit(StoreRequest request) {
            Objects.requireNonNull(request, "request");
            if (closed) throw new WriteQueueClosedException("Submitter is closed", state());
            CompletableFuture<Integer> result = new CompletableFuture<>();
            synchronized (monitor) {
                outstanding++;
            }
            try {
                queue.put(new Pending(request, result));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                synchronized (monitor) {
                    outstanding--;
                    monitor.notifyAll();
                }
                result.completeExceptionally(e);
            }
            return result;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            synchronized (monitor) {
                openSubmitters--;
                monitor.notifyAll();
            }
        }
    }
}
