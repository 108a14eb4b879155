package com.xpt.worker.queue;

import com.xpt.storage.StorageCoordinator;
import com.xpt.storage.record.TrajectoryDescriptor;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.Result;
import com.xpt.tree.snapshot.NodeSnapshot;
import com.xpt.tree.snapshot.NodeSnapshots;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WriteQueueServiceTest {

    private final NodeTree tree = new NodeTree();
    private final MeterRegistry registry = new SimpleMeterRegistry();
    private WriteQueueService queue;

    @AfterEach
    void tearDown() {
        if (queue != null) queue.close();
    }

    private WriteQueueService queueOver(RecordingBackend backend, int capacity) {
        StorageCoordinator coordinator = new StorageCoordinator(backend, "traj", "1.0", 1000);
        coordinator.open("traj");
        queue = new WriteQueueService(coordinator, capacity, registry);
        return queue;
    }

    private StoreRequest resultRequest(String name) {
        NodeSnapshot snapshot = NodeSnapshots.capture(tree, tree.addLeaf("results." + name, new Result(1)),
                NodeSnapshots.UNLIMITED);
        return StoreRequest.node(snapshot);
    }

    private static void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(Thread.State.WAITING, thread.getState());
    }

    @Test
    void submit_appliesInOrderAndIsolatesFailures() throws Exception {
        RecordingBackend backend = new RecordingBackend("boom");
        WriteQueueService q = queueOver(backend, 10);

        CompletableFuture<Integer> r1;
        CompletableFuture<Integer> r2;
        CompletableFuture<Integer> r3;
        try (WriteQueueService.Submitter submitter = q.openSubmitter()) {
            r1 = submitter.submit(resultRequest("r1"));
            r2 = submitter.submit(resultRequest("boom"));
            r3 = submitter.submit(resultRequest("r3"));
        }

        assertTrue(r1.get(5, TimeUnit.SECONDS) >= 1);
        ExecutionException e = assertThrows(ExecutionException.class, () -> r2.get(5, TimeUnit.SECONDS));
        assertInstanceOf(UncheckedIOException.class, e.getCause());
        assertTrue(r3.get(5, TimeUnit.SECONDS) >= 1);

        List<String> leafWrites = backend.writes().stream()
                .filter(p -> p.startsWith("results."))
                .collect(Collectors.toList());
        assertEquals(List.of("results.r1", "results.boom", "results.r3"), leafWrites);
        assertEquals(2.0, registry.counter("xpt.queue.applied").count());
        assertEquals(1.0, registry.counter("xpt.queue.failed").count());
        assertTrue(backend.readNode("results.r3").isPresent());
    }

    @Test
    void submit_errorInBackendFailsOnlyThatRequest() throws Exception {
        RecordingBackend backend = new RecordingBackend(null);
        backend.errorOn("corrupt");
        WriteQueueService q = queueOver(backend, 10);

        CompletableFuture<Integer> before = q.submit(resultRequest("before"));
        CompletableFuture<Integer> broken = q.submit(resultRequest("corrupt"));
        CompletableFuture<Integer> after = q.submit(resultRequest("after"));

        assertTrue(before.get(5, TimeUnit.SECONDS) >= 1);
        ExecutionException e = assertThrows(ExecutionException.class, () -> broken.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AssertionError.class, e.getCause());
        assertTrue(after.get(5, TimeUnit.SECONDS) >= 1);
        assertTrue(backend.readNode("results.after").isPresent());
        assertEquals(1.0, registry.counter("xpt.queue.failed").count());

        q.close();
        assertEquals(QueueState.CLOSED, q.state());
    }

    @Test
    void descriptorRequest_isApplied() throws Exception {
        RecordingBackend backend = new RecordingBackend(null);
        WriteQueueService q = queueOver(backend, 10);

        q.submit(StoreRequest.descriptor(new TrajectoryDescriptor("traj", "1.0", 1L, List.of(), List.of())))
                .get(5, TimeUnit.SECONDS);

        assertEquals("traj", backend.readNode("").orElseThrow().payload().get("name"));
    }

    @Test
    void submit_blocksWhileQueueIsFull() throws Exception {
        RecordingBackend backend = new RecordingBackend(null);
        WriteQueueService q = queueOver(backend, 1);
        StoreRequest first = resultRequest("a");
        StoreRequest second = resultRequest("b");
        StoreRequest third = resultRequest("c");

        backend.holdWrites();
        CompletableFuture<Integer> f1 = q.submit(first);
        assertTrue(backend.awaitHeldWrite());
        CompletableFuture<Integer> f2 = q.submit(second);
        assertEquals(1, q.depth());
        assertEquals(QueueState.DRAINING, q.state());
        assertEquals(1.0, registry.get("xpt.queue.depth").gauge().value());

        AtomicReference<CompletableFuture<Integer>> f3 = new AtomicReference<>();
        Thread blocked = new Thread(() -> f3.set(q.submit(third)));
        blocked.start();
        awaitWaiting(blocked);

        backend.releaseWrites();
        blocked.join(5000);
        f1.get(5, TimeUnit.SECONDS);
        f2.get(5, TimeUnit.SECONDS);
        f3.get().get(5, TimeUnit.SECONDS);
        assertTrue(backend.readNode("results.c").isPresent());
    }

    @Test
    void close_waitsForOpenSubmittersThenRejects() throws Exception {
        RecordingBackend backend = new RecordingBackend(null);
        WriteQueueService q = queueOver(backend, 10);
        WriteQueueService.Submitter open = q.openSubmitter();

        Thread closer = new Thread(q::close);
        closer.start();
        awaitWaiting(closer);

        assertThrows(WriteQueueClosedException.class, q::openSubmitter);
        CompletableFuture<Integer> late = open.submit(resultRequest("late"));
        open.close();
        closer.join(5000);

        assertTrue(late.isDone());
        assertTrue(backend.readNode("results.late").isPresent());
        assertEquals(QueueState.CLOSED, q.state());
        WriteQueueClosedException e = assertThrows(WriteQueueClosedException.class,
                () -> q.submit(resultRequest("after")));
        assertEquals(QueueState.CLOSED, e.getState());
        assertThrows(WriteQueueClosedException.class, () -> open.submit(resultRequest("reuse")));
        q.close();
    }

    @Test
    void storeRequest_requiresExactlyOnePayload() {
        assertThrows(IllegalArgumentException.class, () -> new StoreRequest(null, null, null));
    }
}
