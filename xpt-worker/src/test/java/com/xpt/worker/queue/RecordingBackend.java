package com.xpt.worker.queue;

import com.xpt.storage.StorageBackend;
import com.xpt.storage.backend.InMemoryStorageBackend;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** In-memory backend that records write order, fails on marked paths and can hold writes at a gate. */
final class RecordingBackend implements StorageBackend {

    private final InMemoryStorageBackend delegate = new InMemoryStorageBackend();
    private final List<String> writes = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch entered = new CountDownLatch(1);
    private final String failMarker;
    private volatile CountDownLatch gate;
    private volatile String errorMarker;

    RecordingBackend(String failMarker) {
        this.failMarker = failMarker;
    }

    List<String> writes() {
        synchronized (writes) {
            return List.copyOf(writes);
        }
    }

    /** Writes to paths containing {@code marker} throw an {@link AssertionError}. */
    void errorOn(String marker) {
        errorMarker = marker;
    }

    void holdWrites() {
        gate = new CountDownLatch(1);
    }

    void releaseWrites() {
        gate.countDown();
    }

    boolean awaitHeldWrite() throws InterruptedException {
        return entered.await(5, TimeUnit.SECONDS);
    }

    @Override
    public void open(String location) {
        delegate.open(location);
    }

    @Override
    public String location() {
        return delegate.location();
    }

    @Override
    public void writeNode(String path, NodeMetadata metadata, Map<String, Object> payloadOrNull) {
        CountDownLatch g = gate;
        if (g != null) {
            entered.countDown();
            try {
                if (!g.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("gate never released");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        writes.add(path);
        String marker = errorMarker;
        if (marker != null && path.contains(marker)) {
            throw new AssertionError("corrupt record at " + path);
        }
        if (failMarker != null && path.contains(failMarker)) {
            throw new UncheckedIOException(new IOException("disk full at " + path));
        }
        delegate.writeNode(path, metadata, payloadOrNull);
    }

    @Override
    public Optional<NodeRecord> readNode(String path) {
        return delegate.readNode(path);
    }

    @Override
    public List<String> listChildren(String path) {
        return delegate.listChildren(path);
    }

    @Override
    public void deleteNode(String path) {
        delegate.deleteNode(path);
    }

    @Override
    public void deletePayloadFields(String path, Collection<String> fields) {
        delegate.deletePayloadFields(path, fields);
    }

    @Override
    public void appendOverviewRow(String table, Map<String, Object> row) {
        delegate.appendOverviewRow(table, row);
    }

    @Override
    public List<Map<String, Object>> readOverview(String table) {
        return delegate.readOverview(table);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
