package com.xpt.storage.backend;

import com.xpt.storage.StorageBackend;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;
import com.xpt.tree.naming.PathNames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backend keeping records as JSON strings in memory. Locations are keys into a map shared by every
 * backend created from the same map, so a trajectory written by one instance can be read by another.
 * Useful for tests and local runs; nothing survives the process.
 */
public final class InMemoryStorageBackend implements StorageBackend {

    /** Contents of one location. */
    public static final class Store {
        private final Map<String, String> records = new HashMap<>();
        private final Map<String, List<String>> children = new HashMap<>();
        private final Map<String, List<String>> overview = new LinkedHashMap<>();
        private final AtomicLong writeCount = new AtomicLong();

        /** Number of mutating calls applied to this location. */
        public long getWriteCount() {
            return writeCount.get();
        }

        public synchronized int size() {
            return records.size();
        }
    }

    private final Map<String, Store> shared;
    private String location;
    private Store store;

    public InMemoryStorageBackend() {
        this(new ConcurrentHashMap<>());
    }

    public InMemoryStorageBackend(Map<String, Store> shared) {
        this.shared = Objects.requireNonNull(shared, "shared");
    }

    @Override
    public void open(String location) {
        Objects.requireNonNull(location, "location");
        this.store = shared.computeIfAbsent(location, k -> new Store());
        this.location = location;
    }

    @Override
    public String location() {
        return location;
    }

    /** Write counter of the bound location. */
    public long getWriteCount() {
        return requireOpen().getWriteCount();
    }

    public Store getStore() {
        return requireOpen();
    }

    @Override
    public void writeNode(String path, NodeMetadata metadata, Map<String, Object> payloadOrNull) {
        Store s = requireOpen();
        synchronized (s) {
            String existing = s.records.get(path);
            Map<String, Object> payload = payloadOrNull;
            if (payload == null && existing != null) {
                payload = NodeRecordCodec.decode(existing).payload();
            }
            s.records.put(path, NodeRecordCodec.encode(new NodeRecord(metadata, payload)));
            if (existing == null && !path.isEmpty()) {
                s.children.computeIfAbsent(parentOf(path), k -> new ArrayList<>()).add(nameOf(path));
            }
            s.writeCount.incrementAndGet();
        }
    }

    @Override
    public Optional<NodeRecord> readNode(String path) {
        Store s = requireOpen();
        synchronized (s) {
            String json = s.records.get(path);
            return json == null ? Optional.empty() : Optional.of(NodeRecordCodec.decode(json));
        }
    }

    @Override
    public List<String> listChildren(String path) {
        Store s = requireOpen();
        synchronized (s) {
            List<String> names = s.children.get(path);
            return names == null ? List.of() : List.copyOf(names);
        }
    }

    @Override
    public void deleteNode(String path) {
        Store s = requireOpen();
        synchronized (s) {
            String prefix = path.isEmpty() ? "" : path + PathNames.SEPARATOR;
            s.records.keySet().removeIf(k -> k.equals(path) || k.startsWith(prefix));
            s.children.keySet().removeIf(k -> k.equals(path) || k.startsWith(prefix));
            if (!path.isEmpty()) {
                List<String> siblings = s.children.get(parentOf(path));
                if (siblings != null) siblings.remove(nameOf(path));
            }
            s.writeCount.incrementAndGet();
        }
    }

    @Override
    public void deletePayloadFields(String path, Collection<String> fields) {
        Store s = requireOpen();
        synchronized (s) {
            String json = s.records.get(path);
            if (json == null) return;
            NodeRecord record = NodeRecordCodec.decode(json);
            if (record.payload() == null) return;
            Map<String, Object> payload = new LinkedHashMap<>(record.payload());
            payload.keySet().removeAll(fields);
            s.records.put(path, NodeRecordCodec.encode(new NodeRecord(record.metadata(), payload)));
            s.writeCount.incrementAndGet();
        }
    }

    @Override
    public void appendOverviewRow(String table, Map<String, Object> row) {
        Store s = requireOpen();
        synchronized (s) {
            s.overview.computeIfAbsent(table, k -> new ArrayList<>()).add(NodeRecordCodec.encodeRow(row));
            s.writeCount.incrementAndGet();
        }
    }

    @Override
    public List<Map<String, Object>> readOverview(String table) {
        Store s = requireOpen();
        synchronized (s) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (String json : s.overview.getOrDefault(table, List.of())) rows.add(NodeRecordCodec.decodeRow(json));
            return rows;
        }
    }

    @Override
    public void close() {
        store = null;
        location = null;
    }

    private Store requireOpen() {
        Store s = store;
        if (s == null) throw new IllegalStateException("In-memory backend is not open");
        return s;
    }

    static String parentOf(String path) {
        int i = path.lastIndexOf('.');
        return i < 0 ? "" : path.substring(0, i);
    }

    static String nameOf(String path) {
        int i = path.lastIndexOf('.');
        return i < 0 ? path : path.substring(i + 1);
    }
}
