package com.xpt.storage.backend;

import com.xpt.storage.StorageBackend;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;
import com.xpt.tree.naming.PathNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File backend: one directory per node below {@code <location>/tree}, holding {@code node.json} and
 * {@code children.json}; overview tables live in {@code <location>/overview/<table>.json}. Every file is
 * written to a temporary sibling first and moved into place, so a reader sees either the old or the
 * new content.
 */
public final class JsonFileStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStorageBackend.class);

    static final String NODE_FILE = "node.json";
    static final String CHILDREN_FILE = "children.json";

    private Path root;

    @Override
    public void open(String location) {
        Path dir = Paths.get(location);
        try {
            Files.createDirectories(dir.resolve("tree"));
            Files.createDirectories(dir.resolve("overview"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open storage location " + location, e);
        }
        this.root = dir;
        log.info("JsonFileStorage open | location={}", dir.toAbsolutePath());
    }

    @Override
    public String location() {
        return root == null ? null : root.toString();
    }

    @Override
    public void writeNode(String path, NodeMetadata metadata, Map<String, Object> payloadOrNull) {
        Path dir = nodeDir(path);
        Path file = dir.resolve(NODE_FILE);
        boolean existed = Files.exists(file);
        Map<String, Object> payload = payloadOrNull;
        if (payload == null && existed) {
            payload = NodeRecordCodec.decode(readString(file)).payload();
        }
        createDirectories(dir);
        writeAtomically(file, NodeRecordCodec.encode(new NodeRecord(metadata, payload)));
        if (!existed && !path.isEmpty()) {
            String parent = InMemoryStorageBackend.parentOf(path);
            List<String> siblings = new ArrayList<>(listChildren(parent));
            siblings.add(InMemoryStorageBackend.nameOf(path));
            writeAtomically(nodeDir(parent).resolve(CHILDREN_FILE), NodeRecordCodec.encodeNames(siblings));
        }
    }

    @Override
    public Optional<NodeRecord> readNode(String path) {
        Path file = nodeDir(path).resolve(NODE_FILE);
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(NodeRecordCodec.decode(readString(file)));
    }

    @Override
    public List<String> listChildren(String path) {
        Path file = nodeDir(path).resolve(CHILDREN_FILE);
        if (!Files.exists(file)) return List.of();
        return NodeRecordCodec.decodeNames(readString(file));
    }

    @Override
    public void deleteNode(String path) {
        Path dir = nodeDir(path);
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                List<Path> paths = new ArrayList<>();
                walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
                for (Path p : paths) Files.delete(p);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete " + dir, e);
            }
        }
        if (path.isEmpty()) {
            createDirectories(dir);
            return;
        }
        String parent = InMemoryStorageBackend.parentOf(path);
        List<String> siblings = new ArrayList<>(listChildren(parent));
        if (siblings.remove(InMemoryStorageBackend.nameOf(path))) {
            writeAtomically(nodeDir(parent).resolve(CHILDREN_FILE), NodeRecordCodec.encodeNames(siblings));
        }
    }

    @Override
    public void deletePayloadFields(String path, Collection<String> fields) {
        Optional<NodeRecord> record = readNode(path);
        if (record.isEmpty() || !record.get().hasPayload()) return;
        Map<String, Object> payload = new LinkedHashMap<>(record.get().payload());
        payload.keySet().removeAll(fields);
        writeAtomically(nodeDir(path).resolve(NODE_FILE),
                NodeRecordCodec.encode(new NodeRecord(record.get().metadata(), payload)));
    }

    @Override
    public void appendOverviewRow(String table, Map<String, Object> row) {
        List<Map<String, Object>> rows = readOverview(table);
        rows.add(row);
        writeAtomically(tableFile(table), NodeRecordCodec.encodeRows(rows));
    }

    @Override
    public List<Map<String, Object>> readOverview(String table) {
        Path file = tableFile(table);
        if (!Files.exists(file)) return new ArrayList<>();
        return new ArrayList<>(NodeRecordCodec.decodeRows(readString(file)));
    }

    @Override
    public void close() {
        if (root != null) log.info("JsonFileStorage close | location={}", root.toAbsolutePath());
        root = null;
    }

    private Path requireRoot() {
        if (root == null) throw new IllegalStateException("File backend is not open");
        return root;
    }

    private Path nodeDir(String path) {
        Path dir = requireRoot().resolve("tree");
        for (String segment : PathNames.split(path)) dir = dir.resolve(segment);
        return dir;
    }

    private Path tableFile(String table) {
        return requireRoot().resolve("overview").resolve(table + ".json");
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + dir, e);
        }
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void writeAtomically(Path file, String content) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("JsonFileStorage | atomic move not supported, replacing | file={}", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
