package com.xpt.storage;

import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Physical storage of node records addressed by full name ({@code ""} is the root). Implementations
 * keep the order in which children were first written. Not required to be thread-safe; a single
 * writer uses a backend at a time.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Binds the backend to a location, creating it when missing.
     *
     * @throws java.io.UncheckedIOException if the location cannot be opened
     */
    void open(String location);

    /** Currently bound location, or null when closed. */
    String location();

    /**
     * Writes metadata and, when {@code payloadOrNull} is not null, replaces the payload. A null payload
     * keeps whatever payload the backend already has.
     */
    void writeNode(String path, NodeMetadata metadata, Map<String, Object> payloadOrNull);

    Optional<NodeRecord> readNode(String path);

    /** Names of the stored children of {@code path}, in first-write order. */
    List<String> listChildren(String path);

    /** Deletes the record at {@code path} and every record below it. */
    void deleteNode(String path);

    /** Removes the named fields from the stored payload. */
    void deletePayloadFields(String path, Collection<String> fields);

    void appendOverviewRow(String table, Map<String, Object> row);

    List<Map<String, Object>> readOverview(String table);

    @Override
    void close();
}
