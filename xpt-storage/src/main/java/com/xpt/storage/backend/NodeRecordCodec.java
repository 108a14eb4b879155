package com.xpt.storage.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.storage.record.NodeRecord;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding shared by the backends.
 */
public final class NodeRecordCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> NAMES = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() { };
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() { };

    private NodeRecordCodec() {
    }

    public static String encode(NodeRecord record) {
        return write(record);
    }

    public static NodeRecord decode(String json) {
        return read(json, NodeRecord.class);
    }

    /**
     * Metadata as it reads back from a backend: annotation values take their JSON types
     * ({@code Long} 42 becomes {@code Integer}, {@code Float} becomes {@code Double}).
     */
    public static NodeMetadata normalize(NodeMetadata metadata) {
        return read(write(metadata), NodeMetadata.class);
    }

    /** Payload as it reads back from a backend; null stays null. */
    public static Map<String, Object> normalize(Map<String, Object> payload) {
        if (payload == null) return null;
        return decodeRow(write(payload));
    }

    public static String encodeNames(List<String> names) {
        return write(names);
    }

    public static List<String> decodeNames(String json) {
        try {
            return MAPPER.readValue(json, NAMES);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse child names", e);
        }
    }

    public static String encodeRow(Map<String, Object> row) {
        return write(row);
    }

    public static Map<String, Object> decodeRow(String json) {
        try {
            return MAPPER.readValue(json, ROW);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse overview row", e);
        }
    }

    public static String encodeRows(List<Map<String, Object>> rows) {
        return write(rows);
    }

    public static List<Map<String, Object>> decodeRows(String json) {
        try {
            return MAPPER.readValue(json, ROWS);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse overview table", e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse " + type.getSimpleName(), e);
        }
    }
}
