package com.xpt.storage.record;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node as held by a backend: metadata plus payload fields (null when no payload was ever written).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeRecord(NodeMetadata metadata, Map<String, Object> payload) {

    public NodeRecord {
        Objects.requireNonNull(metadata, "metadata");
        payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
