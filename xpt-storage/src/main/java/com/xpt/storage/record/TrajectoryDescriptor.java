package com.xpt.storage.record;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Trajectory-level record kept as the payload of the stored root: name, format version, runs and
 * explored parameter names.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrajectoryDescriptor(
        String name,
        String version,
        Long createdAt,
        List<RunRecord> runs,
        List<String> exploredParameters) {

    public TrajectoryDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        runs = runs != null ? List.copyOf(runs) : List.of();
        exploredParameters = exploredParameters != null ? List.copyOf(exploredParameters) : List.of();
    }
}
