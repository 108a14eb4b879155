package com.xpt.trajectory;

import com.xpt.storage.record.RunRecord;

import java.util.List;
import java.util.Objects;

/**
 * Immutable image of a trajectory: its tree as JSON plus run bookkeeping. Every
 * {@link #instantiate(int)} parses the JSON again, so copies share no values with each other or
 * with the trajectory the template was taken from. Safe to share between threads.
 */
public record RunTemplate(String name, String formatVersion, String snapshotJson, List<RunRecord> runs,
                          List<String> exploredParameters, boolean withLinks) {

    public RunTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(snapshotJson, "snapshotJson");
        runs = List.copyOf(runs);
        exploredParameters = List.copyOf(exploredParameters);
    }

    /** Number of runs a copy can be bound to; an unexplored trajectory has one. */
    public int length() {
        return Math.max(1, runs.size());
    }

    /**
     * Builds an in-memory trajectory bound to run {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not a run index
     */
    public Trajectory instantiate(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Run " + index + " out of range, length " + length());
        }
        return Trajectory.instantiate(this, index);
    }
}
