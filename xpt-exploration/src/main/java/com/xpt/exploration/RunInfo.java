package com.xpt.exploration;

import com.xpt.tree.naming.RunNames;

/**
 * One run of an explored trajectory. Timestamps are epoch milliseconds, null until set.
 */
public final class RunInfo {

    private final int index;
    private final String name;
    private volatile boolean completed;
    private volatile Long startedAt;
    private volatile Long finishedAt;
    private volatile String summary;

    public RunInfo(int index, String summary) {
        this.index = index;
        this.name = RunNames.name(index);
        this.summary = summary == null ? "" : summary;
    }

    public RunInfo(int index, boolean completed, Long startedAt, Long finishedAt, String summary) {
        this(index, summary);
        this.completed = completed;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public boolean isCompleted() {
        return completed;
    }

    public Long getStartedAt() {
        return startedAt;
    }

    public Long getFinishedAt() {
        return finishedAt;
    }

    /** Short description of the parameter values of this run, e.g. {@code x: 3, y: a}. */
    public String getSummary() {
        return summary;
    }

    public void markStarted(long epochMillis) {
        this.startedAt = epochMillis;
    }

    public void markCompleted(long epochMillis) {
        this.finishedAt = epochMillis;
        this.completed = true;
    }

    void setSummary(String summary) {
        this.summary = summary;
    }

    @Override
    public String toString() {
        return name + (completed ? " (completed)" : "") + " {" + summary + "}";
    }
}
