package com.xpt.worker;

/**
 * Result of executing one run.
 *
 * @param written records written for the run; 0 when it failed
 * @param error   the failure, null on success
 */
public record RunOutcome(int index, String runName, long startedAt, long finishedAt, int written, Throwable error) {

    public static RunOutcome success(int index, String runName, long startedAt, long finishedAt, int written) {
        return new RunOutcome(index, runName, startedAt, finishedAt, written, null);
    }

    public static RunOutcome failure(int index, String runName, long startedAt, long finishedAt, Throwable error) {
        return new RunOutcome(index, runName, startedAt, finishedAt, 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
