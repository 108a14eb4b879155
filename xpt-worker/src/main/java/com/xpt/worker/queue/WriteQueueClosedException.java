package com.xpt.worker.queue;

/**
 * Thrown when submitting to a write queue that is closing or closed.
 */
public final class WriteQueueClosedException extends IllegalStateException {

    private final QueueState state;

    public WriteQueueClosedException(String message, QueueState state) {
        super(message + " (state=" + state + ")");
        this.state = state;
    }

    public QueueState getState() {
        return state;
    }
}
