package com.xpt.worker.queue;

/** Writer state. {@code CLOSED} is terminal. */
public enum QueueState {
    IDLE,
    DRAINING,
    CLOSED
}
