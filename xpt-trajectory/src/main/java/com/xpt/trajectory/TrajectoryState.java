package com.xpt.trajectory;

/**
 * Storage lifecycle of a trajectory.
 */
public enum TrajectoryState {
    /** Built in memory, never stored. */
    BUILT,
    /** Some nodes stored. */
    PARTIALLY_STORED,
    /** The whole tree was stored at least once. */
    FULLY_STORED,
    /** Loaded from storage. */
    LOADED
}
