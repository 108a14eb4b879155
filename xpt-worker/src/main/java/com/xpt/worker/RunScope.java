package com.xpt.worker;

import com.xpt.tree.LeafNode;
import com.xpt.tree.item.Result;
import com.xpt.trajectory.Trajectory;

/**
 * What a {@link RunFunction} sees: its own copy of the trajectory, bound to one run.
 * Results and derived parameters added here land under {@code runs.<run>} of their branch.
 */
public final class RunScope {

    static final String RUN_GROUP = "runs";

    private final Trajectory trajectory;
    private final int index;

    RunScope(Trajectory trajectory, int index) {
        this.trajectory = trajectory;
        this.index = index;
    }

    public Trajectory trajectory() {
        return trajectory;
    }

    public int index() {
        return index;
    }

    public String runName() {
        return trajectory.runs().get(index).getName();
    }

    /** Value of the parameter (or any leaf) at {@code path} for this run. */
    public Object value(String path) {
        return trajectory.value(path);
    }

    public LeafNode addResult(String name, Object value) {
        return trajectory.addResult(RUN_GROUP + ".$." + name, value);
    }

    public LeafNode addResult(String name, Result result) {
        return trajectory.addResult(RUN_GROUP + ".$." + name, result);
    }

    public LeafNode addDerivedParameter(String name, Object value) {
        return trajectory.addDerivedParameter(RUN_GROUP + ".$." + name, value);
    }
}
