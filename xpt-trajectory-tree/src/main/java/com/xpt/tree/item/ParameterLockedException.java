package com.xpt.tree.item;

/**
 * Thrown when a locked item is modified.
 */
public final class ParameterLockedException extends RuntimeException {

    private final String operation;

    public ParameterLockedException(String operation) {
        super("Item is locked, cannot " + operation + "; unlock it first");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
