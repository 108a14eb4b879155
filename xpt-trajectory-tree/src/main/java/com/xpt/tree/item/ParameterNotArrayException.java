package com.xpt.tree.item;

/**
 * Thrown when an array operation is applied to a parameter that has not been explored.
 */
public final class ParameterNotArrayException extends RuntimeException {

    public ParameterNotArrayException(String operation) {
        super("Parameter is not explored, cannot " + operation);
    }
}
