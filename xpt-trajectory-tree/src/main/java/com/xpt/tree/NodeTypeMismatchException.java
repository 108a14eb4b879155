package com.xpt.tree;

/**
 * Thrown when an operation finds a node (or item) of another kind than it needs, e.g. a leaf where
 * a group is required or a result added below {@code parameters}. Raised before the tree is changed.
 */
public final class NodeTypeMismatchException extends RuntimeException {

    private final String path;
    private final String expected;
    private final String actual;

    public NodeTypeMismatchException(String path, String expected, String actual) {
        super(String.format("Type mismatch at `%s`: expected %s, found %s", path, expected, actual));
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    public String getPath() {
        return path;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
