package com.xpt.tree.naming;

import java.util.NoSuchElementException;

/**
 * Thrown when a path does not resolve to any node of the in-memory tree.
 */
public final class NoSuchNodeException extends NoSuchElementException {

    private final String path;

    public NoSuchNodeException(String path, String reason) {
        super(String.format("No node found for `%s`: %s", path, reason));
        this.path = path;
    }

    /** The path that failed to resolve. */
    public String getPath() {
        return path;
    }
}
