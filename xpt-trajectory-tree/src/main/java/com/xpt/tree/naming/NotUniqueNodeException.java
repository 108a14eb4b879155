package com.xpt.tree.naming;

import java.util.List;

/**
 * Thrown when a shortcut segment matches more than one node in the searched subtree.
 * Never recovered automatically; callers must use a longer, unambiguous path.
 */
public final class NotUniqueNodeException extends RuntimeException {

    private final String path;
    private final List<String> candidates;

    public NotUniqueNodeException(String path, List<String> candidates) {
        super(String.format("Path `%s` is not unique, candidates: %s", path, candidates));
        this.path = path;
        this.candidates = List.copyOf(candidates);
    }

    public String getPath() {
        return path;
    }

    /** Paths (as reached by the search) of every matching node. */
    public List<String> getCandidates() {
        return candidates;
    }
}
