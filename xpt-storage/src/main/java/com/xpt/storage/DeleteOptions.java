package com.xpt.storage;

import java.util.List;

/**
 * Options of a delete call. With {@code deleteOnly} only those payload fields are deleted (and, with
 * {@code removeFromItem}, removed from the live item as well); otherwise the whole record goes.
 */
public record DeleteOptions(boolean recursive, boolean removeFromTrajectory, List<String> deleteOnly,
                            boolean removeFromItem) {

    public DeleteOptions {
        deleteOnly = deleteOnly != null ? List.copyOf(deleteOnly) : List.of();
    }

    public static DeleteOptions defaults() {
        return new DeleteOptions(false, false, null, false);
    }

    public DeleteOptions withRecursive(boolean value) {
        return new DeleteOptions(value, removeFromTrajectory, deleteOnly, removeFromItem);
    }

    public DeleteOptions withRemoveFromTrajectory(boolean value) {
        return new DeleteOptions(recursive, value, deleteOnly, removeFromItem);
    }

    public DeleteOptions withDeleteOnly(List<String> fields, boolean fromItem) {
        return new DeleteOptions(recursive, removeFromTrajectory, fields, fromItem);
    }
}
