package com.xpt.worker.queue;

import com.xpt.storage.StorageCoordinator;
import com.xpt.storage.StoreOptions;
import com.xpt.storage.record.TrajectoryDescriptor;
import com.xpt.tree.snapshot.NodeSnapshot;

import java.util.Objects;

/**
 * One unit of work for the writer: a captured subtree with its store options, or a descriptor update.
 * Requests are values; nothing in them refers to a worker's live tree.
 */
public record StoreRequest(NodeSnapshot snapshot, StoreOptions options, TrajectoryDescriptor descriptor) {

    public StoreRequest {
        if ((snapshot == null) == (descriptor == null)) {
            throw new IllegalArgumentException("A store request carries either a snapshot or a descriptor");
        }
        if (snapshot != null) Objects.requireNonNull(options, "options");
    }

    public static StoreRequest node(NodeSnapshot snapshot, StoreOptions options) {
        return new StoreRequest(snapshot, options, null);
    }

    public static StoreRequest node(NodeSnapshot snapshot) {
        return node(snapshot, StoreOptions.defaults());
    }

    public static StoreRequest descriptor(TrajectoryDescriptor descriptor) {
        return new StoreRequest(null, null, descriptor);
    }

    public boolean isDescriptorUpdate() {
        return descriptor != null;
    }

    /** Applies the request as one coordinator call; returns the number of records written. */
    int apply(StorageCoordinator coordinator) {
        if (descriptor != null) {
            coordinator.storeDescriptor(descriptor);
            return 1;
        }
        return coordinator.storeSnapshot(snapshot, options);
    }

    /** Short label for logs. */
    String label() {
        return descriptor != null ? "descriptor" : (snapshot.getFullName().isEmpty() ? "<root>" : snapshot.getFullName());
    }
}
