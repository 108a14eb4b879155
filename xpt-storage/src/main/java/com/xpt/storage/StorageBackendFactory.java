package com.xpt.storage;

/** Creates unopened backends for a registered service name. */
@FunctionalInterface
public interface StorageBackendFactory {

    StorageBackend create();
}
