package com.xpt.storage.backend;

import com.xpt.storage.NoSuchServiceException;
import com.xpt.storage.StorageBackend;
import com.xpt.storage.record.NodeMetadata;
import com.xpt.tree.Branch;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageServiceRegistryTest {

    @Test
    void withDefaults_registersMemoryAndFileServices() {
        StorageServiceRegistry registry = StorageServiceRegistry.withDefaults();

        assertTrue(registry.isRegistered(StorageServiceRegistry.MEMORY));
        assertTrue(registry.isRegistered(StorageServiceRegistry.JSON_FILE));
        assertTrue(registry.create(StorageServiceRegistry.JSON_FILE) instanceof JsonFileStorageBackend);
    }

    @Test
    void memoryBackends_shareLocationsWithinRegistry() {
        StorageServiceRegistry registry = StorageServiceRegistry.withDefaults();
        StorageBackend writer = registry.open(StorageServiceRegistry.MEMORY, "loc");
        writer.writeNode("", NodeMetadata.group("", "", Branch.GENERIC), null);

        StorageBackend reader = registry.open(StorageServiceRegistry.MEMORY, "loc");

        assertTrue(reader.readNode("").isPresent());
        assertEquals("loc", reader.location());
    }

    @Test
    void create_unknownServiceFails() {
        StorageServiceRegistry registry = StorageServiceRegistry.withDefaults();

        NoSuchServiceException e = assertThrows(NoSuchServiceException.class, () -> registry.create("hdf5"));

        assertEquals("hdf5", e.getService());
    }
}
