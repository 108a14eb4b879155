package com.xpt.storage.backend;

import com.xpt.storage.NoSuchServiceException;
import com.xpt.storage.StorageBackend;
import com.xpt.storage.StorageBackendFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps storage service names to backend factories. {@link #withDefaults()} registers
 * {@code memory} and {@code json-file}.
 */
public final class StorageServiceRegistry {

    public static final String MEMORY = "memory";
    public static final String JSON_FILE = "json-file";

    private final Map<String, StorageBackendFactory> factories = Collections.synchronizedMap(new LinkedHashMap<>());

    public static StorageServiceRegistry withDefaults() {
        StorageServiceRegistry registry = new StorageServiceRegistry();
        Map<String, InMemoryStorageBackend.Store> shared = new ConcurrentHashMap<>();
        registry.register(MEMORY, () -> new InMemoryStorageBackend(shared));
        registry.register(JSON_FILE, JsonFileStorageBackend::new);
        return registry;
    }

    public void register(String service, StorageBackendFactory factory) {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(factory, "factory");
        factories.put(service, factory);
    }

    public boolean isRegistered(String service) {
        return factories.containsKey(service);
    }

    public Set<String> services() {
        synchronized (factories) {
            return Set.copyOf(factories.keySet());
        }
    }

    /**
     * Creates an unopened backend for {@code service}.
     *
     * @throws NoSuchServiceException if nothing is registered under that name
     */
    public StorageBackend create(String service) {
        StorageBackendFactory factory = service == null ? null : factories.get(service);
        if (factory == null) throw new NoSuchServiceException(service, services());
        return factory.create();
    }

    /** Creates and opens a backend. */
    public StorageBackend open(String service, String location) {
        StorageBackend backend = create(service);
        backend.open(location);
        return backend;
    }
}
