package com.xpt.storage;

import java.util.Set;

/**
 * Thrown when a storage service name has no registered backend factory.
 */
public final class NoSuchServiceException extends RuntimeException {

    private final String service;

    public NoSuchServiceException(String service, Set<String> registered) {
        super(String.format("No storage service `%s`; registered: %s", service, registered));
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
