package com.xpt.storage;

/**
 * Thrown when a stored trajectory was written with another format version and loading is not forced.
 */
public final class VersionMismatchException extends RuntimeException {

    private final String expectedVersion;
    private final String storedVersion;

    public VersionMismatchException(String expectedVersion, String storedVersion) {
        super(String.format("Format version mismatch: expected=%s, stored=%s; load with force to ignore",
                expectedVersion, storedVersion));
        this.expectedVersion = expectedVersion;
        this.storedVersion = storedVersion;
    }

    /** Version this process writes and expects. */
    public String getExpectedVersion() {
        return expectedVersion;
    }

    /** Version found in storage. */
    public String getStoredVersion() {
        return storedVersion;
    }
}
