package com.xpt.storage;

/**
 * Thrown when a path is read from storage but the backend holds no record for it.
 */
public final class DataNotInStorageException extends RuntimeException {

    private final String path;

    public DataNotInStorageException(String path) {
        super(String.format("No stored data for `%s`", path));
        this.path = path;
    }

    public DataNotInStorageException(String path, String detail) {
        super(String.format("No stored data for `%s`: %s", path, detail));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
