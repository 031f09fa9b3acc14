package com.eventboard.storage;

/**
 * Persisting or reading a dataset file failed.
 */
public class StorageException extends Exception {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
