package com.yoursp.vkyc.service.storage;

/**
 * Thrown when the storage backend cannot read or write an object.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
