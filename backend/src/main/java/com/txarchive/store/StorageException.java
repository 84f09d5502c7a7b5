package com.txarchive.store;

/**
 * Storage operation failed. Recoverable: the caller may retry the same write.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
