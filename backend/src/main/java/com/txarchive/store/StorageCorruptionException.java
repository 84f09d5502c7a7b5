package com.txarchive.store;

/**
 * Stored data cannot be trusted (unknown schema version, unreadable record). Not retried; ingestion halts.
 */
public class StorageCorruptionException extends StorageException {

    public StorageCorruptionException(String message) {
        super(message);
    }

    public StorageCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
