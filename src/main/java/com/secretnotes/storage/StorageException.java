package com.secretnotes.storage;

/**
 * The backing store is unreachable or a command against it failed.
 * Callers treat this as store-unavailable, never as partial state:
 * every mutating call is a single atomic command.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
