package io.scatterstore.storage.error;

/**
 * Base type for every failure the storage engine surfaces to callers.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
