package io.scatterstore.storage.error;

public class ManifestPersistenceException extends StorageException {

    public ManifestPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
