package io.scatterstore.storage.error;

public class NoProvidersAvailableException extends StorageException {

    public NoProvidersAvailableException(String message) {
        super(message);
    }
}
