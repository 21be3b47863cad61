package io.scatterstore.storage.error;

/**
 * Transient provider failure. Retried by the transfer layer until the retry ceiling is reached.
 */
public class ProviderUnavailableException extends StorageException {

    private final String providerId;

    public ProviderUnavailableException(String providerId, String message) {
        super(providerId + ": " + message);
        this.providerId = providerId;
    }

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
