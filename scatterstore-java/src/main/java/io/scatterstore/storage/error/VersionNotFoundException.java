package io.scatterstore.storage.error;

public class VersionNotFoundException extends StorageException {

    public VersionNotFoundException(String fileId, long versionId) {
        super("Version " + versionId + " not found for file " + fileId);
    }

    public VersionNotFoundException(String message) {
        super(message);
    }
}
