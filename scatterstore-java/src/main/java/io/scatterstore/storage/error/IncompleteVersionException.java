package io.scatterstore.storage.error;

public class IncompleteVersionException extends StorageException {

    public IncompleteVersionException(String fileId, long versionId, String reason) {
        super("Version " + versionId + " of file " + fileId + " is incomplete: " + reason);
    }
}
