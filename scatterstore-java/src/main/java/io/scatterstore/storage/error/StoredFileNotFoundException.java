package io.scatterstore.storage.error;

public class StoredFileNotFoundException extends StorageException {

    private final String fileId;

    public StoredFileNotFoundException(String fileId) {
        super("File not found: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
