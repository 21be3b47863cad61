package io.scatterstore.storage.error;

public class MissingChunkException extends StorageException {

    private final int chunkIndex;

    public MissingChunkException(int chunkIndex, String message) {
        super(message);
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
