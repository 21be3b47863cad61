package io.scatterstore.storage.error;

/**
 * A chunk could not be stored after retries and one re-placement. Fatal to the version.
 */
public class ChunkUploadFailedException extends StorageException {

    private final int chunkIndex;

    public ChunkUploadFailedException(int chunkIndex, String message, Throwable cause) {
        super("Chunk " + chunkIndex + " upload failed: " + message, cause);
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
