package io.scatterstore.storage.error;

public class ChecksumMismatchException extends StorageException {

    private final int chunkIndex;
    private final String expected;
    private final String actual;

    public ChecksumMismatchException(int chunkIndex, String expected, String actual) {
        this(chunkIndex, expected, actual, null);
    }

    public ChecksumMismatchException(int chunkIndex, String expected, String actual, Throwable cause) {
        super((chunkIndex < 0 ? "Whole-file" : "Chunk " + chunkIndex)
            + " checksum mismatch: expected " + expected + ", got " + actual, cause);
        this.chunkIndex = chunkIndex;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * @return the chunk index, or -1 when the whole-file checksum disagreed
     */
    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
