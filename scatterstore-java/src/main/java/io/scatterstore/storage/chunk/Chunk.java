package io.scatterstore.storage.chunk;

/**
 * One ordered segment of a file with the SHA-256 checksum of its plaintext bytes.
 */
public record Chunk(int index, byte[] data, String checksum) {

    public static Chunk of(int index, byte[] data) {
        return new Chunk(index, data, Checksums.sha256Hex(data));
    }

    public int size() {
        return data.length;
    }
}
