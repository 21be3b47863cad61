package io.scatterstore.storage.chunk;

/**
 * Reversible byte transform applied at the provider boundary, after checksumming on the way out
 * and before verification on the way back.
 */
public interface ChunkTransform {

    byte[] encode(byte[] plaintext);

    byte[] decode(byte[] stored);

    static ChunkTransform identity() {
        return Identity.INSTANCE;
    }

    enum Identity implements ChunkTransform {
        INSTANCE;

        @Override
        public byte[] encode(byte[] plaintext) {
            return plaintext;
        }

        @Override
        public byte[] decode(byte[] stored) {
            return stored;
        }
    }
}
