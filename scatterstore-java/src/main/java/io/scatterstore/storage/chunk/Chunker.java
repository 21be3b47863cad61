package io.scatterstore.storage.chunk;

import io.scatterstore.storage.error.ChecksumMismatchException;
import io.scatterstore.storage.error.MissingChunkException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Fixed-size splitting of a byte stream and the inverse reassembly.
 */
public final class Chunker {

    private Chunker() {}

    /**
     * Lazily split a stream into chunks of exactly {@code chunkSize} bytes, the last possibly
     * shorter. An empty stream yields a single zero-length chunk. The stream is read once.
     */
    public static ChunkSequence split(InputStream input, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        return new ChunkSequence(input, chunkSize);
    }

    public static List<Chunk> split(byte[] data, int chunkSize) {
        List<Chunk> chunks = new ArrayList<>();
        split(new ByteArrayInputStream(data), chunkSize).forEachRemaining(chunks::add);
        return chunks;
    }

    /**
     * Reassemble chunks into the original byte stream.
     * Each chunk's data is rehashed and compared to its recorded checksum.
     *
     * @param chunks Chunks in any order, carrying the checksum recorded for them
     * @param expectedCount Number of chunks the version holds
     * @throws MissingChunkException if any index in 0..expectedCount-1 is absent
     * @throws ChecksumMismatchException if a chunk's bytes disagree with its checksum
     */
    public static InputStream reassemble(Collection<Chunk> chunks, int expectedCount) {
        List<Chunk> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingInt(Chunk::index));

        List<InputStream> parts = new ArrayList<>(ordered.size());
        int next = 0;
        for (Chunk chunk : ordered) {
            if (chunk.index() < next) {
                throw new IllegalArgumentException("Duplicate chunk index " + chunk.index());
            }
            if (chunk.index() > next && next < expectedCount) {
                throw new MissingChunkException(next, "Chunk " + next + " is missing");
            }
            if (chunk.index() >= expectedCount) {
                throw new IllegalArgumentException(
                    "Chunk index " + chunk.index() + " out of range for " + expectedCount + " chunks");
            }
            verify(chunk);
            parts.add(new ByteArrayInputStream(chunk.data()));
            next++;
        }
        if (next < expectedCount) {
            throw new MissingChunkException(next, "Chunk " + next + " is missing");
        }
        return new SequenceInputStream(Collections.enumeration(parts));
    }

    public static void verify(Chunk chunk) {
        String actual = Checksums.sha256Hex(chunk.data());
        if (!actual.equals(chunk.checksum())) {
            throw new ChecksumMismatchException(chunk.index(), chunk.checksum(), actual);
        }
    }

    /**
     * Single-pass iterator over the chunks of a stream. Also accumulates the whole-file length
     * and checksum, which are available once the sequence is exhausted.
     */
    public static final class ChunkSequence implements Iterator<Chunk> {

        private final InputStream input;
        private final int chunkSize;
        private final MessageDigest fileDigest = Checksums.newDigest();
        private Chunk pending;
        private int nextIndex;
        private long totalBytes;
        private boolean exhausted;
        private String fileChecksum;

        private ChunkSequence(InputStream input, int chunkSize) {
            this.input = input;
            this.chunkSize = chunkSize;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                pending = readNext();
            }
            return pending != null;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Chunk chunk = pending;
            pending = null;
            return chunk;
        }

        public long totalBytes() {
            return totalBytes;
        }

        public int chunkCount() {
            return nextIndex;
        }

        /**
         * @return whole-file SHA-256, only once every chunk has been consumed
         */
        public String fileChecksum() {
            if (!exhausted) {
                throw new IllegalStateException("Sequence not fully consumed");
            }
            return fileChecksum;
        }

        private Chunk readNext() {
            byte[] data;
            try {
                data = input.readNBytes(chunkSize);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read chunk " + nextIndex, e);
            }
            if (data.length == 0 && nextIndex > 0) {
                finish();
                return null;
            }
            fileDigest.update(data);
            totalBytes += data.length;
            Chunk chunk = Chunk.of(nextIndex++, data);
            if (data.length < chunkSize) {
                finish();
            }
            return chunk;
        }

        private void finish() {
            exhausted = true;
            fileChecksum = Checksums.hex(fileDigest);
        }
    }
}
