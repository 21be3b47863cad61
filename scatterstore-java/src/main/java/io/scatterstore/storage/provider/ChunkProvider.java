package io.scatterstore.storage.provider;

import java.util.List;

/**
 * Uniform capability over one storage backend account.
 * Providers hold opaque bytes behind locators and know nothing about files, versions or ordering.
 *
 * Implementations signal transient failures with
 * {@link io.scatterstore.storage.error.ProviderUnavailableException} and an unknown locator with
 * {@link io.scatterstore.storage.error.MissingChunkException}.
 */
public interface ChunkProvider {

    /**
     * Store a chunk.
     * @param chunkName Name hint for the chunk, unique per version and index
     * @param data The chunk bytes
     * @return Provider-specific locator used for later get/delete
     */
    String put(String chunkName, byte[] data);

    /**
     * Retrieve a chunk.
     * @param locator Locator returned by {@link #put}
     * @return The stored bytes
     */
    byte[] get(String locator);

    /**
     * Delete a chunk.
     * @param locator Locator returned by {@link #put}
     * @return true if deleted, false if it did not exist
     */
    boolean delete(String locator);

    /**
     * Check whether the backend is reachable.
     * @return true if the provider can currently serve requests
     */
    boolean probe();

    /**
     * Backend type tag, e.g. "memory" or "directory".
     */
    String type();

    /**
     * List every locator currently held by this provider.
     * @return Locators, in no particular order
     */
    default List<String> list() {
        return List.of();
    }

    /**
     * Space accounting for this provider.
     */
    default ProviderUsage usage() {
        return ProviderUsage.unknown();
    }

    record ProviderUsage(long chunkCount, long bytesStored) {
        public static ProviderUsage unknown() {
            return new ProviderUsage(-1, -1);
        }
    }
}
