package io.scatterstore.storage.placement;

import io.scatterstore.storage.error.NoProvidersAvailableException;
import io.scatterstore.storage.provider.Provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the provider that receives each chunk of a version. Decisions are made once, when
 * the chunk is first written, and are never migrated afterwards.
 */
public interface PlacementPolicy {

    /**
     * Pick the provider for one chunk.
     * @param index Zero-based chunk index within the version
     * @param live Live providers captured when the version started, in configuration order
     */
    Provider select(int index, List<Provider> live);

    /**
     * Pick a replacement after {@code failed} exhausted its retries for this chunk.
     * @return the replacement, or empty if no other live provider exists
     */
    Optional<Provider> reassign(int index, Provider failed, List<Provider> live);

    /**
     * Assign every chunk of a version up front.
     * @param chunkCount Number of chunks
     * @param providers All configured providers; non-live ones are skipped
     * @return One provider per chunk, in chunk order
     * @throws NoProvidersAvailableException if no provider is live
     */
    default List<Provider> assign(int chunkCount, List<Provider> providers) {
        List<Provider> live = requireLive(providers);
        List<Provider> assignment = new ArrayList<>(chunkCount);
        for (int i = 0; i < chunkCount; i++) {
            assignment.add(select(i, live));
        }
        return assignment;
    }

    static List<Provider> requireLive(List<Provider> providers) {
        List<Provider> live = providers.stream().filter(Provider::isLive).toList();
        if (live.isEmpty()) {
            throw new NoProvidersAvailableException(
                "No live storage providers (" + providers.size() + " configured)");
        }
        return live;
    }
}
