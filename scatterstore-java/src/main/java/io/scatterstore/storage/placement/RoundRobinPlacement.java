package io.scatterstore.storage.placement;

import io.scatterstore.storage.provider.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Chunk {@code i} goes to live provider {@code i mod n}. Two chunks of one version share a
 * provider only when there are more chunks than live providers.
 */
public class RoundRobinPlacement implements PlacementPolicy {

    @Override
    public Provider select(int index, List<Provider> live) {
        List<Provider> candidates = PlacementPolicy.requireLive(live);
        return candidates.get(Math.floorMod(index, candidates.size()));
    }

    @Override
    public Optional<Provider> reassign(int index, Provider failed, List<Provider> live) {
        int start = live.indexOf(failed);
        for (int step = 1; step <= live.size(); step++) {
            Provider candidate = live.get(Math.floorMod(start + step, live.size()));
            if (candidate != failed && candidate.isLive()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
