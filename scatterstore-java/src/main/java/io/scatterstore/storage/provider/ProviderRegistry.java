package io.scatterstore.storage.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * The ordered set of configured providers, built once and handed to every component that needs
 * backends. Tracks liveness and can probe providers on demand or on a schedule.
 */
public class ProviderRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers;
    private ScheduledExecutorService healthMonitor;
    private volatile Consumer<HealthChangeEvent> onHealthChange;

    public ProviderRegistry(List<Provider> providers) {
        Map<String, Provider> byId = new LinkedHashMap<>();
        for (Provider provider : providers) {
            if (byId.putIfAbsent(provider.id(), provider) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + provider.id());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
    }

    /**
     * Build a registry from adapters, naming them {@code bucket-0}, {@code bucket-1}, ... in order.
     */
    public static ProviderRegistry of(ChunkProvider... adapters) {
        List<Provider> list = new ArrayList<>();
        for (int i = 0; i < adapters.length; i++) {
            list.add(new Provider(bucketId(i), adapters[i]));
        }
        return new ProviderRegistry(list);
    }

    public static String bucketId(int index) {
        return "bucket-" + index;
    }

    public List<Provider> all() {
        return List.copyOf(providers.values());
    }

    /**
     * Snapshot of the providers currently marked live, in configuration order.
     */
    public List<Provider> live() {
        return providers.values().stream()
            .filter(Provider::isLive)
            .toList();
    }

    public Optional<Provider> find(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public Provider require(String id) {
        Provider provider = providers.get(id);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown provider: " + id);
        }
        return provider;
    }

    public int size() {
        return providers.size();
    }

    public void markUnavailable(String id, String reason) {
        find(id).ifPresent(p -> updateLiveness(p, false, reason));
    }

    public void markAvailable(String id) {
        find(id).ifPresent(p -> updateLiveness(p, true, "marked available"));
    }

    /**
     * Probe every provider and update its liveness flag.
     * @return number of live providers afterwards
     */
    public int probeAll() {
        int live = 0;
        for (Provider provider : providers.values()) {
            if (probe(provider)) {
                live++;
            }
        }
        return live;
    }

    public boolean probe(Provider provider) {
        boolean healthy;
        String reason;
        try {
            healthy = provider.adapter().probe();
            reason = healthy ? "probe ok" : "probe reported unhealthy";
        } catch (RuntimeException e) {
            healthy = false;
            reason = "probe failed: " + e.getMessage();
        }
        provider.recordProbe(Instant.now());
        updateLiveness(provider, healthy, reason);
        return healthy;
    }

    /**
     * Start probing all providers in the background.
     * @param interval Time between probe rounds
     */
    public synchronized void startHealthMonitor(Duration interval) {
        if (healthMonitor != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        healthMonitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-health-monitor");
            t.setDaemon(true);
            return t;
        });
        healthMonitor.scheduleAtFixedRate(
            this::probeAll,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    public synchronized void stopHealthMonitor() {
        if (healthMonitor != null) {
            healthMonitor.shutdownNow();
            healthMonitor = null;
        }
    }

    public void setOnHealthChange(Consumer<HealthChangeEvent> listener) {
        this.onHealthChange = listener;
    }

    @Override
    public void close() {
        stopHealthMonitor();
    }

    private void updateLiveness(Provider provider, boolean live, String reason) {
        if (provider.setLive(live)) {
            if (live) {
                log.info("Provider {} is back up ({})", provider.id(), reason);
            } else {
                log.warn("Provider {} marked down: {}", provider.id(), reason);
            }
            Consumer<HealthChangeEvent> listener = onHealthChange;
            if (listener != null) {
                listener.accept(new HealthChangeEvent(provider.id(), live, reason, Instant.now()));
            }
        }
    }

    public record HealthChangeEvent(String providerId, boolean live, String reason, Instant timestamp) {}
}
