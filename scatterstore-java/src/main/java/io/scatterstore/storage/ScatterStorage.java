package io.scatterstore.storage;

import io.scatterstore.storage.chunk.ChaChaChunkTransform;
import io.scatterstore.storage.chunk.ChunkTransform;
import io.scatterstore.storage.config.EngineConfig;
import io.scatterstore.storage.error.StorageException;
import io.scatterstore.storage.manifest.ChunkDescriptor;
import io.scatterstore.storage.manifest.FileManifest;
import io.scatterstore.storage.manifest.InMemoryManifestRepository;
import io.scatterstore.storage.manifest.JsonManifestRepository;
import io.scatterstore.storage.manifest.ManifestRepository;
import io.scatterstore.storage.manifest.ManifestStore;
import io.scatterstore.storage.manifest.VersionRecord;
import io.scatterstore.storage.placement.PlacementPolicy;
import io.scatterstore.storage.placement.RoundRobinPlacement;
import io.scatterstore.storage.provider.Provider;
import io.scatterstore.storage.provider.ProviderFactory;
import io.scatterstore.storage.provider.ProviderRegistry;
import io.scatterstore.storage.transfer.CancellationSignal;
import io.scatterstore.storage.transfer.OrphanedChunk;
import io.scatterstore.storage.transfer.TransferOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Chunked, versioned file storage scattered across several independent providers.
 *
 * <p>Files are split into fixed-size chunks, placed round-robin over the live providers and
 * described by a manifest that is the only source of truth. Every upload or update is atomic from
 * the caller's point of view: either a new complete version becomes current, or the file is left
 * exactly as it was and any chunks already written are deleted again.
 */
public class ScatterStorage implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScatterStorage.class);

    private final EngineConfig config;
    private final ProviderRegistry registry;
    private final ManifestStore manifestStore;
    private final TransferOrchestrator orchestrator;
    private final VersionManager versions;

    private final ExecutorService executor;
    private final Map<String, OperationState> operations = new ConcurrentHashMap<>();
    private final AtomicLong operationCounter = new AtomicLong();

    private volatile Consumer<ChunkStoredEvent> onChunkStored;

    public ScatterStorage(EngineConfig config) {
        this(config, new ProviderFactory().createRegistry(config.buckets), repositoryFor(config));
    }

    public ScatterStorage(EngineConfig config, ProviderRegistry registry, ManifestRepository repository) {
        this(config, registry, repository, new RoundRobinPlacement());
    }

    public ScatterStorage(EngineConfig config,
                          ProviderRegistry registry,
                          ManifestRepository repository,
                          PlacementPolicy placement) {
        this.config = config;
        this.registry = registry;
        this.manifestStore = new ManifestStore(repository);
        this.orchestrator = new TransferOrchestrator(
            registry,
            placement,
            manifestStore,
            transformFor(config),
            config.retryPolicy,
            config.maxConcurrentTransfers
        );
        this.versions = new VersionManager(manifestStore, orchestrator, config.chunkSize, config.retainedVersions);

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.maxConcurrentTransfers, r -> {
            Thread t = new Thread(r, "storage-operation-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        int live = registry.probeAll();
        log.info("Storage ready: {} of {} providers live, chunk size {} bytes", live, registry.size(), config.chunkSize);
        registry.startHealthMonitor(config.healthCheckInterval);
    }

    private static ManifestRepository repositoryFor(EngineConfig config) {
        if (config.manifestDirectory == null) {
            return new InMemoryManifestRepository();
        }
        return new JsonManifestRepository(config.manifestDirectory);
    }

    private static ChunkTransform transformFor(EngineConfig config) {
        if (!config.encryptionEnabled) {
            return ChunkTransform.identity();
        }
        return ChaChaChunkTransform.fromPassphrase(config.encryptionKey);
    }

    // ==================== Upload / update ====================

    /**
     * Store a new file.
     * @return the new file id
     */
    public String upload(String fileName, InputStream input) {
        return track(OperationType.UPLOAD, null, state -> uploadTracked(state, fileName, input));
    }

    public String upload(String fileName, byte[] data) {
        return upload(fileName, new ByteArrayInputStream(data));
    }

    public OperationHandle<String> uploadAsync(String fileName, InputStream input) {
        return trackAsync(OperationType.UPLOAD, null, state -> uploadTracked(state, fileName, input));
    }

    private String uploadTracked(OperationState state, String fileName, InputStream input) {
        String fileId = versions.upload(fileName, input, "Initial upload", state.cancel, progressFor(state)).fileId();
        state.fileId = fileId;
        return fileId;
    }

    /**
     * Store a new version of an existing file and make it current.
     * @return the new version id
     */
    public long update(String fileId, InputStream input, String notes) {
        return track(OperationType.UPDATE, fileId,
            state -> versions.update(fileId, input, notes, state.cancel, progressFor(state)));
    }

    public long update(String fileId, byte[] data, String notes) {
        return update(fileId, new ByteArrayInputStream(data), notes);
    }

    public OperationHandle<Long> updateAsync(String fileId, InputStream input, String notes) {
        return trackAsync(OperationType.UPDATE, fileId,
            state -> versions.update(fileId, input, notes, state.cancel, progressFor(state)));
    }

    // ==================== Download ====================

    /**
     * Read the current version of a file. Every chunk and the whole file are verified before the
     * stream is returned.
     */
    public InputStream download(String fileId) {
        return download(fileId, null);
    }

    /**
     * Read a specific complete version, or the current one when {@code versionId} is null.
     */
    public InputStream download(String fileId, Long versionId) {
        return versions.download(fileId, versionId);
    }

    public byte[] downloadBytes(String fileId, Long versionId) {
        try (InputStream in = download(fileId, versionId)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + fileId, e);
        }
    }

    // ==================== Versions ====================

    /**
     * Make an earlier complete version current again. Chunk bytes are not moved.
     */
    public void restore(String fileId, long versionId) {
        versions.restore(fileId, versionId);
    }

    /**
     * Complete versions of a file in creation order. Exactly one entry is current.
     */
    public List<VersionInfo> listVersions(String fileId) {
        FileManifest manifest = manifestStore.require(fileId);
        Long current = manifest.currentVersionId();
        return manifestStore.listVersions(fileId).stream()
            .filter(VersionRecord::isComplete)
            .map(v -> new VersionInfo(
                v.versionId(),
                v.createdAt(),
                v.notes(),
                v.chunkCount(),
                v.totalSize(),
                current != null && current == v.versionId()))
            .toList();
    }

    /**
     * Remove all but the newest {@code keep} non-current versions, and any aborted versions.
     * @return removed version ids
     */
    public List<Long> pruneVersions(String fileId, int keep) {
        return versions.pruneVersions(fileId, keep);
    }

    // ==================== Files ====================

    public DeleteResult delete(String fileId) {
        return versions.delete(fileId);
    }

    public List<FileSummary> listFiles() {
        return manifestStore.listFiles().stream()
            .map(m -> new FileSummary(
                m.fileId(),
                m.fileName(),
                m.currentVersion().map(VersionRecord::chunkCount).orElse(0)))
            .toList();
    }

    public Optional<FileInfo> getFile(String fileId) {
        return manifestStore.find(fileId)
            .filter(m -> m.currentVersionId() != null)
            .map(m -> {
                VersionRecord current = m.currentVersion().orElseThrow();
                return new FileInfo(
                    m.fileId(),
                    m.fileName(),
                    current.versionId(),
                    current.totalSize(),
                    current.chunkCount(),
                    m.createdAt(),
                    m.modifiedAt());
            });
    }

    /**
     * Locators held by providers that no manifest references. Chunks of uploads still in flight
     * can show up here. Nothing is deleted.
     */
    public List<StrayChunk> findOrphans() {
        Set<String> referenced = new HashSet<>();
        for (FileManifest manifest : manifestStore.allManifests()) {
            for (VersionRecord version : manifest.versions()) {
                for (ChunkDescriptor chunk : version.chunks()) {
                    referenced.add(chunk.providerId() + "/" + chunk.locator());
                }
            }
        }

        List<StrayChunk> strays = new ArrayList<>();
        for (Provider provider : registry.all()) {
            List<String> locators;
            try {
                locators = provider.adapter().list();
            } catch (StorageException e) {
                log.warn("Could not list {} while auditing: {}", provider.id(), e.getMessage());
                continue;
            }
            for (String locator : locators) {
                if (!referenced.contains(provider.id() + "/" + locator)) {
                    strays.add(new StrayChunk(provider.id(), locator));
                }
            }
        }
        return strays;
    }

    // ==================== Operations ====================

    public Optional<OperationStatus> getOperationStatus(String operationId) {
        OperationState state = operations.get(operationId);
        if (state == null) {
            return Optional.empty();
        }

        OperationStatusType statusType;
        if (state.cancelled) {
            statusType = OperationStatusType.CANCELLED;
        } else if (state.failed) {
            statusType = OperationStatusType.FAILED;
        } else if (state.completed) {
            statusType = OperationStatusType.COMPLETED;
        } else {
            statusType = OperationStatusType.IN_PROGRESS;
        }

        Duration elapsed = state.completedAt != null
            ? Duration.between(state.startedAt, state.completedAt)
            : Duration.between(state.startedAt, Instant.now());

        return Optional.of(new OperationStatus(
            operationId,
            state.type,
            statusType,
            state.fileId,
            state.chunksStored.get(),
            state.bytesProcessed.get(),
            state.startedAt,
            state.completedAt,
            elapsed,
            state.error
        ));
    }

    public List<OperationStatus> getActiveOperations() {
        return operations.values().stream()
            .filter(s -> !s.completed && !s.failed && !s.cancelled)
            .map(s -> getOperationStatus(s.operationId).orElse(null))
            .filter(Objects::nonNull)
            .toList();
    }

    /**
     * Cancel an upload or update that has not committed yet. Chunks already written are deleted
     * and the file keeps its previous current version.
     * @return true if the operation was still running and is now cancelling
     */
    public boolean cancelOperation(String operationId) {
        OperationState state = operations.get(operationId);
        if (state == null || state.completed || state.failed || state.cancelled) {
            return false;
        }
        state.cancel.cancel();
        log.info("Cancellation requested for {}", operationId);
        return true;
    }

    public void cleanupCompletedOperations(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        operations.entrySet().removeIf(e ->
            e.getValue().completedAt != null && e.getValue().completedAt.isBefore(cutoff));
    }

    private <T> T track(OperationType type, String fileId, Function<OperationState, T> work) {
        OperationState state = startOperation(type, fileId);
        return run(state, work);
    }

    private <T> OperationHandle<T> trackAsync(OperationType type, String fileId, Function<OperationState, T> work) {
        OperationState state = startOperation(type, fileId);
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> run(state, work), executor);
        return new OperationHandle<>(state.operationId, future);
    }

    private OperationState startOperation(OperationType type, String fileId) {
        String operationId = "op-" + operationCounter.incrementAndGet() + "-" + System.currentTimeMillis();
        OperationState state = new OperationState(operationId, type, Instant.now());
        state.fileId = fileId;
        operations.put(operationId, state);
        return state;
    }

    private <T> T run(OperationState state, Function<OperationState, T> work) {
        try {
            T result = work.apply(state);
            state.completed = true;
            return result;
        } catch (CancellationException e) {
            state.cancelled = true;
            state.error = e.getMessage();
            throw e;
        } catch (RuntimeException e) {
            state.failed = true;
            state.error = e.getMessage();
            throw e;
        } finally {
            state.completedAt = Instant.now();
        }
    }

    private Consumer<ChunkDescriptor> progressFor(OperationState state) {
        return descriptor -> {
            state.fileId = descriptor.fileId();
            state.chunksStored.incrementAndGet();
            state.bytesProcessed.addAndGet(descriptor.size());
            Consumer<ChunkStoredEvent> listener = onChunkStored;
            if (listener != null) {
                listener.accept(new ChunkStoredEvent(
                    descriptor.fileId(),
                    descriptor.versionId(),
                    descriptor.index(),
                    descriptor.providerId(),
                    descriptor.size()));
            }
        };
    }

    // ==================== Stats and lifecycle ====================

    public StorageStats stats() {
        List<FileManifest> manifests = manifestStore.listFiles();
        int versionCount = manifests.stream()
            .mapToInt(m -> (int) m.versions().stream().filter(VersionRecord::isComplete).count())
            .sum();
        return new StorageStats(
            manifests.size(),
            versionCount,
            registry.size(),
            registry.live().size(),
            orchestrator.getBytesUploaded(),
            orchestrator.getBytesDownloaded(),
            orchestrator.getOrphanCount(),
            getActiveOperations().size()
        );
    }

    /**
     * Probe every provider now and update liveness.
     * @return number of live providers
     */
    public int probeProviders() {
        return registry.probeAll();
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public EngineConfig getConfig() {
        return config;
    }

    ManifestStore getManifestStore() {
        return manifestStore;
    }

    VersionManager getVersionManager() {
        return versions;
    }

    @Override
    public void close() {
        registry.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        orchestrator.close();
    }

    public void setOnChunkStored(Consumer<ChunkStoredEvent> listener) { this.onChunkStored = listener; }
    public void setOnVersionCommitted(Consumer<VersionCommittedEvent> listener) { versions.setOnVersionCommitted(listener); }
    public void setOnVersionAborted(Consumer<VersionAbortedEvent> listener) { versions.setOnVersionAborted(listener); }
    public void setOnOrphanedChunk(Consumer<OrphanedChunk> listener) { orchestrator.setOnOrphanedChunk(listener); }

    public enum OperationType { UPLOAD, UPDATE }
    public enum OperationStatusType { IN_PROGRESS, COMPLETED, FAILED, CANCELLED }

    private static class OperationState {
        final String operationId;
        final OperationType type;
        final Instant startedAt;
        final CancellationSignal cancel = new CancellationSignal();
        final AtomicInteger chunksStored = new AtomicInteger();
        final AtomicLong bytesProcessed = new AtomicLong();
        volatile String fileId;
        volatile Instant completedAt;
        volatile boolean completed;
        volatile boolean failed;
        volatile boolean cancelled;
        volatile String error;

        OperationState(String operationId, OperationType type, Instant startedAt) {
            this.operationId = operationId;
            this.type = type;
            this.startedAt = startedAt;
        }
    }

    public record OperationHandle<T>(String operationId, CompletableFuture<T> future) {}

    public record OperationStatus(
        String operationId,
        OperationType type,
        OperationStatusType status,
        String fileId,
        int chunksStored,
        long bytesProcessed,
        Instant startedAt,
        Instant completedAt,
        Duration elapsed,
        String error
    ) {}

    public record FileSummary(String fileId, String fileName, int chunkCount) {}

    public record VersionInfo(long versionId, Instant createdAt, String notes, int chunkCount, long size, boolean current) {}

    public record FileInfo(
        String fileId,
        String fileName,
        long currentVersionId,
        long size,
        int chunkCount,
        Instant createdAt,
        Instant modifiedAt
    ) {}

    /**
     * Outcome of deleting a file. The file is gone either way; {@code orphans} lists chunks that
     * may still occupy provider space.
     */
    public record DeleteResult(String fileId, int deletedChunks, List<OrphanedChunk> orphans) {
        public DeleteResult {
            orphans = List.copyOf(orphans);
        }

        public boolean isClean() {
            return orphans.isEmpty();
        }
    }

    public record StrayChunk(String providerId, String locator) {}

    public record StorageStats(
        int fileCount,
        int versionCount,
        int providerCount,
        int liveProviderCount,
        long bytesUploaded,
        long bytesDownloaded,
        long orphanedChunks,
        int activeOperations
    ) {}

    public record ChunkStoredEvent(String fileId, long versionId, int index, String providerId, int size) {}
    public record VersionCommittedEvent(String fileId, long versionId, int chunkCount, long size) {}
    public record VersionAbortedEvent(String fileId, long versionId, String reason) {}
}
