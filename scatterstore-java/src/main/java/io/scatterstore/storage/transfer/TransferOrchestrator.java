package io.scatterstore.storage.transfer;

import io.scatterstore.storage.chunk.Checksums;
import io.scatterstore.storage.chunk.Chunk;
import io.scatterstore.storage.chunk.ChunkTransform;
import io.scatterstore.storage.chunk.Chunker;
import io.scatterstore.storage.chunk.Chunker.ChunkSequence;
import io.scatterstore.storage.error.ChecksumMismatchException;
import io.scatterstore.storage.error.ChunkUploadFailedException;
import io.scatterstore.storage.error.MissingChunkException;
import io.scatterstore.storage.error.ProviderUnavailableException;
import io.scatterstore.storage.error.StorageException;
import io.scatterstore.storage.manifest.ChunkDescriptor;
import io.scatterstore.storage.manifest.ManifestStore;
import io.scatterstore.storage.manifest.VersionRecord;
import io.scatterstore.storage.manifest.VersionSummary;
import io.scatterstore.storage.placement.PlacementPolicy;
import io.scatterstore.storage.provider.Provider;
import io.scatterstore.storage.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Moves the chunks of one version to and from providers.
 *
 * <p>Uploads stream the input through the chunker, fan chunk writes out to at most
 * {@code min(maxConcurrentTransfers, live providers)} concurrent workers and join on all of them
 * before committing. Each write is retried with backoff; a provider that exhausts the ceiling is
 * marked down and the chunk gets one re-placement. Any chunk failure, a cancellation or a failed
 * commit aborts the version: every write recorded in the {@link UploadSaga} is deleted best-effort
 * and the version is marked dead, leaving the current pointer where it was.
 */
public class TransferOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransferOrchestrator.class);

    private final ProviderRegistry registry;
    private final PlacementPolicy placement;
    private final ManifestStore manifestStore;
    private final ChunkTransform transform;
    private final RetryPolicy retryPolicy;
    private final int maxConcurrentTransfers;

    private final ExecutorService workers;
    private final ExecutorService providerCalls;

    private final AtomicLong bytesUploaded = new AtomicLong();
    private final AtomicLong bytesDownloaded = new AtomicLong();
    private final AtomicLong orphanCount = new AtomicLong();

    private volatile Consumer<OrphanedChunk> onOrphanedChunk;

    public TransferOrchestrator(ProviderRegistry registry,
                                PlacementPolicy placement,
                                ManifestStore manifestStore,
                                ChunkTransform transform,
                                RetryPolicy retryPolicy,
                                int maxConcurrentTransfers) {
        if (maxConcurrentTransfers < 1) {
            throw new IllegalArgumentException("maxConcurrentTransfers must be >= 1");
        }
        this.registry = registry;
        this.placement = placement;
        this.manifestStore = manifestStore;
        this.transform = transform;
        this.retryPolicy = retryPolicy;
        this.maxConcurrentTransfers = maxConcurrentTransfers;
        this.workers = Executors.newCachedThreadPool(daemonThreads("chunk-transfer"));
        this.providerCalls = Executors.newCachedThreadPool(daemonThreads("provider-call"));
    }

    // ==================== Upload ====================

    /**
     * Upload one version that the manifest store has already begun.
     *
     * @param makeCurrent whether the committed version becomes the file's current version
     * @param onChunkStored called after each chunk is durably recorded, may be null
     * @return the committed version
     * @throws ChunkUploadFailedException if a chunk could not be stored anywhere
     * @throws CancellationException if {@code cancel} fired before commit
     */
    public VersionRecord upload(String fileId,
                                long versionId,
                                InputStream input,
                                int chunkSize,
                                boolean makeCurrent,
                                CancellationSignal cancel,
                                Consumer<ChunkDescriptor> onChunkStored) {
        UploadSaga saga = new UploadSaga(fileId, versionId);
        List<CompletableFuture<ChunkDescriptor>> inFlight = new ArrayList<>();
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();

        try {
            List<Provider> live = PlacementPolicy.requireLive(registry.all());
            Semaphore permits = new Semaphore(Math.min(maxConcurrentTransfers, live.size()));
            ChunkSequence chunks = Chunker.split(input, chunkSize);

            while (firstFailure.get() == null) {
                cancel.throwIfCancelled();
                acquire(permits);
                if (!chunks.hasNext()) {
                    permits.release();
                    break;
                }
                Chunk chunk = chunks.next();
                Provider target = placement.select(chunk.index(), live);

                // track the callback stage so failures are visible once all transfers are joined
                CompletableFuture<ChunkDescriptor> tracked = CompletableFuture
                    .supplyAsync(() -> storeChunk(saga, chunk, target, live, cancel), workers)
                    .whenComplete((descriptor, error) -> {
                        try {
                            if (error != null) {
                                firstFailure.compareAndSet(null, unwrap(error));
                            } else if (onChunkStored != null) {
                                notifyChunkStored(onChunkStored, descriptor);
                            }
                        } finally {
                            permits.release();
                        }
                    });
                inFlight.add(tracked);
            }

            awaitAll(inFlight);
            Throwable failure = firstFailure.get();
            if (failure != null) {
                throw asRuntime(failure);
            }
            cancel.throwIfCancelled();

            VersionSummary summary = new VersionSummary(chunks.chunkCount(), chunks.totalBytes(), chunks.fileChecksum());
            return manifestStore.commitVersion(fileId, versionId, summary, makeCurrent);
        } catch (RuntimeException e) {
            awaitAll(inFlight);
            rollback(saga, e);
            throw e;
        }
    }

    private ChunkDescriptor storeChunk(UploadSaga saga,
                                       Chunk chunk,
                                       Provider target,
                                       List<Provider> live,
                                       CancellationSignal cancel) {
        String chunkName = saga.fileId() + "_v" + saga.versionId() + "_chunk_" + chunk.index();
        byte[] payload = transform.encode(chunk.data());

        Provider provider = target;
        String locator;
        try {
            locator = putWithRetry(provider, chunkName, payload, cancel);
        } catch (ProviderUnavailableException e) {
            registry.markUnavailable(provider.id(), "retries exhausted: " + e.getMessage());
            Optional<Provider> alternative = placement.reassign(chunk.index(), provider, live);
            if (alternative.isEmpty()) {
                throw new ChunkUploadFailedException(chunk.index(), "no alternative provider after " + provider.id(), e);
            }
            log.warn("Chunk {} of {} v{} re-placed from {} to {}",
                chunk.index(), saga.fileId(), saga.versionId(), provider.id(), alternative.get().id());
            provider = alternative.get();
            try {
                locator = putWithRetry(provider, chunkName, payload, cancel);
            } catch (ProviderUnavailableException retryFailure) {
                registry.markUnavailable(provider.id(), "retries exhausted: " + retryFailure.getMessage());
                retryFailure.addSuppressed(e);
                throw new ChunkUploadFailedException(chunk.index(), retryFailure.getMessage(), retryFailure);
            }
        }

        saga.record(chunk.index(), provider.id(), locator);
        bytesUploaded.addAndGet(chunk.size());

        ChunkDescriptor descriptor = new ChunkDescriptor(
            saga.fileId(),
            saga.versionId(),
            chunk.index(),
            chunk.size(),
            chunk.checksum(),
            provider.id(),
            locator
        );
        manifestStore.recordChunk(saga.fileId(), saga.versionId(), descriptor);
        log.debug("Stored chunk {} of {} v{} on {} as {}",
            chunk.index(), saga.fileId(), saga.versionId(), provider.id(), locator);
        return descriptor;
    }

    private String putWithRetry(Provider provider, String chunkName, byte[] payload, CancellationSignal cancel) {
        return withRetry(provider, cancel,
            () -> provider.adapter().put(chunkName, payload),
            lateLocator -> abandonLateWrite(provider, lateLocator));
    }

    private void abandonLateWrite(Provider provider, String locator) {
        try {
            provider.adapter().delete(locator);
            log.debug("Removed late write {} on {}", locator, provider.id());
        } catch (RuntimeException e) {
            log.warn("Write {} on {} completed after its timeout and could not be removed: {}",
                locator, provider.id(), e.getMessage());
            orphanCount.incrementAndGet();
        }
    }

    private void rollback(UploadSaga saga, RuntimeException cause) {
        List<UploadSaga.WrittenChunk> written = saga.written();
        log.warn("Upload of {} v{} failed ({}), rolling back {} written chunks",
            saga.fileId(), saga.versionId(), cause.getMessage(), written.size());

        List<ChunkDescriptor> toDelete = written.stream()
            .map(w -> new ChunkDescriptor(saga.fileId(), saga.versionId(), w.index(), 0, null, w.providerId(), w.locator()))
            .toList();
        List<OrphanedChunk> orphans = deleteChunks(toDelete);
        if (!orphans.isEmpty()) {
            log.warn("Rollback of {} v{} left {} orphaned chunks", saga.fileId(), saga.versionId(), orphans.size());
        }

        try {
            manifestStore.abortVersion(saga.fileId(), saga.versionId());
        } catch (RuntimeException abortFailure) {
            cause.addSuppressed(abortFailure);
        }
    }

    // ==================== Download ====================

    /**
     * Fetch, verify and reassemble a complete version.
     *
     * @throws ChecksumMismatchException if a chunk or the whole file fails verification
     * @throws ProviderUnavailableException if a provider stayed unreachable for the retry ceiling
     * @throws MissingChunkException if a provider no longer holds a chunk
     */
    public InputStream download(VersionRecord version) {
        List<ChunkDescriptor> descriptors = version.chunks();
        List<Outcome<Chunk>> outcomes = fanOut(descriptors, this::fetchChunk);

        List<Chunk> chunks = new ArrayList<>(descriptors.size());
        StorageException failure = null;
        for (Outcome<Chunk> outcome : outcomes) {
            if (outcome.error() == null) {
                chunks.add(outcome.value());
            } else if (failure == null) {
                failure = asStorageException(outcome.error());
            } else {
                failure.addSuppressed(outcome.error());
            }
        }
        if (failure != null) {
            throw failure;
        }

        InputStream stream = Chunker.reassemble(chunks, descriptors.size());
        if (version.checksum() != null) {
            MessageDigest digest = Checksums.newDigest();
            chunks.stream()
                .sorted(Comparator.comparingInt(Chunk::index))
                .forEach(c -> digest.update(c.data()));
            String actual = Checksums.hex(digest);
            if (!actual.equals(version.checksum())) {
                throw new ChecksumMismatchException(-1, version.checksum(), actual);
            }
        }
        return stream;
    }

    private static void notifyChunkStored(Consumer<ChunkDescriptor> listener, ChunkDescriptor descriptor) {
        try {
            listener.accept(descriptor);
        } catch (RuntimeException e) {
            log.warn("Chunk listener failed for chunk {} of {}: {}",
                descriptor.index(), descriptor.fileId(), e.getMessage(), e);
        }
    }

    private Chunk fetchChunk(ChunkDescriptor descriptor) {
        Provider provider = registry.find(descriptor.providerId())
            .orElseThrow(() -> new ProviderUnavailableException(descriptor.providerId(), "provider is not configured"));
        byte[] stored = withRetry(provider, CancellationSignal.none(),
            () -> provider.adapter().get(descriptor.locator()), null);
        byte[] plain;
        try {
            plain = transform.decode(stored);
        } catch (StorageException e) {
            // a tampered or truncated ciphertext is corruption of this chunk
            throw new ChecksumMismatchException(descriptor.index(), descriptor.checksum(), "undecryptable", e);
        }
        Chunk chunk = new Chunk(descriptor.index(), plain, descriptor.checksum());
        Chunker.verify(chunk);
        bytesDownloaded.addAndGet(chunk.size());
        log.debug("Fetched chunk {} of {} v{} from {}",
            descriptor.index(), descriptor.fileId(), descriptor.versionId(), provider.id());
        return chunk;
    }

    // ==================== Delete ====================

    /**
     * Delete chunks from their providers, best-effort. A chunk that is already gone counts as deleted.
     *
     * @return chunks whose delete failed, possibly still occupying space
     */
    public List<OrphanedChunk> deleteChunks(Collection<ChunkDescriptor> descriptors) {
        List<ChunkDescriptor> items = List.copyOf(descriptors);
        List<Outcome<Boolean>> outcomes = fanOut(items, this::deleteChunk);

        List<OrphanedChunk> orphans = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Throwable error = outcomes.get(i).error();
            if (error != null) {
                ChunkDescriptor d = items.get(i);
                OrphanedChunk orphan = new OrphanedChunk(
                    d.fileId(), d.versionId(), d.index(), d.providerId(), d.locator(), error.getMessage());
                orphans.add(orphan);
                reportOrphan(orphan);
            }
        }
        return orphans;
    }

    private Boolean deleteChunk(ChunkDescriptor descriptor) {
        Provider provider = registry.find(descriptor.providerId())
            .orElseThrow(() -> new ProviderUnavailableException(descriptor.providerId(), "provider is not configured"));
        return withRetry(provider, CancellationSignal.none(),
            () -> provider.adapter().delete(descriptor.locator()), null);
    }

    private void reportOrphan(OrphanedChunk orphan) {
        orphanCount.incrementAndGet();
        log.warn("Orphaned chunk {} of {} v{} on {} ({}): {}",
            orphan.index(), orphan.fileId(), orphan.versionId(), orphan.providerId(), orphan.locator(), orphan.reason());
        Consumer<OrphanedChunk> listener = onOrphanedChunk;
        if (listener != null) {
            listener.accept(orphan);
        }
    }

    // ==================== Retry and fan-out ====================

    /**
     * Run one provider operation with bounded retries. Each attempt is limited by the call timeout;
     * a timeout counts as a failed attempt. Missing chunks are not retried.
     *
     * @param lateResult receives results of attempts that completed after their timeout, may be null
     */
    private <T> T withRetry(Provider provider, CancellationSignal cancel, Supplier<T> operation, Consumer<T> lateResult) {
        ProviderUnavailableException last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            cancel.throwIfCancelled();
            try {
                return callWithTimeout(provider, operation, lateResult);
            } catch (ProviderUnavailableException e) {
                last = e;
                log.debug("Attempt {}/{} on {} failed: {}", attempt, retryPolicy.maxAttempts(), provider.id(), e.getMessage());
                if (attempt < retryPolicy.maxAttempts()) {
                    sleep(retryPolicy.backoffAfter(attempt));
                }
            }
        }
        throw last;
    }

    private <T> T callWithTimeout(Provider provider, Supplier<T> operation, Consumer<T> lateResult) {
        CompletableFuture<T> call = CompletableFuture.supplyAsync(operation, providerCalls);
        Duration timeout = retryPolicy.callTimeout();
        try {
            return timeout == null ? call.get() : call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (lateResult != null) {
                call.thenAccept(lateResult);
            }
            throw new ProviderUnavailableException(provider.id(), "call timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderUnavailableException
                || cause instanceof MissingChunkException
                || cause instanceof ChecksumMismatchException) {
                throw (StorageException) cause;
            }
            throw new ProviderUnavailableException(provider.id(), String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + provider.id());
        }
    }

    private <T, R> List<Outcome<R>> fanOut(List<T> items, Function<T, R> task) {
        int parallelism = Math.max(1, Math.min(maxConcurrentTransfers, registry.live().size()));
        Semaphore permits = new Semaphore(parallelism);
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            acquire(permits);
            CompletableFuture<R> future = CompletableFuture.supplyAsync(() -> task.apply(item), workers);
            future.whenComplete((r, e) -> permits.release());
            futures.add(future);
        }
        awaitAll(futures);

        List<Outcome<R>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            try {
                outcomes.add(new Outcome<>(future.join(), null));
            } catch (CompletionException | CancellationException e) {
                outcomes.add(new Outcome<>(null, unwrap(e)));
            }
        }
        return outcomes;
    }

    private static void awaitAll(List<? extends CompletableFuture<?>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .handle((v, e) -> null)
            .join();
    }

    private static void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a transfer slot");
        }
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException asRuntime(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        return new StorageException(error.getMessage(), error);
    }

    private static StorageException asStorageException(Throwable error) {
        if (error instanceof StorageException storage) {
            return storage;
        }
        return new StorageException(error.getMessage(), error);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ==================== Stats and lifecycle ====================

    public long getBytesUploaded() {
        return bytesUploaded.get();
    }

    public long getBytesDownloaded() {
        return bytesDownloaded.get();
    }

    public long getOrphanCount() {
        return orphanCount.get();
    }

    public void setOnOrphanedChunk(Consumer<OrphanedChunk> listener) {
        this.onOrphanedChunk = listener;
    }

    @Override
    public void close() {
        workers.shutdown();
        providerCalls.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        providerCalls.shutdownNow();
    }

    private record Outcome<R>(R value, Throwable error) {}
}
