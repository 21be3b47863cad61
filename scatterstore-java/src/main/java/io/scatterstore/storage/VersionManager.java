package io.scatterstore.storage;

import io.scatterstore.storage.ScatterStorage.DeleteResult;
import io.scatterstore.storage.ScatterStorage.VersionAbortedEvent;
import io.scatterstore.storage.ScatterStorage.VersionCommittedEvent;
import io.scatterstore.storage.error.StoredFileNotFoundException;
import io.scatterstore.storage.error.VersionNotFoundException;
import io.scatterstore.storage.manifest.ChunkDescriptor;
import io.scatterstore.storage.manifest.FileManifest;
import io.scatterstore.storage.manifest.ManifestStore;
import io.scatterstore.storage.manifest.ManifestStore.VersionRef;
import io.scatterstore.storage.manifest.VersionRecord;
import io.scatterstore.storage.manifest.VersionState;
import io.scatterstore.storage.transfer.CancellationSignal;
import io.scatterstore.storage.transfer.OrphanedChunk;
import io.scatterstore.storage.transfer.TransferOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives the version lifecycle of each file on top of the manifest store.
 *
 * <p>Writers of one file (update, restore, delete, prune) are serialized by a per-file lock held
 * for the whole operation, so current-pointer transitions are linearizable. The lock is never
 * shared between files. Downloads and listings read manifest snapshots and take no lock.
 */
class VersionManager {

    private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

    private final ManifestStore manifestStore;
    private final TransferOrchestrator orchestrator;
    private final int chunkSize;
    private final int retainedVersions;
    private final Map<String, ReentrantLock> writerLocks = new ConcurrentHashMap<>();

    private volatile Consumer<VersionCommittedEvent> onVersionCommitted;
    private volatile Consumer<VersionAbortedEvent> onVersionAborted;

    VersionManager(ManifestStore manifestStore, TransferOrchestrator orchestrator, int chunkSize, int retainedVersions) {
        this.manifestStore = manifestStore;
        this.orchestrator = orchestrator;
        this.chunkSize = chunkSize;
        this.retainedVersions = retainedVersions;
    }

    /**
     * Create a file and upload its first version. If the upload fails the file is discarded.
     */
    VersionRef upload(String fileName,
                      InputStream input,
                      String notes,
                      CancellationSignal cancel,
                      Consumer<ChunkDescriptor> onChunkStored) {
        VersionRef ref = manifestStore.beginFile(fileName, notes);
        log.info("Uploading {} as {}", fileName, ref.fileId());
        return withWriterLock(ref.fileId(), () -> {
            try {
                VersionRecord committed = orchestrator.upload(
                    ref.fileId(), ref.versionId(), input, chunkSize, true, cancel, onChunkStored);
                fireCommitted(ref.fileId(), committed);
                return ref;
            } catch (RuntimeException e) {
                fireAborted(ref.fileId(), ref.versionId(), e);
                try {
                    manifestStore.discardIfEmpty(ref.fileId());
                } catch (RuntimeException discardFailure) {
                    e.addSuppressed(discardFailure);
                }
                throw e;
            }
        });
    }

    /**
     * Upload a new version of an existing file. It becomes current only once committed.
     */
    long update(String fileId,
                InputStream input,
                String notes,
                CancellationSignal cancel,
                Consumer<ChunkDescriptor> onChunkStored) {
        return withWriterLock(fileId, () -> {
            FileManifest manifest = manifestStore.require(fileId);
            if (manifest.currentVersionId() == null) {
                throw new StoredFileNotFoundException(fileId);
            }
            long versionId = manifestStore.beginVersion(fileId, notes);
            log.info("Updating {} with version {}", fileId, versionId);
            VersionRecord committed;
            try {
                committed = orchestrator.upload(fileId, versionId, input, chunkSize, true, cancel, onChunkStored);
            } catch (RuntimeException e) {
                fireAborted(fileId, versionId, e);
                throw e;
            }
            fireCommitted(fileId, committed);
            if (retainedVersions > 0) {
                applyRetention(fileId);
            }
            return versionId;
        });
    }

    /**
     * Make a complete version current. Restoring the current version changes nothing.
     */
    void restore(String fileId, long versionId) {
        withWriterLock(fileId, () -> {
            manifestStore.setCurrent(fileId, versionId);
            log.info("Restored {} to version {}", fileId, versionId);
            return null;
        });
    }

    /**
     * Delete every chunk of every version, then the manifest. Chunks whose delete failed are
     * reported as orphans and do not stop the delete.
     */
    DeleteResult delete(String fileId) {
        return withWriterLock(fileId, () -> {
            FileManifest manifest = manifestStore.require(fileId);
            List<ChunkDescriptor> chunks = new ArrayList<>();
            for (VersionRecord version : manifest.versions()) {
                chunks.addAll(version.chunks());
            }
            List<OrphanedChunk> orphans = orchestrator.deleteChunks(chunks);
            manifestStore.deleteFile(fileId);
            log.info("Deleted {} ({} chunks, {} orphaned)", fileId, chunks.size(), orphans.size());
            return new DeleteResult(fileId, chunks.size() - orphans.size(), orphans);
        });
    }

    /**
     * Keep the newest {@code keep} stale versions and drop the rest, along with aborted versions.
     *
     * @return ids of the versions removed, oldest first
     */
    List<Long> pruneVersions(String fileId, int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0");
        }
        return withWriterLock(fileId, () -> prune(fileId, keep));
    }

    InputStream download(String fileId, Long versionId) {
        VersionRecord version = resolveReadable(fileId, versionId);
        log.info("Downloading {} version {}", fileId, version.versionId());
        return orchestrator.download(version);
    }

    VersionRecord resolveReadable(String fileId, Long versionId) {
        FileManifest manifest = manifestStore.require(fileId);
        Long target = versionId != null ? versionId : manifest.currentVersionId();
        if (target == null) {
            throw new StoredFileNotFoundException(fileId);
        }
        return manifest.version(target)
            .filter(VersionRecord::isComplete)
            .orElseThrow(() -> new VersionNotFoundException(fileId, target));
    }

    private void applyRetention(String fileId) {
        try {
            prune(fileId, retainedVersions);
        } catch (RuntimeException e) {
            log.warn("Retention pass for {} failed: {}", fileId, e.getMessage());
        }
    }

    private List<Long> prune(String fileId, int keep) {
        FileManifest manifest = manifestStore.require(fileId);
        Long current = manifest.currentVersionId();

        List<VersionRecord> stale = new ArrayList<>();
        List<VersionRecord> doomed = new ArrayList<>();
        for (VersionRecord version : manifestStore.listVersions(fileId)) {
            if (current != null && version.versionId() == current) {
                continue;
            }
            if (version.state() == VersionState.COMPLETE) {
                stale.add(version);
            } else {
                // writers hold the lock, so an UPLOADING version here was left behind by a crash
                doomed.add(version);
            }
        }
        int excess = stale.size() - keep;
        for (int i = 0; i < excess; i++) {
            doomed.add(stale.get(i));
        }
        doomed.sort((a, b) -> Long.compare(a.versionId(), b.versionId()));

        List<Long> removed = new ArrayList<>();
        for (VersionRecord version : doomed) {
            orchestrator.deleteChunks(version.chunks());
            manifestStore.removeVersion(fileId, version.versionId());
            removed.add(version.versionId());
        }
        if (!removed.isEmpty()) {
            log.info("Pruned versions {} of {}", removed, fileId);
        }
        return removed;
    }

    /**
     * Run a write under the file's lock. Unknown ids fail before a lock is created, and the lock
     * is dropped once the file no longer exists.
     */
    private <T> T withWriterLock(String fileId, Supplier<T> action) {
        if (manifestStore.find(fileId).isEmpty()) {
            throw new StoredFileNotFoundException(fileId);
        }
        ReentrantLock lock = writerLocks.computeIfAbsent(fileId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            if (manifestStore.find(fileId).isEmpty()) {
                writerLocks.remove(fileId, lock);
            }
        }
    }

    int writerLockCount() {
        return writerLocks.size();
    }

    private void fireCommitted(String fileId, VersionRecord version) {
        Consumer<VersionCommittedEvent> listener = onVersionCommitted;
        if (listener != null) {
            listener.accept(new VersionCommittedEvent(fileId, version.versionId(), version.chunkCount(), version.totalSize()));
        }
    }

    private void fireAborted(String fileId, long versionId, RuntimeException cause) {
        Consumer<VersionAbortedEvent> listener = onVersionAborted;
        if (listener != null) {
            listener.accept(new VersionAbortedEvent(fileId, versionId, String.valueOf(cause.getMessage())));
        }
    }

    void setOnVersionCommitted(Consumer<VersionCommittedEvent> listener) {
        this.onVersionCommitted = listener;
    }

    void setOnVersionAborted(Consumer<VersionAbortedEvent> listener) {
        this.onVersionAborted = listener;
    }
}
