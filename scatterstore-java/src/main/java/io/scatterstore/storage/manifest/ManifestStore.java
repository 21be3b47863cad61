package io.scatterstore.storage.manifest;

import io.scatterstore.storage.error.IncompleteVersionException;
import io.scatterstore.storage.error.StoredFileNotFoundException;
import io.scatterstore.storage.error.VersionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for files, versions and chunk placements.
 *
 * <p>Every mutation runs under a per-file lock, persists the whole file document through the
 * {@link ManifestRepository} and only then publishes the new snapshot. Reads are lock-free and see
 * the last published snapshot. Mutations of unrelated files never contend.
 *
 * <p>No lock is held while talking to a provider: callers do their network work between
 * manifest calls.
 */
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    private final ManifestRepository repository;
    private final Clock clock;
    private final Map<String, FileManifest> files = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ManifestStore(ManifestRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public ManifestStore(ManifestRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        for (FileManifest manifest : repository.loadAll()) {
            files.put(manifest.fileId(), manifest);
        }
        if (!files.isEmpty()) {
            log.info("Loaded {} file manifests", files.size());
        }
    }

    /**
     * Create a file together with its first, still incomplete, version.
     * The file is not listed until that version commits.
     */
    public VersionRef beginFile(String fileName, String notes) {
        String fileId = UUID.randomUUID().toString();
        ReentrantLock lock = lockFor(fileId);
        lock.lock();
        try {
            FileManifest manifest = FileManifest.create(fileId, fileName, clock.instant());
            VersionRecord first = VersionRecord.started(manifest.nextVersionId(), clock.instant(), notes);
            publish(manifest.withNewVersion(first));
            return new VersionRef(fileId, first.versionId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Allocate a new incomplete version. Does not touch the current pointer.
     */
    public long beginVersion(String fileId, String notes) {
        FileManifest updated = mutate(fileId, m ->
            m.withNewVersion(VersionRecord.started(m.nextVersionId(), clock.instant(), notes)));
        return updated.nextVersionId() - 1;
    }

    /**
     * Record a stored chunk. Re-recording the same index replaces the earlier descriptor.
     */
    public void recordChunk(String fileId, long versionId, ChunkDescriptor descriptor) {
        if (!fileId.equals(descriptor.fileId()) || versionId != descriptor.versionId()) {
            throw new IllegalArgumentException("Descriptor does not belong to " + fileId + " v" + versionId);
        }
        mutate(fileId, m -> {
            VersionRecord version = requireVersion(m, versionId);
            if (version.state() != VersionState.UPLOADING) {
                throw new IllegalStateException(
                    "Version " + versionId + " of " + fileId + " is " + version.state() + ", not accepting chunks");
            }
            return m.withVersion(versionId, v -> v.withChunk(descriptor));
        });
    }

    /**
     * Validate and complete a version, optionally making it current.
     *
     * @throws IncompleteVersionException if the recorded chunks do not form the contiguous,
     *     checksummed range described by {@code summary}
     */
    public VersionRecord commitVersion(String fileId, long versionId, VersionSummary summary, boolean makeCurrent) {
        FileManifest updated = mutate(fileId, m -> {
            VersionRecord version = requireVersion(m, versionId);
            if (version.state() == VersionState.DEAD) {
                throw new IncompleteVersionException(fileId, versionId, "version was aborted");
            }
            if (version.state() == VersionState.UPLOADING) {
                validate(fileId, version, summary);
                m = m.withVersion(versionId, v -> v.completed(summary.totalSize(), summary.checksum()));
            }
            return makeCurrent ? m.withCurrent(versionId, clock.instant()) : m;
        });
        log.info("Committed version {} of {} ({} chunks)", versionId, fileId, summary.chunkCount());
        return requireVersion(updated, versionId);
    }

    /**
     * Mark a version dead. It was never current and never will be.
     */
    public void abortVersion(String fileId, long versionId) {
        mutate(fileId, m -> {
            VersionRecord version = requireVersion(m, versionId);
            if (version.state() == VersionState.COMPLETE) {
                throw new IllegalStateException("Cannot abort committed version " + versionId + " of " + fileId);
            }
            return version.state() == VersionState.DEAD ? m : m.withVersion(versionId, VersionRecord::dead);
        });
        log.info("Aborted version {} of {}", versionId, fileId);
    }

    /**
     * Point the file at an existing complete version. Never moves chunk bytes.
     */
    public void setCurrent(String fileId, long versionId) {
        mutate(fileId, m -> {
            VersionRecord version = m.version(versionId)
                .filter(VersionRecord::isComplete)
                .orElseThrow(() -> new VersionNotFoundException(fileId, versionId));
            if (m.currentVersionId() != null && m.currentVersionId() == version.versionId()) {
                return m;
            }
            return m.withCurrent(versionId, clock.instant());
        });
    }

    /**
     * Drop a non-current version's descriptors. Provider cleanup must already have happened.
     */
    public void removeVersion(String fileId, long versionId) {
        mutate(fileId, m -> {
            requireVersion(m, versionId);
            if (m.currentVersionId() != null && m.currentVersionId() == versionId) {
                throw new IllegalStateException("Cannot remove current version " + versionId + " of " + fileId);
            }
            return m.withoutVersion(versionId);
        });
    }

    /**
     * Remove the file and everything under it. Provider cleanup must already have happened.
     */
    public boolean deleteFile(String fileId) {
        if (!files.containsKey(fileId)) {
            return false;
        }
        ReentrantLock lock = lockFor(fileId);
        lock.lock();
        try {
            if (!files.containsKey(fileId)) {
                return false;
            }
            repository.delete(fileId);
            files.remove(fileId);
        } finally {
            lock.unlock();
            releaseLockIfGone(fileId, lock);
        }
        log.info("Deleted manifest for {}", fileId);
        return true;
    }

    /**
     * Remove the file if it never got a complete version, e.g. after its first upload aborted.
     */
    public boolean discardIfEmpty(String fileId) {
        FileManifest manifest = files.get(fileId);
        if (manifest == null || manifest.hasCompleteVersion()) {
            return false;
        }
        return deleteFile(fileId);
    }

    public Optional<FileManifest> find(String fileId) {
        return Optional.ofNullable(files.get(fileId));
    }

    public FileManifest require(String fileId) {
        FileManifest manifest = files.get(fileId);
        if (manifest == null) {
            throw new StoredFileNotFoundException(fileId);
        }
        return manifest;
    }

    /**
     * All versions of a file, in creation order, whatever their state.
     */
    public List<VersionRecord> listVersions(String fileId) {
        return require(fileId).versions().stream()
            .sorted(Comparator.comparingLong(VersionRecord::versionId))
            .toList();
    }

    public VersionRecord getVersion(String fileId, long versionId) {
        return require(fileId).version(versionId)
            .orElseThrow(() -> new VersionNotFoundException(fileId, versionId));
    }

    /**
     * Files that have a current version, oldest first.
     */
    public List<FileManifest> listFiles() {
        return files.values().stream()
            .filter(m -> m.currentVersionId() != null)
            .sorted(Comparator.comparing(FileManifest::createdAt).thenComparing(FileManifest::fileId))
            .toList();
    }

    /**
     * Every manifest, including files whose first version is still uploading.
     */
    public List<FileManifest> allManifests() {
        return List.copyOf(files.values());
    }

    private FileManifest mutate(String fileId, UnaryOperator<FileManifest> change) {
        if (!files.containsKey(fileId)) {
            throw new StoredFileNotFoundException(fileId);
        }
        ReentrantLock lock = lockFor(fileId);
        lock.lock();
        try {
            FileManifest current = files.get(fileId);
            if (current == null) {
                throw new StoredFileNotFoundException(fileId);
            }
            FileManifest updated = change.apply(current);
            if (updated != current) {
                publish(updated);
            }
            return updated;
        } finally {
            lock.unlock();
            releaseLockIfGone(fileId, lock);
        }
    }

    private void publish(FileManifest manifest) {
        repository.save(manifest);
        files.put(manifest.fileId(), manifest);
    }

    private ReentrantLock lockFor(String fileId) {
        return locks.computeIfAbsent(fileId, id -> new ReentrantLock());
    }

    // a lock outlives its file only while a failed delete left the file in place
    private void releaseLockIfGone(String fileId, ReentrantLock lock) {
        if (!files.containsKey(fileId)) {
            locks.remove(fileId, lock);
        }
    }

    int lockCount() {
        return locks.size();
    }

    private static VersionRecord requireVersion(FileManifest manifest, long versionId) {
        return manifest.version(versionId)
            .orElseThrow(() -> new VersionNotFoundException(manifest.fileId(), versionId));
    }

    private static void validate(String fileId, VersionRecord version, VersionSummary summary) {
        List<ChunkDescriptor> chunks = version.chunks();
        if (summary.chunkCount() < 1) {
            throw new IncompleteVersionException(fileId, version.versionId(), "a version needs at least one chunk");
        }
        if (chunks.size() != summary.chunkCount()) {
            throw new IncompleteVersionException(fileId, version.versionId(),
                chunks.size() + " of " + summary.chunkCount() + " chunks recorded");
        }
        long bytes = 0;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkDescriptor chunk = chunks.get(i);
            if (chunk.index() != i) {
                throw new IncompleteVersionException(fileId, version.versionId(), "chunk " + i + " is missing");
            }
            if (chunk.checksum() == null || chunk.checksum().isBlank()) {
                throw new IncompleteVersionException(fileId, version.versionId(), "chunk " + i + " has no checksum");
            }
            if (chunk.locator() == null || chunk.providerId() == null) {
                throw new IncompleteVersionException(fileId, version.versionId(), "chunk " + i + " has no placement");
            }
            bytes += chunk.size();
        }
        if (bytes != summary.totalSize()) {
            throw new IncompleteVersionException(fileId, version.versionId(),
                "recorded " + bytes + " bytes, expected " + summary.totalSize());
        }
    }

    public record VersionRef(String fileId, long versionId) {}
}
