package io.scatterstore.storage;

import io.scatterstore.storage.ScatterStorage.DeleteResult;
import io.scatterstore.storage.ScatterStorage.FileInfo;
import io.scatterstore.storage.ScatterStorage.FileSummary;
import io.scatterstore.storage.ScatterStorage.OperationHandle;
import io.scatterstore.storage.ScatterStorage.OperationStatus;
import io.scatterstore.storage.ScatterStorage.OperationStatusType;
import io.scatterstore.storage.ScatterStorage.StorageStats;
import io.scatterstore.storage.ScatterStorage.StrayChunk;
import io.scatterstore.storage.ScatterStorage.VersionAbortedEvent;
import io.scatterstore.storage.ScatterStorage.VersionCommittedEvent;
import io.scatterstore.storage.ScatterStorage.VersionInfo;
import io.scatterstore.storage.config.BucketConfig;
import io.scatterstore.storage.config.EngineConfig;
import io.scatterstore.storage.error.ChunkUploadFailedException;
import io.scatterstore.storage.error.ManifestPersistenceException;
import io.scatterstore.storage.error.StorageException;
import io.scatterstore.storage.error.StoredFileNotFoundException;
import io.scatterstore.storage.error.VersionNotFoundException;
import io.scatterstore.storage.manifest.ChunkDescriptor;
import io.scatterstore.storage.manifest.InMemoryManifestRepository;
import io.scatterstore.storage.manifest.VersionRecord;
import io.scatterstore.storage.provider.FlakyChunkProvider;
import io.scatterstore.storage.provider.InMemoryChunkProvider;
import io.scatterstore.storage.provider.ProviderRegistry;
import io.scatterstore.storage.transfer.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScatterStorage")
class ScatterStorageTest {

    private FlakyChunkProvider p0;
    private FlakyChunkProvider p1;
    private FlakyChunkProvider p2;
    private ScatterStorage storage;

    @BeforeEach
    void setUp() {
        p0 = new FlakyChunkProvider("p0");
        p1 = new FlakyChunkProvider("p1");
        p2 = new FlakyChunkProvider("p2");
        storage = newStorage(config(4, 0), ProviderRegistry.of(p0, p1, p2));
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private static EngineConfig config(int chunkSize, int retainedVersions) {
        return EngineConfig.builder()
            .chunkSize(chunkSize)
            .maxConcurrentTransfers(3)
            .retainedVersions(retainedVersions)
            .retryPolicy(RetryPolicy.noBackoff(2))
            .build();
    }

    private static ScatterStorage newStorage(EngineConfig config, ProviderRegistry registry) {
        return new ScatterStorage(config, registry, new InMemoryManifestRepository());
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private String text(String fileId, Long versionId) {
        return new String(storage.downloadBytes(fileId, versionId), StandardCharsets.US_ASCII);
    }

    private List<ChunkDescriptor> chunksOf(String fileId, long versionId) {
        return storage.getManifestStore().getVersion(fileId, versionId).chunks();
    }

    private static int stored(FlakyChunkProvider provider) {
        return ((InMemoryChunkProvider) provider.delegate()).size();
    }

    @Nested
    @DisplayName("Upload and versions")
    class VersionTests {

        @Test
        @DisplayName("should split ABCDEFGHI over three providers, update to XYZ and keep version 1 restorable")
        void alphabetScenario() {
            String fileId = storage.upload("letters.txt", ascii("ABCDEFGHI"));

            List<ChunkDescriptor> v1 = chunksOf(fileId, 1);
            assertEquals(3, v1.size());
            assertEquals(List.of("bucket-0", "bucket-1", "bucket-2"), v1.stream().map(ChunkDescriptor::providerId).toList());
            assertEquals(List.of(4, 4, 1), v1.stream().map(ChunkDescriptor::size).toList());
            assertEquals("ABCDEFGHI", text(fileId, null));

            long v2 = storage.update(fileId, ascii("XYZ"), "shorter");

            assertEquals(2, v2);
            assertEquals(1, chunksOf(fileId, v2).size());
            assertEquals("XYZ", text(fileId, null));
            assertEquals("ABCDEFGHI", text(fileId, 1L));

            List<VersionInfo> versions = storage.listVersions(fileId);
            assertEquals(List.of(1L, 2L), versions.stream().map(VersionInfo::versionId).toList());
            assertFalse(versions.get(0).current());
            assertTrue(versions.get(1).current());
            assertEquals("shorter", versions.get(1).notes());
            assertEquals(3, versions.get(0).chunkCount());

            storage.restore(fileId, 1);

            assertEquals("ABCDEFGHI", text(fileId, null));
            assertTrue(storage.listVersions(fileId).get(0).current());
        }

        @Test
        @DisplayName("should list files with the chunk count of their current version")
        void listFiles() {
            String a = storage.upload("a.txt", ascii("ABCDEFGHI"));
            String b = storage.upload("b.txt", ascii("XY"));

            List<FileSummary> files = storage.listFiles();

            assertEquals(2, files.size());
            assertTrue(files.containsAll(List.of(new FileSummary(a, "a.txt", 3), new FileSummary(b, "b.txt", 1))));

            FileInfo info = storage.getFile(a).orElseThrow();
            assertEquals(1, info.currentVersionId());
            assertEquals(9, info.size());
            assertEquals(3, info.chunkCount());
            assertTrue(storage.getFile("missing").isEmpty());
        }

        @Test
        @DisplayName("should place no chunk on a dead provider and still succeed with two live ones")
        void deadProviderSkipped() {
            InMemoryChunkProvider dead = new InMemoryChunkProvider("dead");
            dead.setOnline(false);
            InMemoryChunkProvider a = new InMemoryChunkProvider("a");
            InMemoryChunkProvider b = new InMemoryChunkProvider("b");
            try (ScatterStorage partial = newStorage(config(4, 0), ProviderRegistry.of(a, dead, b))) {
                String fileId = partial.upload("five.bin", ascii("0123456789ABCDEFGHIJ"));

                List<ChunkDescriptor> chunks = partial.getManifestStore().getVersion(fileId, 1).chunks();
                assertEquals(5, chunks.size());
                assertTrue(chunks.stream().noneMatch(c -> c.providerId().equals("bucket-1")));
                assertEquals(0, dead.size());
                assertEquals(5, a.size() + b.size());
                assertArrayEquals(ascii("0123456789ABCDEFGHIJ"), partial.downloadBytes(fileId, null));
            }
        }

        @Test
        @DisplayName("restoring the current version should change nothing")
        void restoreIdempotent() {
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            storage.update(fileId, ascii("XYZ"), null);
            FileInfo before = storage.getFile(fileId).orElseThrow();

            storage.restore(fileId, 2);
            storage.restore(fileId, 2);

            assertEquals(before, storage.getFile(fileId).orElseThrow());
            assertEquals(1, storage.listVersions(fileId).stream().filter(VersionInfo::current).count());
        }

        @Test
        @DisplayName("should list versions in creation order with exactly one current")
        void versionOrdering() {
            String fileId = storage.upload("a.txt", ascii("v1"));
            for (int i = 2; i <= 5; i++) {
                storage.update(fileId, ascii("v" + i), "rev " + i);
            }
            storage.restore(fileId, 3);

            List<VersionInfo> versions = storage.listVersions(fileId);

            assertEquals(List.of(1L, 2L, 3L, 4L, 5L), versions.stream().map(VersionInfo::versionId).toList());
            assertEquals(List.of(3L), versions.stream().filter(VersionInfo::current).map(VersionInfo::versionId).toList());
            for (int i = 1; i < versions.size(); i++) {
                assertFalse(versions.get(i).createdAt().isBefore(versions.get(i - 1).createdAt()));
            }
        }

        @ParameterizedTest(name = "{0} bytes")
        @ValueSource(ints = {0, 1, 3, 4, 5, 12, 13, 1000})
        @DisplayName("should return exactly the uploaded bytes")
        void roundTrip(int length) {
            byte[] data = new byte[length];
            new Random(length).nextBytes(data);

            String fileId = storage.upload("blob.bin", data);

            assertArrayEquals(data, storage.downloadBytes(fileId, null));
            assertEquals(length, storage.getFile(fileId).orElseThrow().size());
        }

        @Test
        @DisplayName("should surface structural errors immediately")
        void notFound() {
            String fileId = storage.upload("a.txt", ascii("ABCD"));

            assertThrows(StoredFileNotFoundException.class, () -> storage.download("nope"));
            assertThrows(StoredFileNotFoundException.class, () -> storage.update("nope", ascii("x"), null));
            assertThrows(StoredFileNotFoundException.class, () -> storage.listVersions("nope"));
            assertThrows(VersionNotFoundException.class, () -> storage.restore(fileId, 42));
            assertThrows(VersionNotFoundException.class, () -> storage.download(fileId, 42L));
        }
    }

    @Nested
    @DisplayName("Failure atomicity")
    class AtomicityTests {

        @Test
        @DisplayName("should keep the previous version current when an update fails at chunk k")
        void failedUpdateKeepsCurrent() {
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            p0.failPutsWhere(name -> name.endsWith("_v2_chunk_3"));
            p1.failPutsWhere(name -> name.endsWith("_v2_chunk_3"));
            p2.failPutsWhere(name -> name.endsWith("_v2_chunk_3"));

            assertThrows(ChunkUploadFailedException.class,
                () -> storage.update(fileId, ascii("0123456789ABCDEFGHIJ"), "doomed"));

            assertEquals(1, storage.getFile(fileId).orElseThrow().currentVersionId());
            assertEquals("ABCDEFGHI", text(fileId, null));
            assertEquals(List.of(1L), storage.listVersions(fileId).stream().map(VersionInfo::versionId).toList());
            for (VersionRecord version : storage.getManifestStore().listVersions(fileId)) {
                assertTrue(!version.isComplete() || version.versionId() == 1);
            }
            assertEquals(3, stored(p0) + stored(p1) + stored(p2));
        }

        @Test
        @DisplayName("should discard a new file whose first upload fails")
        void failedFirstUpload() {
            p0.failAllPuts();
            p1.failAllPuts();
            p2.failAllPuts();
            List<VersionAbortedEvent> aborted = new CopyOnWriteArrayList<>();
            storage.setOnVersionAborted(aborted::add);

            assertThrows(StorageException.class, () -> storage.upload("a.txt", ascii("ABCDEFGHI")));

            assertTrue(storage.listFiles().isEmpty());
            assertTrue(storage.getManifestStore().allManifests().isEmpty());
            assertEquals(1, aborted.size());
            assertEquals(0, stored(p0) + stored(p1) + stored(p2));
        }

        @Test
        @DisplayName("should cancel an in-flight upload and roll it back")
        void cancelUpload() throws Exception {
            p0.delayPuts(100);
            p1.delayPuts(100);
            p2.delayPuts(100);

            OperationHandle<String> handle = storage.uploadAsync("slow.bin",
                new ByteArrayInputStream(new byte[4 * 30]));
            assertTrue(storage.cancelOperation(handle.operationId()));

            ExecutionException e = assertThrows(ExecutionException.class, () -> handle.future().get(10, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, e.getCause());
            OperationStatus status = storage.getOperationStatus(handle.operationId()).orElseThrow();
            assertEquals(OperationStatusType.CANCELLED, status.status());
            assertNotNull(status.completedAt());
            assertTrue(storage.listFiles().isEmpty());
            assertEquals(0, stored(p0) + stored(p1) + stored(p2));
            assertFalse(storage.cancelOperation(handle.operationId()));
        }
    }

    @Nested
    @DisplayName("Delete and retention")
    class DeleteTests {

        @Test
        @DisplayName("should delete every locator of every version")
        void deleteCompleteness() {
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            storage.update(fileId, ascii("XYZXYZ"), null);
            String other = storage.upload("b.txt", ascii("keep"));

            DeleteResult result = storage.delete(fileId);

            assertTrue(result.isClean());
            assertEquals(5, result.deletedChunks());
            assertEquals(List.of(other), storage.listFiles().stream().map(FileSummary::fileId).toList());
            for (FlakyChunkProvider provider : List.of(p0, p1, p2)) {
                for (String locator : provider.writtenLocators()) {
                    if (locator.startsWith(fileId)) {
                        assertTrue(provider.deletedLocators().contains(locator), locator);
                    }
                }
            }
            assertEquals(1, stored(p0) + stored(p1) + stored(p2));
            assertThrows(StoredFileNotFoundException.class, () -> storage.delete(fileId));
        }

        @Test
        @DisplayName("should finish a delete even when a provider refuses, reporting orphans")
        void deleteWithOrphans() {
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            p1.failDeletes(true);

            DeleteResult result = storage.delete(fileId);

            assertFalse(result.isClean());
            assertEquals(1, result.orphans().size());
            assertEquals("bucket-1", result.orphans().get(0).providerId());
            assertTrue(storage.listFiles().isEmpty());
            assertEquals(1, storage.stats().orphanedChunks());
        }

        @Test
        @DisplayName("should prune stale versions beyond the retention limit")
        void retention() {
            try (ScatterStorage retaining = newStorage(config(4, 1), ProviderRegistry.of(p0, p1, p2))) {
                String fileId = retaining.upload("a.txt", ascii("v1"));
                retaining.update(fileId, ascii("v2"), null);
                retaining.update(fileId, ascii("v3"), null);
                retaining.update(fileId, ascii("v4"), null);

                assertEquals(List.of(3L, 4L), retaining.listVersions(fileId).stream().map(VersionInfo::versionId).toList());
                assertEquals(2, stored(p0) + stored(p1) + stored(p2));
                assertArrayEquals(ascii("v3"), retaining.downloadBytes(fileId, 3L));
            }
        }

        @Test
        @DisplayName("should prune on demand and never drop the current version")
        void pruneOnDemand() {
            String fileId = storage.upload("a.txt", ascii("v1"));
            storage.update(fileId, ascii("v2"), null);
            storage.update(fileId, ascii("v3"), null);
            storage.restore(fileId, 2);

            List<Long> removed = storage.pruneVersions(fileId, 0);

            assertEquals(List.of(1L, 3L), removed);
            assertEquals(List.of(2L), storage.listVersions(fileId).stream().map(VersionInfo::versionId).toList());
            assertEquals("v2", text(fileId, null));
            assertThrows(IllegalArgumentException.class, () -> storage.pruneVersions(fileId, -1));
        }
    }

    @Nested
    @DisplayName("Operations and queries")
    class OperationTests {

        @Test
        @DisplayName("should track async operations to completion")
        void asyncUpload() throws Exception {
            List<VersionCommittedEvent> committed = new CopyOnWriteArrayList<>();
            storage.setOnVersionCommitted(committed::add);

            OperationHandle<String> handle = storage.uploadAsync("a.txt", new ByteArrayInputStream(ascii("ABCDEFGHI")));
            String fileId = handle.future().get(10, TimeUnit.SECONDS);

            OperationStatus status = storage.getOperationStatus(handle.operationId()).orElseThrow();
            assertEquals(OperationStatusType.COMPLETED, status.status());
            assertEquals(fileId, status.fileId());
            assertEquals(3, status.chunksStored());
            assertEquals(9, status.bytesProcessed());
            assertTrue(handle.operationId().startsWith("op-"));
            assertFalse(storage.cancelOperation(handle.operationId()));
            assertEquals(1, committed.size());
            assertEquals(new VersionCommittedEvent(fileId, 1, 3, 9), committed.get(0));

            long v2 = storage.updateAsync(fileId, new ByteArrayInputStream(ascii("XYZ")), "async")
                .future().get(10, TimeUnit.SECONDS);
            assertEquals(2, v2);
            assertTrue(storage.getActiveOperations().isEmpty());
        }

        @Test
        @DisplayName("should report chunk events as they are stored")
        void chunkEvents() {
            List<ScatterStorage.ChunkStoredEvent> events = new CopyOnWriteArrayList<>();
            storage.setOnChunkStored(events::add);

            storage.upload("a.txt", ascii("ABCDEFGHI"));

            assertEquals(List.of(0, 1, 2), events.stream().map(ScatterStorage.ChunkStoredEvent::index).sorted().toList());
        }

        @Test
        @DisplayName("should summarize files, versions and traffic")
        void stats() {
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            storage.update(fileId, ascii("XYZ"), null);
            storage.downloadBytes(fileId, null);

            StorageStats stats = storage.stats();

            assertEquals(1, stats.fileCount());
            assertEquals(2, stats.versionCount());
            assertEquals(3, stats.providerCount());
            assertEquals(3, stats.liveProviderCount());
            assertEquals(12, stats.bytesUploaded());
            assertEquals(3, stats.bytesDownloaded());
            assertEquals(0, stats.orphanedChunks());
        }

        @Test
        @DisplayName("should find chunks that no manifest references")
        void findOrphans() {
            storage.upload("a.txt", ascii("ABCDEFGHI"));
            String stray = p1.put("leftover_chunk_0", ascii("junk"));

            List<StrayChunk> strays = storage.findOrphans();

            assertEquals(List.of(new StrayChunk("bucket-1", stray)), strays);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        private <T> List<T> runTogether(List<Callable<T>> tasks) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<T>> futures = new ArrayList<>();
                for (Callable<T> task : tasks) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return task.call();
                    }));
                }
                start.countDown();
                List<T> results = new ArrayList<>();
                for (Future<T> future : futures) {
                    results.add(future.get(30, TimeUnit.SECONDS));
                }
                return results;
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("should serialize parallel updates of one file into distinct complete versions")
        void parallelUpdatesOfOneFile() throws Exception {
            String fileId = storage.upload("shared.txt", ascii("base"));
            int writers = 12;
            List<Callable<Long>> tasks = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String payload = String.format("rev-%02d", i);
                tasks.add(() -> storage.update(fileId, ascii(payload), payload));
            }

            List<Long> ids = runTogether(tasks);

            assertEquals(writers, new HashSet<>(ids).size());
            List<VersionInfo> versions = storage.listVersions(fileId);
            assertEquals(writers + 1, versions.size());
            assertEquals(writers + 1, versions.stream().map(VersionInfo::versionId).distinct().count());
            List<VersionInfo> current = versions.stream().filter(VersionInfo::current).toList();
            assertEquals(1, current.size());
            long newest = Collections.max(ids);
            assertEquals(newest, current.get(0).versionId());
            assertEquals(current.get(0).notes(), text(fileId, null));
            for (VersionInfo version : versions) {
                assertEquals(version.versionId() == 1 ? "base" : version.notes(), text(fileId, version.versionId()));
            }
        }

        @Test
        @DisplayName("should upload different files in parallel without interference")
        void parallelUploadsOfDifferentFiles() throws Exception {
            int files = 8;
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < files; i++) {
                String name = "file-" + i + ".txt";
                String payload = "contents of file number " + i;
                tasks.add(() -> storage.upload(name, ascii(payload)));
            }

            List<String> ids = runTogether(tasks);

            assertEquals(files, new HashSet<>(ids).size());
            assertEquals(files, storage.listFiles().size());
            for (int i = 0; i < files; i++) {
                assertEquals("contents of file number " + i, text(ids.get(i), null));
                assertEquals("file-" + i + ".txt", storage.getFile(ids.get(i)).orElseThrow().fileName());
            }
        }

        @Test
        @DisplayName("should not leave writer locks behind for unknown or deleted files")
        void writerLocksFollowFiles() {
            assertThrows(StoredFileNotFoundException.class, () -> storage.restore("missing", 1));
            assertThrows(StoredFileNotFoundException.class, () -> storage.update("missing", ascii("x"), null));
            assertEquals(0, storage.getVersionManager().writerLockCount());

            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));
            assertEquals(1, storage.getVersionManager().writerLockCount());

            storage.delete(fileId);
            assertEquals(0, storage.getVersionManager().writerLockCount());
        }

        @Test
        @DisplayName("should keep the file and its writer lock when the manifest delete fails")
        void failedDeleteKeepsWriterLock() {
            AtomicBoolean failDeletes = new AtomicBoolean(true);
            InMemoryManifestRepository repository = new InMemoryManifestRepository() {
                @Override
                public boolean delete(String fileId) {
                    if (failDeletes.get()) {
                        throw new ManifestPersistenceException("disk full", new IOException("disk full"));
                    }
                    return super.delete(fileId);
                }
            };
            storage.close();
            storage = new ScatterStorage(config(4, 0), ProviderRegistry.of(p0, p1, p2), repository);
            String fileId = storage.upload("a.txt", ascii("ABCDEFGHI"));

            assertThrows(ManifestPersistenceException.class, () -> storage.delete(fileId));
            assertTrue(storage.getFile(fileId).isPresent());
            assertEquals(1, storage.getVersionManager().writerLockCount());

            failDeletes.set(false);
            storage.delete(fileId);
            assertTrue(storage.getFile(fileId).isEmpty());
            assertEquals(0, storage.getVersionManager().writerLockCount());
        }
    }

    @Nested
    @DisplayName("Durability")
    class DurabilityTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should reopen from disk with directory buckets and JSON manifests")
        void reopen() {
            EngineConfig config = EngineConfig.builder()
                .bucket(BucketConfig.directory(dir.resolve("b0").toString()))
                .bucket(BucketConfig.directory(dir.resolve("b1").toString()))
                .chunkSize(4)
                .manifestDirectory(dir.resolve("manifests"))
                .encryptionEnabled(true)
                .encryptionKey("test-key")
                .build();

            String fileId;
            try (ScatterStorage first = new ScatterStorage(config)) {
                fileId = first.upload("persisted.txt", ascii("ABCDEFGHI"));
                first.update(fileId, ascii("XYZ"), "second");
            }

            try (ScatterStorage reopened = new ScatterStorage(config)) {
                assertEquals(List.of(fileId), reopened.listFiles().stream().map(FileSummary::fileId).toList());
                assertArrayEquals(ascii("XYZ"), reopened.downloadBytes(fileId, null));
                assertArrayEquals(ascii("ABCDEFGHI"), reopened.downloadBytes(fileId, 1L));
                assertEquals(2, reopened.listVersions(fileId).size());
                assertTrue(reopened.findOrphans().isEmpty());
            }
        }
    }
}
