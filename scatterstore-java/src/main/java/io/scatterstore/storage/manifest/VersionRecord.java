package io.scatterstore.storage.manifest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable snapshot of one version of a file. Chunks are kept sorted by index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionRecord(
    @JsonProperty("versionId") long versionId,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("notes") String notes,
    @JsonProperty("state") VersionState state,
    @JsonProperty("chunks") List<ChunkDescriptor> chunks,
    @JsonProperty("totalSize") long totalSize,
    @JsonProperty("checksum") String checksum
) {
    public VersionRecord {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        notes = notes == null ? "" : notes;
    }

    static VersionRecord started(long versionId, Instant createdAt, String notes) {
        return new VersionRecord(versionId, createdAt, notes, VersionState.UPLOADING, List.of(), 0, null);
    }

    @JsonIgnore
    public int chunkCount() {
        return chunks.size();
    }

    @JsonIgnore
    public boolean isComplete() {
        return state == VersionState.COMPLETE;
    }

    VersionRecord withChunk(ChunkDescriptor descriptor) {
        List<ChunkDescriptor> updated = new ArrayList<>(chunks.size() + 1);
        for (ChunkDescriptor existing : chunks) {
            if (existing.index() != descriptor.index()) {
                updated.add(existing);
            }
        }
        updated.add(descriptor);
        updated.sort(Comparator.comparingInt(ChunkDescriptor::index));
        return new VersionRecord(versionId, createdAt, notes, state, updated, totalSize, checksum);
    }

    VersionRecord completed(long totalSize, String checksum) {
        return new VersionRecord(versionId, createdAt, notes, VersionState.COMPLETE, chunks, totalSize, checksum);
    }

    VersionRecord dead() {
        return new VersionRecord(versionId, createdAt, notes, VersionState.DEAD, chunks, totalSize, checksum);
    }
}
