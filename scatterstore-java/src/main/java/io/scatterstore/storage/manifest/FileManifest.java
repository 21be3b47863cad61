package io.scatterstore.storage.manifest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The durable record of one logical file: its versions and the current pointer.
 * Instances are immutable; every mutation returns a new manifest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileManifest(
    @JsonProperty("format") int format,
    @JsonProperty("fileId") String fileId,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("currentVersionId") Long currentVersionId,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("modifiedAt") Instant modifiedAt,
    @JsonProperty("nextVersionId") long nextVersionId,
    @JsonProperty("versions") List<VersionRecord> versions
) {
    public static final int FORMAT = 1;

    public FileManifest {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }

    static FileManifest create(String fileId, String fileName, Instant now) {
        return new FileManifest(FORMAT, fileId, fileName, null, now, now, 1, List.of());
    }

    public Optional<VersionRecord> version(long versionId) {
        return versions.stream().filter(v -> v.versionId() == versionId).findFirst();
    }

    @JsonIgnore
    public Optional<VersionRecord> currentVersion() {
        return currentVersionId == null ? Optional.empty() : version(currentVersionId);
    }

    @JsonIgnore
    public boolean hasCompleteVersion() {
        return versions.stream().anyMatch(VersionRecord::isComplete);
    }

    FileManifest withNewVersion(VersionRecord version) {
        List<VersionRecord> updated = new ArrayList<>(versions);
        updated.add(version);
        return new FileManifest(format, fileId, fileName, currentVersionId, createdAt, modifiedAt,
            version.versionId() + 1, updated);
    }

    FileManifest withVersion(long versionId, UnaryOperator<VersionRecord> change) {
        List<VersionRecord> updated = new ArrayList<>(versions.size());
        for (VersionRecord v : versions) {
            updated.add(v.versionId() == versionId ? change.apply(v) : v);
        }
        return new FileManifest(format, fileId, fileName, currentVersionId, createdAt, modifiedAt,
            nextVersionId, updated);
    }

    FileManifest withoutVersion(long versionId) {
        List<VersionRecord> updated = versions.stream().filter(v -> v.versionId() != versionId).toList();
        return new FileManifest(format, fileId, fileName, currentVersionId, createdAt, modifiedAt,
            nextVersionId, updated);
    }

    FileManifest withCurrent(long versionId, Instant now) {
        return new FileManifest(format, fileId, fileName, versionId, createdAt, now, nextVersionId, versions);
    }
}
