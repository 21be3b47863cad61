package io.scatterstore.storage.manifest;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for file manifests, one document per file id.
 * Implementations throw {@link io.scatterstore.storage.error.ManifestPersistenceException} when a
 * write cannot be made durable.
 */
public interface ManifestRepository {

    void save(FileManifest manifest);

    Optional<FileManifest> load(String fileId);

    boolean delete(String fileId);

    List<FileManifest> loadAll();
}
