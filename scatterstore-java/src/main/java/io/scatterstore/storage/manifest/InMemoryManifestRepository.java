package io.scatterstore.storage.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryManifestRepository implements ManifestRepository {

    private final ConcurrentHashMap<String, FileManifest> store = new ConcurrentHashMap<>();

    @Override
    public void save(FileManifest manifest) {
        store.put(manifest.fileId(), manifest);
    }

    @Override
    public Optional<FileManifest> load(String fileId) {
        return Optional.ofNullable(store.get(fileId));
    }

    @Override
    public boolean delete(String fileId) {
        return store.remove(fileId) != null;
    }

    @Override
    public List<FileManifest> loadAll() {
        return new ArrayList<>(store.values());
    }
}
