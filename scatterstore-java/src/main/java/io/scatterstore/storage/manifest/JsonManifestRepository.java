package io.scatterstore.storage.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.scatterstore.storage.error.ManifestPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each manifest as {@code <fileId>.json} in one directory.
 * Documents are written to a temporary file and atomically moved into place, so a crash never
 * leaves a half-written manifest behind.
 */
public class JsonManifestRepository implements ManifestRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonManifestRepository.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonManifestRepository(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        this.mapper = createMapper();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new ManifestPersistenceException("Cannot create manifest directory " + this.directory, e);
        }
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(FileManifest manifest) {
        Path target = pathFor(manifest.fileId());
        try {
            Path tmp = Files.createTempFile(directory, ".manifest-", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), manifest);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ManifestPersistenceException("Failed to save manifest " + target, e);
        }
    }

    @Override
    public Optional<FileManifest> load(String fileId) {
        Path path = pathFor(fileId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), FileManifest.class));
        } catch (IOException e) {
            throw new ManifestPersistenceException("Failed to read manifest " + path, e);
        }
    }

    @Override
    public boolean delete(String fileId) {
        try {
            return Files.deleteIfExists(pathFor(fileId));
        } catch (IOException e) {
            throw new ManifestPersistenceException("Failed to delete manifest for " + fileId, e);
        }
    }

    /**
     * Load every readable manifest. Unreadable documents are skipped with a warning so one
     * corrupt file does not take the whole store down.
     */
    @Override
    public List<FileManifest> loadAll() {
        List<FileManifest> manifests = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList()) {
                try {
                    manifests.add(mapper.readValue(path.toFile(), FileManifest.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable manifest {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ManifestPersistenceException("Failed to list manifests in " + directory, e);
        }
        return manifests;
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String fileId) {
        StringBuilder safe = new StringBuilder(fileId.length());
        for (char c : fileId.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                safe.append(c);
            }
        }
        if (safe.length() == 0) {
            throw new IllegalArgumentException("Invalid file id: " + fileId);
        }
        return directory.resolve(safe + SUFFIX);
    }
}
