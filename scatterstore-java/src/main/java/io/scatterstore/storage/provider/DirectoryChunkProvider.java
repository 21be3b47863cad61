package io.scatterstore.storage.provider;

import io.scatterstore.storage.error.MissingChunkException;
import io.scatterstore.storage.error.ProviderUnavailableException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Bucket backed by a directory on a local or mounted filesystem.
 * Each chunk is one file; the locator is its file name relative to the root. Every write gets a
 * fresh locator, so a retried write never shares a file with an abandoned one.
 */
public class DirectoryChunkProvider implements ChunkProvider {

    public static final String TYPE = "directory";
    private static final String CHUNK_SUFFIX = ".chunk";

    private final Path root;
    private final AtomicLong writeCounter = new AtomicLong(System.currentTimeMillis());

    public DirectoryChunkProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String put(String chunkName, byte[] data) {
        String locator = sanitize(chunkName) + "-" + Long.toHexString(writeCounter.incrementAndGet()) + CHUNK_SUFFIX;
        Path target = resolve(locator);
        try {
            Files.createDirectories(root);
            Path tmp = Files.createTempFile(root, ".upload-", ".tmp");
            try {
                Files.write(tmp, data);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return locator;
        } catch (IOException e) {
            throw new ProviderUnavailableException(root.toString(), "write failed for " + locator, e);
        }
    }

    @Override
    public byte[] get(String locator) {
        Path path = resolve(locator);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new MissingChunkException(-1, root + ": no chunk at " + locator);
        } catch (IOException e) {
            throw new ProviderUnavailableException(root.toString(), "read failed for " + locator, e);
        }
    }

    @Override
    public boolean delete(String locator) {
        try {
            return Files.deleteIfExists(resolve(locator));
        } catch (IOException e) {
            throw new ProviderUnavailableException(root.toString(), "delete failed for " + locator, e);
        }
    }

    @Override
    public boolean probe() {
        if (!Files.exists(root)) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                return false;
            }
        }
        return Files.isDirectory(root) && Files.isWritable(root);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(CHUNK_SUFFIX))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new ProviderUnavailableException(root.toString(), "listing failed", e);
        }
    }

    @Override
    public ProviderUsage usage() {
        List<String> locators = list();
        long bytes = 0;
        for (String locator : locators) {
            try {
                bytes += Files.size(resolve(locator));
            } catch (IOException e) {
                throw new ProviderUnavailableException(root.toString(), "size lookup failed for " + locator, e);
            }
        }
        return new ProviderUsage(locators.size(), bytes);
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String locator) {
        Path path = root.resolve(locator).normalize();
        Path parent = path.getParent();
        if (parent == null || !parent.equals(root)) {
            throw new IllegalArgumentException("Locator escapes provider root: " + locator);
        }
        return path;
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
