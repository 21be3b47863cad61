package io.scatterstore.storage.provider;

import io.scatterstore.storage.error.MissingChunkException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DirectoryChunkProvider")
class DirectoryChunkProviderTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("should store, read and delete chunks as files")
    void putGetDelete() {
        DirectoryChunkProvider provider = new DirectoryChunkProvider(root.resolve("bucket"));
        byte[] data = "chunk bytes".getBytes(StandardCharsets.UTF_8);

        String locator = provider.put("file1_v1_chunk_0", data);

        assertTrue(locator.startsWith("file1_v1_chunk_0"));
        assertTrue(Files.exists(root.resolve("bucket").resolve(locator)));
        assertArrayEquals(data, provider.get(locator));
        assertTrue(provider.delete(locator));
        assertFalse(provider.delete(locator));
        assertThrows(MissingChunkException.class, () -> provider.get(locator));
    }

    @Test
    @DisplayName("should issue a distinct locator for every write")
    void distinctLocators() {
        DirectoryChunkProvider provider = new DirectoryChunkProvider(root);

        String first = provider.put("same", new byte[]{1});
        String second = provider.put("same", new byte[]{2});

        assertNotEquals(first, second);
        assertArrayEquals(new byte[]{1}, provider.get(first));
        assertArrayEquals(new byte[]{2}, provider.get(second));
    }

    @Test
    @DisplayName("should list chunks and report usage, ignoring temp files")
    void listAndUsage() throws Exception {
        DirectoryChunkProvider provider = new DirectoryChunkProvider(root);
        String a = provider.put("a", new byte[10]);
        String b = provider.put("b", new byte[5]);
        Files.write(root.resolve(".upload-x.tmp"), new byte[3]);

        List<String> locators = provider.list();

        assertEquals(2, locators.size());
        assertTrue(locators.containsAll(List.of(a, b)));
        assertEquals(new ChunkProvider.ProviderUsage(2, 15), provider.usage());
    }

    @Test
    @DisplayName("should sanitize chunk names and reject escaping locators")
    void pathSafety() {
        DirectoryChunkProvider provider = new DirectoryChunkProvider(root);

        String locator = provider.put("../evil/name", new byte[]{1});

        assertFalse(locator.contains("/"));
        assertThrows(IllegalArgumentException.class, () -> provider.get("../outside.chunk"));
        assertThrows(IllegalArgumentException.class, () -> provider.delete("sub/dir.chunk"));
    }

    @Test
    @DisplayName("should probe healthy when the root is writable")
    void probe() {
        DirectoryChunkProvider provider = new DirectoryChunkProvider(root.resolve("created-on-probe"));

        assertTrue(provider.probe());
        assertTrue(Files.isDirectory(provider.getRoot()));
        assertEquals(DirectoryChunkProvider.TYPE, provider.type());
    }
}
