package io.scatterstore.storage.provider;

import io.scatterstore.storage.error.MissingChunkException;
import io.scatterstore.storage.error.ProviderUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local bucket. Can be taken offline to simulate an unreachable backend.
 */
public class InMemoryChunkProvider implements ChunkProvider {

    public static final String TYPE = "memory";

    private final String name;
    private final Map<String, byte[]> chunks = new ConcurrentHashMap<>();
    private final AtomicLong locatorCounter = new AtomicLong();
    private volatile boolean online = true;

    public InMemoryChunkProvider() {
        this("memory");
    }

    public InMemoryChunkProvider(String name) {
        this.name = name;
    }

    @Override
    public String put(String chunkName, byte[] data) {
        ensureOnline();
        String locator = chunkName + "#" + locatorCounter.incrementAndGet();
        chunks.put(locator, data.clone());
        return locator;
    }

    @Override
    public byte[] get(String locator) {
        ensureOnline();
        byte[] data = chunks.get(locator);
        if (data == null) {
            throw new MissingChunkException(-1, name + ": no chunk at " + locator);
        }
        return data.clone();
    }

    @Override
    public boolean delete(String locator) {
        ensureOnline();
        return chunks.remove(locator) != null;
    }

    @Override
    public boolean probe() {
        return online;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> list() {
        return new ArrayList<>(chunks.keySet());
    }

    @Override
    public ProviderUsage usage() {
        long bytes = chunks.values().stream().mapToLong(b -> b.length).sum();
        return new ProviderUsage(chunks.size(), bytes);
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public boolean contains(String locator) {
        return chunks.containsKey(locator);
    }

    public int size() {
        return chunks.size();
    }

    private void ensureOnline() {
        if (!online) {
            throw new ProviderUnavailableException(name, "offline");
        }
    }
}
