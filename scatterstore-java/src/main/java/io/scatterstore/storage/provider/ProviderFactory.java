package io.scatterstore.storage.provider;

import io.scatterstore.storage.config.BucketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps bucket type tags to adapter constructors.
 */
public final class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private final Map<String, Function<BucketConfig, ChunkProvider>> constructors = new ConcurrentHashMap<>();

    public ProviderFactory() {
        register(InMemoryChunkProvider.TYPE, bucket ->
            new InMemoryChunkProvider(bucket.root() != null ? bucket.root() : InMemoryChunkProvider.TYPE));
        register(DirectoryChunkProvider.TYPE, bucket -> {
            if (bucket.root() == null || bucket.root().isBlank()) {
                throw new IllegalArgumentException("Directory bucket requires a root");
            }
            return new DirectoryChunkProvider(Path.of(bucket.root()));
        });
    }

    /**
     * Register (or replace) the adapter constructor for a type tag.
     */
    public ProviderFactory register(String type, Function<BucketConfig, ChunkProvider> constructor) {
        constructors.put(type.toLowerCase(Locale.ROOT), constructor);
        return this;
    }

    public ChunkProvider create(BucketConfig bucket) {
        if (bucket.type() == null) {
            throw new IllegalArgumentException("Bucket type is required");
        }
        Function<BucketConfig, ChunkProvider> constructor = constructors.get(bucket.type().toLowerCase(Locale.ROOT));
        if (constructor == null) {
            throw new IllegalArgumentException("Unsupported storage provider type: '" + bucket.type() + "'");
        }
        return constructor.apply(bucket);
    }

    /**
     * Build the registry for an ordered list of buckets. Ids follow configuration order.
     */
    public ProviderRegistry createRegistry(List<BucketConfig> buckets) {
        List<Provider> providers = new ArrayList<>();
        for (int i = 0; i < buckets.size(); i++) {
            BucketConfig bucket = buckets.get(i);
            Provider provider = new Provider(ProviderRegistry.bucketId(i), create(bucket));
            log.info("Provider {} ({}) configured", provider.id(), provider.type());
            providers.add(provider);
        }
        return new ProviderRegistry(providers);
    }
}
