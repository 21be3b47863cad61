package io.scatterstore.storage.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scatterstore.storage.transfer.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only engine configuration, fixed at construction.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int DEFAULT_CHUNK_SIZE = 5 * 1024 * 1024;
    public static final String ENCRYPTION_KEY_ENV = "SCATTERSTORE_ENCRYPTION_KEY";

    public final List<BucketConfig> buckets;
    public final int chunkSize;
    public final int maxConcurrentTransfers;
    public final RetryPolicy retryPolicy;
    public final int retainedVersions;
    public final Path manifestDirectory;
    public final boolean encryptionEnabled;
    public final String encryptionKey;
    public final Duration healthCheckInterval;

    private EngineConfig(Builder builder) {
        if (builder.chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (builder.maxConcurrentTransfers <= 0) {
            throw new IllegalArgumentException("maxConcurrentTransfers must be positive");
        }
        if (builder.retainedVersions < 0) {
            throw new IllegalArgumentException("retainedVersions must be >= 0");
        }
        if (builder.encryptionEnabled && (builder.encryptionKey == null || builder.encryptionKey.isBlank())) {
            throw new IllegalArgumentException(
                "Encryption is enabled but no key is configured (set " + ENCRYPTION_KEY_ENV + ")");
        }
        this.buckets = List.copyOf(builder.buckets);
        this.chunkSize = builder.chunkSize;
        this.maxConcurrentTransfers = builder.maxConcurrentTransfers;
        this.retryPolicy = builder.retryPolicy;
        this.retainedVersions = builder.retainedVersions;
        this.manifestDirectory = builder.manifestDirectory;
        this.encryptionEnabled = builder.encryptionEnabled;
        this.encryptionKey = builder.encryptionKey;
        this.healthCheckInterval = builder.healthCheckInterval;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load configuration from a JSON file. The encryption key environment variable, when set,
     * overrides the key from the file.
     */
    public static EngineConfig load(Path path) {
        return load(path, System.getenv());
    }

    static EngineConfig load(Path path, Map<String, String> env) {
        ConfigDocument doc;
        if (Files.exists(path)) {
            try {
                doc = MAPPER.readValue(path.toFile(), ConfigDocument.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not parse configuration " + path, e);
            }
        } else {
            log.warn("Configuration file {} not found, using defaults", path);
            doc = new ConfigDocument(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        Builder builder = builder();
        if (doc.buckets() != null) {
            builder.buckets(doc.buckets());
        }
        if (doc.chunkSize() != null) builder.chunkSize(doc.chunkSize());
        if (doc.maxConcurrentTransfers() != null) builder.maxConcurrentTransfers(doc.maxConcurrentTransfers());
        if (doc.retainedVersions() != null) builder.retainedVersions(doc.retainedVersions());
        if (doc.manifestDirectory() != null) {
            Path dir = Path.of(doc.manifestDirectory());
            builder.manifestDirectory(dir.isAbsolute() || path.getParent() == null ? dir : path.getParent().resolve(dir));
        }
        if (doc.encryptionEnabled() != null) builder.encryptionEnabled(doc.encryptionEnabled());
        String key = env.getOrDefault(ENCRYPTION_KEY_ENV, doc.encryptionKey());
        builder.encryptionKey(key);
        if (doc.healthCheckIntervalMs() != null) {
            builder.healthCheckInterval(Duration.ofMillis(doc.healthCheckIntervalMs()));
        }

        RetryPolicy.Builder retry = RetryPolicy.builder();
        if (doc.retryMaxAttempts() != null) retry.maxAttempts(doc.retryMaxAttempts());
        if (doc.retryInitialBackoffMs() != null) retry.initialBackoff(Duration.ofMillis(doc.retryInitialBackoffMs()));
        if (doc.retryMultiplier() != null) retry.multiplier(doc.retryMultiplier());
        if (doc.retryMaxBackoffMs() != null) retry.maxBackoff(Duration.ofMillis(doc.retryMaxBackoffMs()));
        if (doc.callTimeoutMs() != null) retry.callTimeout(Duration.ofMillis(doc.callTimeoutMs()));
        builder.retryPolicy(retry.build());

        EngineConfig config = builder.build();
        if (config.buckets.isEmpty()) {
            log.warn("No storage buckets configured in {}", path);
        }
        return config;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigDocument(
        @JsonProperty("buckets") List<BucketConfig> buckets,
        @JsonProperty("chunkSize") Integer chunkSize,
        @JsonProperty("maxConcurrentTransfers") Integer maxConcurrentTransfers,
        @JsonProperty("retainedVersions") Integer retainedVersions,
        @JsonProperty("manifestDirectory") String manifestDirectory,
        @JsonProperty("encryptionEnabled") Boolean encryptionEnabled,
        @JsonProperty("encryptionKey") String encryptionKey,
        @JsonProperty("healthCheckIntervalMs") Long healthCheckIntervalMs,
        @JsonProperty("retryMaxAttempts") Integer retryMaxAttempts,
        @JsonProperty("retryInitialBackoffMs") Long retryInitialBackoffMs,
        @JsonProperty("retryMultiplier") Double retryMultiplier,
        @JsonProperty("retryMaxBackoffMs") Long retryMaxBackoffMs,
        @JsonProperty("callTimeoutMs") Long callTimeoutMs
    ) {}

    public static class Builder {
        private final List<BucketConfig> buckets = new ArrayList<>();
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxConcurrentTransfers = 4;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int retainedVersions = 0;
        private Path manifestDirectory;
        private boolean encryptionEnabled = false;
        private String encryptionKey;
        private Duration healthCheckInterval;

        public Builder bucket(BucketConfig bucket) { this.buckets.add(bucket); return this; }
        public Builder buckets(List<BucketConfig> buckets) { this.buckets.addAll(buckets); return this; }
        public Builder chunkSize(int size) { this.chunkSize = size; return this; }
        public Builder maxConcurrentTransfers(int max) { this.maxConcurrentTransfers = max; return this; }
        public Builder retryPolicy(RetryPolicy policy) { this.retryPolicy = policy; return this; }
        public Builder retainedVersions(int versions) { this.retainedVersions = versions; return this; }
        public Builder manifestDirectory(Path dir) { this.manifestDirectory = dir; return this; }
        public Builder encryptionEnabled(boolean enabled) { this.encryptionEnabled = enabled; return this; }
        public Builder encryptionKey(String key) { this.encryptionKey = key; return this; }
        public Builder healthCheckInterval(Duration interval) { this.healthCheckInterval = interval; return this; }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
