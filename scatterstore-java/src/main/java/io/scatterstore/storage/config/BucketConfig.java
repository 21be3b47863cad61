package io.scatterstore.storage.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One provider definition: backend type tag, credential handle and destination root.
 * The credential handle is passed to the adapter untouched; it is never logged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BucketConfig(
    @JsonProperty("type") String type,
    @JsonProperty("credentials") String credentials,
    @JsonProperty("root") String root
) {
    public static BucketConfig memory() {
        return new BucketConfig("memory", null, null);
    }

    public static BucketConfig directory(String root) {
        return new BucketConfig("directory", null, root);
    }

    @Override
    public String toString() {
        return "BucketConfig[type=" + type + ", root=" + root + "]";
    }
}
