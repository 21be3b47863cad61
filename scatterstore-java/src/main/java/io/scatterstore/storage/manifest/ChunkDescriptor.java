package io.scatterstore.storage.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where one chunk of one version lives and how to verify it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkDescriptor(
    @JsonProperty("fileId") String fileId,
    @JsonProperty("versionId") long versionId,
    @JsonProperty("index") int index,
    @JsonProperty("size") int size,
    @JsonProperty("checksum") String checksum,
    @JsonProperty("providerId") String providerId,
    @JsonProperty("locator") String locator
) {}
