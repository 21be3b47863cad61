package io.scatterstore.storage.manifest;

/**
 * What the writer observed for a finished version: chunk count, byte length and whole-file checksum.
 * Commit checks the recorded descriptors against it.
 */
public record VersionSummary(int chunkCount, long totalSize, String checksum) {}
