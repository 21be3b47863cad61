package io.scatterstore.storage.manifest;

/**
 * Persisted lifecycle of a version. Whether a complete version is current or stale is decided by
 * the file's current pointer.
 */
public enum VersionState {
    UPLOADING,
    COMPLETE,
    DEAD
}
