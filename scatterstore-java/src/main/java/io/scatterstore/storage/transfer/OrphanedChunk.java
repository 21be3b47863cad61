package io.scatterstore.storage.transfer;

/**
 * A chunk that may still exist on a provider although no committed version references it,
 * because a compensating or final delete failed.
 */
public record OrphanedChunk(
    String fileId,
    long versionId,
    int index,
    String providerId,
    String locator,
    String reason
) {}
