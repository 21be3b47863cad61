package io.scatterstore.storage.transfer;

import java.util.ArrayList;
import java.util.List;

/**
 * Every provider write acknowledged for one version, recorded as it happens. On abort each entry
 * is replayed as a delete.
 */
public final class UploadSaga {

    private final String fileId;
    private final long versionId;
    private final List<WrittenChunk> written = new ArrayList<>();

    public UploadSaga(String fileId, long versionId) {
        this.fileId = fileId;
        this.versionId = versionId;
    }

    public synchronized void record(int index, String providerId, String locator) {
        written.add(new WrittenChunk(index, providerId, locator));
    }

    public synchronized List<WrittenChunk> written() {
        return List.copyOf(written);
    }

    public String fileId() {
        return fileId;
    }

    public long versionId() {
        return versionId;
    }

    public record WrittenChunk(int index, String providerId, String locator) {}
}
