package io.scatterstore.storage.transfer;

import java.util.concurrent.CancellationException;

/**
 * Caller-controlled cancellation flag for one transfer. Checked between chunk reads, before every
 * provider attempt and right before commit.
 */
public final class CancellationSignal {

    private volatile boolean cancelled;

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Transfer cancelled");
        }
    }
}
