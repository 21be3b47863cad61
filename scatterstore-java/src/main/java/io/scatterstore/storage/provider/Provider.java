package io.scatterstore.storage.provider;

import java.time.Instant;

/**
 * One configured backend account: identity, type tag, adapter and liveness.
 * Everything but liveness is fixed at construction. Liveness is written by probes and by the
 * transfer layer, and read without locking by placement.
 */
public final class Provider {

    private final String id;
    private final String type;
    private final ChunkProvider adapter;
    private volatile boolean live = true;
    private volatile Instant lastProbe;

    public Provider(String id, ChunkProvider adapter) {
        this.id = id;
        this.type = adapter.type();
        this.adapter = adapter;
    }

    public String id() { return id; }
    public String type() { return type; }
    public ChunkProvider adapter() { return adapter; }
    public boolean isLive() { return live; }
    public Instant lastProbe() { return lastProbe; }

    boolean setLive(boolean live) {
        boolean previous = this.live;
        this.live = live;
        return previous != live;
    }

    void recordProbe(Instant at) {
        this.lastProbe = at;
    }

    @Override
    public String toString() {
        return id + "(" + type + (live ? "" : ", down") + ")";
    }
}
