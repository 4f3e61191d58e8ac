package com.repairdesk.sync.service.subscription;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Liveness token of one viewer session. Every queued task and transport callback checks it
 * before touching session state, so work scheduled by an ended session is dropped.
 */
public final class SessionEpoch {

    private final long value;
    private final AtomicBoolean active = new AtomicBoolean(true);

    public SessionEpoch(long value) {
        this.value = value;
    }

    public long value() {
        return value;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * @return true for the call that actually ended the epoch
     */
    public boolean end() {
        return active.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "epoch-" + value + (isActive() ? "" : " (ended)");
    }
}
