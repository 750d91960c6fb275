package io.meteofetch.budget;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One reserved concurrency slot of a provider. Closing it releases the slot; closing twice is a no-op.
 */
public final class Permit implements AutoCloseable {
    private final QuotaTracker owner;
    private final String providerId;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicBoolean recorded = new AtomicBoolean(false);

    Permit(QuotaTracker owner, String providerId) {
        this.owner = owner;
        this.providerId = providerId;
    }

    public String providerId() { return providerId; }

    public boolean isReleased() { return released.get(); }

    /** Whether the call made under this permit was already counted as used. */
    public boolean isRecorded() { return recorded.get(); }

    boolean markReleased() { return released.compareAndSet(false, true); }

    boolean markRecorded() { return recorded.compareAndSet(false, true); }

    @Override
    public void close() { owner.release(this); }
}
