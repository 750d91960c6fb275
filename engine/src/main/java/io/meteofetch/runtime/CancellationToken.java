package io.meteofetch.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation flag shared by everything working on one acquisition. Cancelling is idempotent.
 */
public final class CancellationToken {
    private volatile boolean cancelled;
    private final List<Runnable> callbacks = new ArrayList<>();

    /** @return true if this call performed the cancellation, false if it was already cancelled */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) return false;
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
        return true;
    }

    public boolean isCancelled() { return cancelled; }

    /** Runs the callback on cancellation, or right away if already cancelled. */
    public void onCancel(Runnable callback) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) callbacks.add(callback);
        }
        if (runNow) callback.run();
    }
}
