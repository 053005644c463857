package net.kairos.core.timer;

import java.util.OptionalLong;

/**
 * One logical wake. Stays the same object while the scheduler re-arms it through intermediate
 * re-evaluation ticks.
 */
public final class TimerHandle {

    /** Re-reads the current target. Empty means the wake is no longer wanted. */
    @FunctionalInterface
    public interface Recheck {
        OptionalLong remainingDelayMs() throws Exception;
    }

    private final Runnable callback;
    private final Recheck recheck;
    private TimerBackend.Cancellable pending;
    private boolean cancelled;
    private boolean fired;
    private int reevaluations;

    TimerHandle(Runnable callback, Recheck recheck) {
        this.callback = callback;
        this.recheck = recheck;
    }

    Runnable callback() { return callback; }

    Recheck recheck() { return recheck; }

    synchronized boolean arm(TimerBackend.Cancellable next) {
        if (cancelled || fired) {
            next.cancel();
            return false;
        }
        pending = next;
        return true;
    }

    synchronized boolean markFired() {
        if (cancelled || fired) return false;
        fired = true;
        pending = null;
        return true;
    }

    synchronized void countReevaluation() {
        reevaluations++;
    }

    /** Idempotent; a no-op after the callback has run. */
    public synchronized void cancel() {
        if (cancelled || fired) return;
        cancelled = true;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public synchronized boolean isCancelled() { return cancelled; }

    public synchronized boolean isFired() { return fired; }

    public synchronized boolean isDone() { return cancelled || fired; }

    /** Number of intermediate wakes taken so far. */
    public synchronized int reevaluations() { return reevaluations; }
}
