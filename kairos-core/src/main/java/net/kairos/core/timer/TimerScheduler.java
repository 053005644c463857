package net.kairos.core.timer;

import net.kairos.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delayed callbacks of any length on top of a timer that accepts at most {@link #MAX_DELAY_MS}.
 * <p>
 * A delay above the limit is never handed to the backend. Instead the scheduler waits
 * {@code min(MAX_DELAY_MS, reevaluationInterval)}, asks the handle's {@link TimerHandle.Recheck} for the
 * remaining delay, and repeats until the remainder fits in one direct wait. The recheck reads fresh state,
 * so a job rescheduled or disabled in the meantime is followed rather than the original delay.
 */
public final class TimerScheduler {
    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    /** 2^31-1 ms, about 24.8 days. */
    public static final long MAX_DELAY_MS = Integer.MAX_VALUE;
    public static final Duration DEFAULT_REEVALUATION_INTERVAL = Duration.ofDays(1);

    private final TimerBackend backend;
    private final Clock clock;
    private final long stepMs;
    private final Set<TimerHandle> active = ConcurrentHashMap.newKeySet();

    public TimerScheduler(TimerBackend backend, Clock clock, Duration reevaluationInterval) {
        if (reevaluationInterval == null || reevaluationInterval.isZero() || reevaluationInterval.isNegative()) {
            throw new IllegalArgumentException("reevaluationInterval must be positive: " + reevaluationInterval);
        }
        this.backend = backend;
        this.clock = clock;
        this.stepMs = Math.min(MAX_DELAY_MS, reevaluationInterval.toMillis());
    }

    /** Wake after {@code delayMs}, counted against the clock rather than the original request. */
    public TimerHandle scheduleWake(long delayMs, Runnable callback) {
        Instant deadline = clock.now().plusMillis(Math.max(0, delayMs));
        return scheduleWake(delayMs, callback,
                () -> OptionalLong.of(Math.max(0, Duration.between(clock.now(), deadline).toMillis())));
    }

    public TimerHandle scheduleWake(long delayMs, Runnable callback, TimerHandle.Recheck recheck) {
        TimerHandle handle = new TimerHandle(callback, recheck);
        active.add(handle);
        arm(handle, delayMs);
        return handle;
    }

    /** Cancels every pending wake. Used on shutdown. */
    public int cancelAll() {
        int n = 0;
        for (TimerHandle h : active) {
            if (!h.isDone()) n++;
            h.cancel();
        }
        active.clear();
        return n;
    }

    public int pending() {
        active.removeIf(TimerHandle::isDone);
        return active.size();
    }

    private void arm(TimerHandle handle, long delayMs) {
        long delay = Math.max(0, delayMs);
        boolean armed;
        if (delay > MAX_DELAY_MS) {
            log.debug("Delay {} ms exceeds timer range, re-evaluating in {} ms", delay, stepMs);
            armed = handle.arm(backend.schedule(stepMs, () -> reevaluate(handle)));
        } else {
            armed = handle.arm(backend.schedule(delay, () -> fire(handle)));
        }
        if (!armed) active.remove(handle);
    }

    private void reevaluate(TimerHandle handle) {
        if (handle.isDone()) {
            active.remove(handle);
            return;
        }
        handle.countReevaluation();
        OptionalLong remaining;
        try {
            remaining = handle.recheck().remainingDelayMs();
        } catch (Exception e) {
            // keep waiting; the next tick reads again
            log.warn("Timer re-evaluation failed, retrying in {} ms", stepMs, e);
            if (!handle.arm(backend.schedule(stepMs, () -> reevaluate(handle)))) active.remove(handle);
            return;
        }
        if (remaining.isEmpty()) {
            log.debug("Timer target gone, dropping wake");
            handle.cancel();
            active.remove(handle);
            return;
        }
        arm(handle, remaining.getAsLong());
    }

    private void fire(TimerHandle handle) {
        if (!handle.markFired()) return;
        active.remove(handle);
        try {
            handle.callback().run();
        } catch (RuntimeException e) {
            log.error("Timer callback failed", e);
        }
    }
}
