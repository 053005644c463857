package net.kairos.core.timer;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerBackend} on a {@link ScheduledExecutorService}. The executor is owned by the caller.
 */
public final class ExecutorTimerBackend implements TimerBackend {
    private final ScheduledExecutorService executor;

    public ExecutorTimerBackend(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Cancellable schedule(long delayMs, Runnable task) {
        ScheduledFuture<?> future = executor.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        // don't interrupt a wake that is already running
        return () -> future.cancel(false);
    }
}
