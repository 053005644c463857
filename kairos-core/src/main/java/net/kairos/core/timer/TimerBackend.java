package net.kairos.core.timer;

/**
 * The platform timer the {@link TimerScheduler} sits on. Implementations only need to honour delays up to
 * {@link TimerScheduler#MAX_DELAY_MS}.
 */
public interface TimerBackend {

    Cancellable schedule(long delayMs, Runnable task);

    @FunctionalInterface
    interface Cancellable {
        /** @return true if the task was prevented from running */
        boolean cancel();
    }
}
