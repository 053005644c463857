package net.kairos.core.definition;

import java.time.Duration;
import java.util.Objects;

/**
 * Handler plus per-name execution settings.
 *
 * @param concurrency      in-flight ceiling for this name on one worker, 0 = unbounded
 * @param timeout          null = wait for the handler indefinitely
 * @param lockLifetime     null = engine default
 * @param priority         default priority of jobs created for this name
 * @param removeOnComplete delete a one-shot job after a successful run instead of keeping it
 */
public record JobDefinition(
        String name,
        JobHandler handler,
        int concurrency,
        Duration timeout,
        Duration lockLifetime,
        int priority,
        boolean removeOnComplete
) {
    public JobDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("job name is required");
        Objects.requireNonNull(handler, "handler");
        if (concurrency < 0) throw new IllegalArgumentException("concurrency must be >= 0: " + concurrency);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (lockLifetime != null && (lockLifetime.isZero() || lockLifetime.isNegative())) {
            throw new IllegalArgumentException("lockLifetime must be positive: " + lockLifetime);
        }
    }

    public static JobDefinition of(String name, JobHandler handler) {
        return of(name, handler, new Options());
    }

    public static JobDefinition of(String name, JobHandler handler, Options options) {
        return new JobDefinition(name, handler, options.concurrency, options.timeout,
                options.lockLifetime, options.priority, options.removeOnComplete);
    }

    public boolean unboundedConcurrency() {
        return concurrency == 0;
    }

    /** Fluent builder for the optional settings. */
    public static final class Options {
        private int concurrency;
        private Duration timeout;
        private Duration lockLifetime;
        private int priority;
        private boolean removeOnComplete;

        public Options concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Options timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Options lockLifetime(Duration lockLifetime) { this.lockLifetime = lockLifetime; return this; }
        public Options priority(int priority) { this.priority = priority; return this; }
        public Options removeOnComplete(boolean removeOnComplete) { this.removeOnComplete = removeOnComplete; return this; }
    }
}
