package net.kairos.core.service;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.UUID;

/**
 * Engine configuration. Spring deployments bind it from {@code kairos.scheduler.*}.
 *
 * @param workerId             written to LAST_MODIFIED_BY when this engine locks a job
 * @param processEvery         poll interval of the scan loop
 * @param defaultLockLifetime  staleness threshold for names without their own lock lifetime
 * @param maxConcurrency       in-flight ceiling for the whole engine
 * @param defaultConcurrency   per-name ceiling for definitions that set none, 0 = unbounded
 * @param batchSize            candidates read per scan
 * @param reevaluationInterval longest single wait for far-future timers
 * @param drainTimeout         how long stop() waits for running handlers
 * @param defaultZone          zone for cron jobs without REPEAT_TIMEZONE
 */
public record SchedulerSettings(
        String workerId,
        Duration processEvery,
        Duration defaultLockLifetime,
        int maxConcurrency,
        int defaultConcurrency,
        int batchSize,
        Duration reevaluationInterval,
        Duration drainTimeout,
        ZoneId defaultZone
) {
    public SchedulerSettings {
        Objects.requireNonNull(workerId, "workerId");
        requirePositive(processEvery, "processEvery");
        requirePositive(defaultLockLifetime, "defaultLockLifetime");
        requirePositive(reevaluationInterval, "reevaluationInterval");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(defaultZone, "defaultZone");
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        if (defaultConcurrency < 0) throw new IllegalArgumentException("defaultConcurrency must be >= 0: " + defaultConcurrency);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }

    public static SchedulerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String workerId = "kairos-" + UUID.randomUUID();
        private Duration processEvery = Duration.ofSeconds(5);
        private Duration defaultLockLifetime = Duration.ofMinutes(10);
        private int maxConcurrency = 20;
        private int defaultConcurrency = 0;
        private int batchSize = 50;
        private Duration reevaluationInterval = Duration.ofDays(1);
        private Duration drainTimeout = Duration.ofSeconds(30);
        private ZoneId defaultZone = ZoneId.systemDefault();

        public Builder workerId(String v) { this.workerId = v; return this; }
        public Builder processEvery(Duration v) { this.processEvery = v; return this; }
        public Builder defaultLockLifetime(Duration v) { this.defaultLockLifetime = v; return this; }
        public Builder maxConcurrency(int v) { this.maxConcurrency = v; return this; }
        public Builder defaultConcurrency(int v) { this.defaultConcurrency = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder reevaluationInterval(Duration v) { this.reevaluationInterval = v; return this; }
        public Builder drainTimeout(Duration v) { this.drainTimeout = v; return this; }
        public Builder defaultZone(ZoneId v) { this.defaultZone = v; return this; }

        public SchedulerSettings build() {
            return new SchedulerSettings(workerId, processEvery, defaultLockLifetime, maxConcurrency,
                    defaultConcurrency, batchSize, reevaluationInterval, drainTimeout, defaultZone);
        }
    }
}
