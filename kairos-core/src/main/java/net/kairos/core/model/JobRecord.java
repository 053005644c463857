package net.kairos.core.model;

import java.time.Instant;
import java.util.Map;

public record JobRecord(
        Long id,
        String name,
        Map<String, Object> data,
        int priority,
        JobType type,
        Instant nextRunAt,
        Instant lastRunAt,
        Instant lastFinishedAt,
        Instant lockedAt,          // lock token, null = unlocked
        String lastModifiedBy,     // worker id, diagnostic only
        String repeatInterval,     // fixed duration or cron expression, null = one-shot
        String repeatTimezone,
        Instant startDate,
        Instant endDate,
        boolean disabled,
        int failCount,
        String failReason,
        Instant failedAt
) {
    public JobRecord {
        data = data == null ? Map.of() : data;
        type = type == null ? JobType.NORMAL : type;
    }

    public static JobRecord ofNew(String name, Map<String, Object> data) {
        return new JobRecord(null, name, data, 0, JobType.NORMAL,
                null, null, null, null, null,
                null, null, null, null,
                false, 0, null, null);
    }

    public boolean repeating() {
        return repeatInterval != null && !repeatInterval.isBlank();
    }

    public JobState state() {
        if (lastRunAt == null) return JobState.NEVER_RAN;
        if (lockedAt != null && (lastFinishedAt == null || lastRunAt.isAfter(lastFinishedAt))) {
            return JobState.RUNNING;
        }
        if (failedAt != null && lastFinishedAt != null && !failedAt.isBefore(lastFinishedAt)) {
            return JobState.FAILED;
        }
        return JobState.SUCCEEDED;
    }

    public JobRecord withId(Long id) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withType(JobType type) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withPriority(int priority) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withNextRunAt(Instant nextRunAt) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withDisabled(boolean disabled) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withRepeat(String repeatInterval, String repeatTimezone, Instant startDate, Instant endDate) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord withLock(Instant lockedAt, String owner) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, lastRunAt, lastFinishedAt, lockedAt,
                owner, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    /** Start of an execution by {@code worker}. */
    public JobRecord started(Instant at, String worker) {
        return new JobRecord(id, name, data, priority, type, nextRunAt, at, lastFinishedAt, lockedAt,
                worker, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    public JobRecord succeeded(Instant finishedAt, Instant next) {
        return new JobRecord(id, name, data, priority, type, next, lastRunAt, finishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount, failReason, failedAt);
    }

    /** failedAt and lastFinishedAt are set to the same instant so {@link #state()} reads FAILED. */
    public JobRecord failed(Instant finishedAt, String reason, Instant next) {
        return new JobRecord(id, name, data, priority, type, next, lastRunAt, finishedAt, lockedAt,
                lastModifiedBy, repeatInterval, repeatTimezone, startDate, endDate, disabled,
                failCount + 1, reason, finishedAt);
    }
}
