package net.kairos.core.service;

import net.kairos.core.model.JobRecord;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Next run time of a repeating job. A repeat interval is either a fixed duration ({@link Intervals}) or a
 * cron expression evaluated in the job's zone.
 */
public final class RecurrencePlanner {
    /** Upper bound on misfire steps; a cron that never reaches {@code now} within it is treated as exhausted. */
    static final int MAX_ADVANCE_STEPS = 100_000;

    private final CronCalculator cron;
    private final Clock clock;
    private final ZoneId defaultZone;

    public RecurrencePlanner(CronCalculator cron, Clock clock, ZoneId defaultZone) {
        this.cron = cron;
        this.clock = clock;
        this.defaultZone = defaultZone;
    }

    /**
     * @return the next run strictly after {@code completedAt} and not before now, or null for a one-shot
     *         job and for a recurrence past its end date
     */
    public Instant computeNext(JobRecord job, Instant completedAt) {
        if (!job.repeating()) return null;

        ZoneId zone = zoneOf(job);
        Optional<Duration> fixed = Intervals.parse(job.repeatInterval());
        Instant now = clock.now();

        Instant next;
        if (fixed.isPresent()) {
            Duration step = fixed.get();
            next = completedAt.plus(step);
            if (next.isBefore(now)) {
                // skip missed slots in one go
                long behind = Duration.between(next, now).toMillis();
                long steps = (behind + step.toMillis() - 1) / step.toMillis();
                next = next.plusMillis(steps * step.toMillis());
            }
        } else {
            next = cron.next(completedAt, job.repeatInterval(), zone);
            int guard = 0;
            while (next != null && next.isBefore(now)) {
                if (++guard > MAX_ADVANCE_STEPS) return null;
                next = cron.next(next, job.repeatInterval(), zone);
            }
        }
        return bound(job, next, fixed, zone);
    }

    /** First run of a new repeating job: now, or its first slot when {@code skipImmediate}. */
    public Instant firstRun(JobRecord job, boolean skipImmediate) {
        Instant now = clock.now();
        if (job.startDate() != null && job.startDate().isAfter(now)) {
            Optional<Duration> fixed = Intervals.parse(job.repeatInterval());
            return bound(job, fixed.isPresent() ? job.startDate() : cron.next(job.startDate().minusMillis(1),
                    job.repeatInterval(), zoneOf(job)), fixed, zoneOf(job));
        }
        if (!skipImmediate) return bound(job, now, Optional.empty(), zoneOf(job));
        return computeNext(job, now);
    }

    /** Rejects intervals that are neither a duration nor a valid cron expression, and unknown zones. */
    public void validate(String repeatInterval, String timezone) {
        if (repeatInterval == null || repeatInterval.isBlank()) {
            throw new IllegalArgumentException("repeat interval is required");
        }
        ZoneId zone = defaultZone;
        if (timezone != null) {
            try {
                zone = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("unknown timezone: " + timezone, e);
            }
        }
        if (Intervals.parse(repeatInterval).isEmpty()) {
            // throws for a malformed expression
            cron.next(clock.now(), repeatInterval, zone);
        }
    }

    private Instant bound(JobRecord job, Instant next, Optional<Duration> fixed, ZoneId zone) {
        if (next == null) return null;
        if (job.startDate() != null && next.isBefore(job.startDate())) {
            next = fixed.isPresent()
                    ? job.startDate()
                    : cron.next(job.startDate().minusMillis(1), job.repeatInterval(), zone);
            if (next == null) return null;
        }
        if (job.endDate() != null && next.isAfter(job.endDate())) return null;
        return next;
    }

    private ZoneId zoneOf(JobRecord job) {
        return job.repeatTimezone() == null ? defaultZone : ZoneId.of(job.repeatTimezone());
    }
}
