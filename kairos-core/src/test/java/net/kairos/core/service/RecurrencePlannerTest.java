package net.kairos.core.service;

import net.kairos.core.model.JobRecord;
import net.kairos.core.support.HourlyCron;
import net.kairos.core.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecurrencePlannerTest {

    static final Instant T0 = Instant.parse("2030-01-01T00:00:00Z");

    ManualClock clock;
    RecurrencePlanner planner;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        planner = new RecurrencePlanner(new HourlyCron(), clock, ZoneOffset.UTC);
    }

    static JobRecord repeating(String interval) {
        return JobRecord.ofNew("job", Map.of()).withRepeat(interval, null, null, null);
    }

    @Test
    void oneShot_hasNoNextRun() {
        assertNull(planner.computeNext(JobRecord.ofNew("job", Map.of()), T0));
    }

    @Test
    void fixedInterval_addsToCompletion() {
        assertEquals(T0.plus(Duration.ofMinutes(5)), planner.computeNext(repeating("5 minutes"), T0));
    }

    @Test
    void fixedInterval_misfire_skipsMissedSlots() {
        Instant completed = T0.minus(Duration.ofMinutes(62));

        Instant next = planner.computeNext(repeating("PT5M"), completed);

        assertFalse(next.isBefore(T0), "never in the past");
        assertTrue(next.isBefore(T0.plus(Duration.ofMinutes(5))), "no later than one interval ahead");
        assertEquals(0, Duration.between(completed, next).toMillis() % Duration.ofMinutes(5).toMillis(),
                "stays on the original cadence");
    }

    @Test
    void cron_nextOccurrenceStrictlyAfterCompletion() {
        Instant completed = T0.plus(Duration.ofMinutes(10));

        assertEquals(T0.plus(Duration.ofHours(1)), planner.computeNext(repeating(HourlyCron.EXPR), completed));
        assertEquals(T0.plus(Duration.ofHours(1)), planner.computeNext(repeating(HourlyCron.EXPR), T0));
    }

    @Test
    void cron_misfire_doesNotCatchUp() {
        clock.set(T0.plus(Duration.ofMinutes(30)));

        Instant next = planner.computeNext(repeating(HourlyCron.EXPR), T0.minus(Duration.ofHours(5)));

        assertEquals(T0.plus(Duration.ofHours(1)), next);
    }

    @Test
    void nextRun_isMonotonic() {
        JobRecord job = repeating("45 seconds");
        Instant completed = T0;
        for (int i = 0; i < 20; i++) {
            Instant next = planner.computeNext(job, completed);
            assertTrue(next.isAfter(completed));
            clock.set(next);
            completed = next.plusMillis(7);
        }
    }

    @Test
    void endDate_stopsRecurrence() {
        JobRecord job = repeating("1 hour").withRepeat("1 hour", null, null, T0.plus(Duration.ofMinutes(30)));

        assertNull(planner.computeNext(job, T0));
    }

    @Test
    void startDate_postponesRecurrence() {
        Instant start = T0.plus(Duration.ofHours(2));
        JobRecord fixed = repeating("5 minutes").withRepeat("5 minutes", null, start, null);
        JobRecord cron = repeating(HourlyCron.EXPR).withRepeat(HourlyCron.EXPR, null, start.plusSeconds(1), null);

        assertEquals(start, planner.computeNext(fixed, T0));
        assertEquals(T0.plus(Duration.ofHours(3)), planner.computeNext(cron, T0));
    }

    @Test
    void firstRun_isNowUnlessSkipped() {
        JobRecord job = repeating("10 minutes");

        assertEquals(T0, planner.firstRun(job, false));
        assertEquals(T0.plus(Duration.ofMinutes(10)), planner.firstRun(job, true));
        assertEquals(T0.plus(Duration.ofDays(1)),
                planner.firstRun(job.withRepeat("10 minutes", null, T0.plus(Duration.ofDays(1)), null), false));
    }

    @Test
    void validate_rejectsBadIntervalAndZone() {
        assertThrows(IllegalArgumentException.class, () -> planner.validate("every now and then", null));
        assertThrows(IllegalArgumentException.class, () -> planner.validate(" ", null));
        assertThrows(IllegalArgumentException.class, () -> planner.validate("5 minutes", "Mars/Olympus"));
        assertDoesNotThrow(() -> planner.validate(HourlyCron.EXPR, "Asia/Seoul"));
    }
}
