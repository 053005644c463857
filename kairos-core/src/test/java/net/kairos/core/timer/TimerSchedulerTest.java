package net.kairos.core.timer;

import net.kairos.core.support.ManualClock;
import net.kairos.core.support.ManualTimerBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TimerSchedulerTest {

    static final Instant T0 = Instant.parse("2030-01-01T00:00:00Z");

    ManualClock clock;
    ManualTimerBackend backend;
    TimerScheduler timers;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        backend = new ManualTimerBackend(clock);
        timers = new TimerScheduler(backend, clock, Duration.ofDays(1));
    }

    @Test
    void shortDelay_isHandedToBackendDirectly() {
        List<Instant> fired = new ArrayList<>();
        TimerHandle h = timers.scheduleWake(5_000, () -> fired.add(clock.now()));

        backend.advance(Duration.ofSeconds(4));
        assertTrue(fired.isEmpty());
        backend.advance(Duration.ofSeconds(1));

        assertEquals(List.of(T0.plusSeconds(5)), fired);
        assertEquals(List.of(5_000L), backend.requestedDelays());
        assertTrue(h.isFired());
        assertEquals(0, h.reevaluations());
    }

    @Test
    void delayAtLimit_needsNoReevaluation() {
        AtomicInteger fired = new AtomicInteger();
        TimerHandle h = timers.scheduleWake(TimerScheduler.MAX_DELAY_MS, fired::incrementAndGet);

        backend.advance(Duration.ofMillis(TimerScheduler.MAX_DELAY_MS));

        assertEquals(1, fired.get());
        assertEquals(0, h.reevaluations());
    }

    @Test
    void fortyDayDelay_isDecomposedIntoBoundedWaits_thatSumToTheDelay() {
        long delay = Duration.ofDays(40).toMillis();
        List<Instant> fired = new ArrayList<>();
        TimerHandle h = timers.scheduleWake(delay, () -> fired.add(clock.now()));

        backend.advance(Duration.ofDays(41));

        assertEquals(List.of(T0.plus(Duration.ofDays(40))), fired, "fires once, on the deadline");
        List<Long> waits = backend.requestedDelays();
        assertTrue(waits.stream().allMatch(w -> w <= TimerScheduler.MAX_DELAY_MS), "every wait fits the timer");
        assertEquals(delay, waits.stream().mapToLong(Long::longValue).sum());
        // 24 remaining days fit in one wait, so 16 one-day steps come first
        assertEquals(16, h.reevaluations());
        assertEquals(17, waits.size());
    }

    @Test
    void reevaluationIntervalAboveLimit_isCappedAtLimit() {
        timers = new TimerScheduler(backend, clock, Duration.ofDays(60));
        timers.scheduleWake(Duration.ofDays(30).toMillis(), () -> { });

        assertEquals(TimerScheduler.MAX_DELAY_MS, backend.requestedDelays().get(0));
    }

    @Test
    void recheck_followsRescheduledTarget() {
        AtomicLong target = new AtomicLong(T0.plus(Duration.ofDays(30)).toEpochMilli());
        List<Instant> fired = new ArrayList<>();
        timers.scheduleWake(Duration.ofDays(30).toMillis(), () -> fired.add(clock.now()),
                () -> OptionalLong.of(Math.max(0, target.get() - clock.now().toEpochMilli())));

        backend.advance(Duration.ofHours(12));
        target.set(T0.plus(Duration.ofDays(35)).toEpochMilli());
        backend.advance(Duration.ofDays(40));

        assertEquals(List.of(T0.plus(Duration.ofDays(35))), fired);
    }

    @Test
    void recheck_empty_dropsWake() {
        AtomicInteger fired = new AtomicInteger();
        TimerHandle h = timers.scheduleWake(Duration.ofDays(30).toMillis(), fired::incrementAndGet,
                OptionalLong::empty);

        backend.advance(Duration.ofDays(31));

        assertEquals(0, fired.get());
        assertTrue(h.isCancelled());
        assertEquals(0, timers.pending());
        assertEquals(0, backend.pending());
    }

    @Test
    void recheck_failure_retriesOneStepLater() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger fired = new AtomicInteger();
        Instant deadline = T0.plus(Duration.ofDays(26));
        timers.scheduleWake(Duration.ofDays(26).toMillis(), fired::incrementAndGet, () -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("db down");
            return OptionalLong.of(Math.max(0, deadline.toEpochMilli() - clock.now().toEpochMilli()));
        });

        backend.advance(Duration.ofDays(27));

        assertEquals(1, fired.get());
        assertEquals(2, calls.get());
    }

    @Test
    void cancel_isIdempotent_andHarmlessAfterFire() {
        AtomicInteger fired = new AtomicInteger();
        TimerHandle pending = timers.scheduleWake(Duration.ofDays(30).toMillis(), fired::incrementAndGet);
        pending.cancel();
        pending.cancel();
        backend.advance(Duration.ofDays(31));
        assertEquals(0, fired.get());
        assertTrue(pending.isCancelled());

        TimerHandle done = timers.scheduleWake(10, fired::incrementAndGet);
        backend.advance(Duration.ofMillis(10));
        done.cancel();
        assertEquals(1, fired.get());
        assertTrue(done.isFired());
        assertFalse(done.isCancelled());
    }

    @Test
    void cancelAll_dropsEveryPendingWake() {
        AtomicInteger fired = new AtomicInteger();
        timers.scheduleWake(1_000, fired::incrementAndGet);
        timers.scheduleWake(Duration.ofDays(90).toMillis(), fired::incrementAndGet);

        assertEquals(2, timers.cancelAll());
        backend.advance(Duration.ofDays(100));

        assertEquals(0, fired.get());
        assertEquals(0, timers.pending());
    }

    @Test
    void failingCallback_isContained() {
        AtomicInteger after = new AtomicInteger();
        timers.scheduleWake(1, () -> { throw new IllegalStateException("boom"); });
        timers.scheduleWake(2, after::incrementAndGet);

        assertDoesNotThrow(() -> backend.advance(Duration.ofMillis(5)));
        assertEquals(1, after.get());
    }
}
