package net.kairos.core.service;

import net.kairos.core.lock.LockManager;
import net.kairos.core.lock.LockResult;
import net.kairos.core.model.JobRecord;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import net.kairos.core.timer.TimerHandle;
import net.kairos.core.timer.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the repository for due jobs and hands each one through lock, admission and timer to the
 * {@link Dispatcher}. Also keeps one timer wake per future job saved through this engine.
 */
public final class ScanLoop {
    private static final Logger log = LoggerFactory.getLogger(ScanLoop.class);

    public enum State { IDLE, SCANNING, STOPPED }

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final LockManager locks;
    private final AdmissionController admission;
    private final TimerScheduler timers;
    private final Dispatcher dispatcher;
    private final SchedulerSettings settings;
    private final ScheduledExecutorService scanExecutor;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean backlog = new AtomicBoolean();
    private final Map<Long, TimerHandle> watches = new ConcurrentHashMap<>();
    /** Locked and admitted, waiting for the zero-delay wake. */
    private final Map<Long, JobRecord> handoff = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> poll;

    public ScanLoop(JobRepository jobs, TxRunner tx, Clock clock,
                    LockManager locks,
                    AdmissionController admission,
                    TimerScheduler timers,
                    Dispatcher dispatcher,
                    SchedulerSettings settings,
                    ScheduledExecutorService scanExecutor) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.locks = locks;
        this.admission = admission;
        this.timers = timers;
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.scanExecutor = scanExecutor;
    }

    public State state() {
        return state.get();
    }

    public synchronized void start() {
        if (state.get() == State.STOPPED) throw new IllegalStateException("scan loop already stopped");
        if (started.get()) return;
        admission.reset();
        started.set(true);
        long every = settings.processEvery().toMillis();
        poll = scanExecutor.scheduleWithFixedDelay(this::tick, 0, every, TimeUnit.MILLISECONDS);
        log.info("Scan loop started: worker={} processEvery={} batchSize={}",
                locks.workerId(), settings.processEvery(), settings.batchSize());
    }

    /** Requests a scan soon, on the scan thread. No-op before start and after stop. */
    public void trigger() {
        if (!started.get() || state.get() == State.STOPPED) return;
        try {
            scanExecutor.execute(this::tick);
        } catch (RejectedExecutionException e) {
            log.debug("Scan trigger rejected, executor is shut down");
        }
    }

    private void tick() {
        try {
            scanOnce();
        } catch (RuntimeException e) {
            // must not escape: it would cancel the periodic poll
            log.error("Unexpected error in scan loop", e);
        }
    }

    /**
     * One pass over the due candidates.
     *
     * @return number of jobs handed to the dispatcher
     */
    public int scanOnce() {
        if (!started.get() || !state.compareAndSet(State.IDLE, State.SCANNING)) return 0;
        try {
            Instant now = clock.now();
            List<JobRecord> candidates;
            try {
                candidates = tx.required(() ->
                        jobs.findLockable(now, locks.scanStaleBefore(now), settings.batchSize()));
            } catch (Exception e) {
                log.warn("Job scan failed, retrying on next tick", e);
                return 0;
            }

            int handedOff = 0;
            Set<String> skipped = new HashSet<>();
            for (JobRecord candidate : candidates) {
                if (state.get() == State.STOPPED) break;
                if (!admission.hasCapacity(candidate.name())) {
                    backlog.set(true);
                    skipped.add(candidate.name());
                    continue;
                }
                try {
                    if (claim(candidate.id())) handedOff++;
                } catch (Exception e) {
                    log.warn("Failed to claim job '{}' id={}, skipping", candidate.name(), candidate.id(), e);
                }
            }
            if (handedOff > 0) log.debug("Scan handed off {} of {} candidate(s)", handedOff, candidates.size());
            // a slot freed after its completion looked at the backlog flag would otherwise wait for the next poll
            if (skipped.stream().anyMatch(admission::hasCapacity)) trigger();
            return handedOff;
        } finally {
            state.compareAndSet(State.SCANNING, State.IDLE);
        }
    }

    /**
     * Claims and dispatches one job by id if it is due; otherwise keeps watching it. Before start and after
     * stop nothing is claimed; the first scan after start picks up whatever became due meanwhile.
     */
    public boolean process(long jobId) {
        if (!started.get() || state.get() == State.STOPPED) return false;
        try {
            return claim(jobId);
        } catch (Exception e) {
            log.warn("Failed to process job id={}", jobId, e);
            return false;
        }
    }

    /** Keeps a wake for a future job; replaces the previous wake of the same id. */
    public void watch(JobRecord job) {
        if (job.id() == null || job.disabled() || job.nextRunAt() == null) return;
        if (state.get() == State.STOPPED) return;
        long id = job.id();
        long delay = Math.max(0, job.nextRunAt().toEpochMilli() - clock.now().toEpochMilli());
        TimerHandle handle = timers.scheduleWake(delay, () -> onWake(id), () -> remainingDelay(id));
        TimerHandle previous = watches.put(id, handle);
        if (previous != null) previous.cancel();
    }

    public void unwatch(long jobId) {
        TimerHandle h = watches.remove(jobId);
        if (h != null) h.cancel();
    }

    public int watching() {
        watches.values().removeIf(TimerHandle::isDone);
        return watches.size();
    }

    /**
     * Stops polling, cancels every wake and waits up to {@code drainTimeout} for running handlers. Handlers
     * still running after that are abandoned: their outcome is not written and their lock is left to expire.
     *
     * @return true when nothing was abandoned
     */
    public boolean stop(Duration drainTimeout) {
        if (state.getAndSet(State.STOPPED) == State.STOPPED) return true;
        ScheduledFuture<?> p = poll;
        if (p != null) p.cancel(false);
        int cancelled = timers.cancelAll();
        watches.clear();
        // a pending dispatch may take its entry concurrently; whoever removes it owns the release
        for (Long id : handoff.keySet()) {
            JobRecord job = handoff.remove(id);
            if (job != null) {
                admission.release(job);
                locks.release(id);
            }
        }

        boolean drained = dispatcher.drain(drainTimeout);
        if (!drained) dispatcher.abandonInFlight();
        log.info("Scan loop stopped: cancelledWakes={} drained={}", cancelled, drained);
        return drained;
    }

    private boolean claim(long jobId) throws Exception {
        LockResult result = locks.tryAcquire(jobId);
        if (!result.locked()) {
            JobRecord seen = result.job();
            if (seen != null && seen.lockedAt() == null && !seen.disabled()
                    && seen.nextRunAt() != null && seen.nextRunAt().isAfter(clock.now())) {
                watch(seen);
            }
            return false;
        }

        JobRecord job = result.job();
        Admission admitted = admission.tryAdmit(job);
        if (!admitted.admitted()) {
            log.debug("Job '{}' id={} not admitted: {}", job.name(), job.id(), admitted.reason());
            backlog.set(true);
            locks.release(job.id());
            if (admission.hasCapacity(job.name())) trigger();
            return false;
        }

        handoff.put(job.id(), job);
        timers.scheduleWake(0, () -> dispatch(job.id()));
        return true;
    }

    private void dispatch(long jobId) {
        JobRecord job = handoff.remove(jobId);
        if (job == null) return;
        try {
            dispatcher.execute(job).whenComplete((outcome, err) -> {
                if (backlog.getAndSet(false)) trigger();
                if (job.repeating()) reWatch(jobId);
            });
        } catch (RuntimeException e) {
            log.error("Dispatch of job '{}' id={} failed", job.name(), jobId, e);
            admission.release(job);
            locks.release(jobId);
        }
    }

    private void reWatch(long jobId) {
        if (state.get() == State.STOPPED) return;
        try {
            Optional<JobRecord> current = tx.required(() -> jobs.findById(jobId));
            current.ifPresent(this::watch);
        } catch (Exception e) {
            log.debug("Could not re-read job id={} after its run; the scan loop will pick it up", jobId, e);
        }
    }

    private void onWake(long jobId) {
        watches.remove(jobId);
        process(jobId);
    }

    private OptionalLong remainingDelay(long jobId) throws Exception {
        Optional<JobRecord> current = tx.required(() -> jobs.findById(jobId));
        if (current.isEmpty()) return OptionalLong.empty();
        JobRecord job = current.get();
        if (job.disabled() || job.nextRunAt() == null) return OptionalLong.empty();
        return OptionalLong.of(Math.max(0, job.nextRunAt().toEpochMilli() - clock.now().toEpochMilli()));
    }
}
