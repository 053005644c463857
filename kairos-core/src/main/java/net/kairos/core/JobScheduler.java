package net.kairos.core;

import net.kairos.core.definition.JobDefinition;
import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.definition.JobHandler;
import net.kairos.core.event.JobLifecycleListener;
import net.kairos.core.event.LifecycleNotifier;
import net.kairos.core.lock.LockManager;
import net.kairos.core.maintenance.MaintenanceService;
import net.kairos.core.model.JobRecord;
import net.kairos.core.model.JobType;
import net.kairos.core.service.AdmissionController;
import net.kairos.core.service.Dispatcher;
import net.kairos.core.service.RecurrencePlanner;
import net.kairos.core.service.ScanLoop;
import net.kairos.core.service.SchedulerSettings;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import net.kairos.core.timer.ExecutorTimerBackend;
import net.kairos.core.timer.TimerBackend;
import net.kairos.core.timer.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: job definitions, job creation and the worker lifecycle.
 * <pre>
 * try (JobScheduler scheduler = new JobScheduler(repo, tx, Instant::now, cron, SchedulerSettings.defaults())) {
 *     scheduler.define("send-report", ctx -> reports.send(ctx.data()));
 *     scheduler.every("0 6 * * *", "send-report", Map.of("to", "ops"));
 *     scheduler.start();
 *     ...
 * }
 * </pre>
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerSettings settings;

    private final JobDefinitionRegistry definitions;
    private final LifecycleNotifier notifier = new LifecycleNotifier();
    private final LockManager locks;
    private final AdmissionController admission;
    private final RecurrencePlanner planner;
    private final Dispatcher dispatcher;
    private final ScanLoop scanLoop;
    private final MaintenanceService maintenance;

    /** Executors created here and shut down on {@link #stop()}. */
    private final List<ExecutorService> owned = new ArrayList<>();
    /** Worker pool created here; never interrupted, abandoned handlers run to their end. */
    private ExecutorService ownedWorkers;

    public JobScheduler(JobRepository jobs, TxRunner tx, Clock clock, CronCalculator cron,
                        SchedulerSettings settings) {
        this(jobs, tx, clock, cron, settings, null, null, null);
    }

    /**
     * @param timerBackend null = a single-thread scheduled executor
     * @param workers      null = a fixed pool of {@code maxConcurrency} threads
     * @param scanExecutor null = a single-thread scheduled executor
     */
    public JobScheduler(JobRepository jobs, TxRunner tx, Clock clock, CronCalculator cron,
                        SchedulerSettings settings,
                        TimerBackend timerBackend, Executor workers, ScheduledExecutorService scanExecutor) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;

        if (timerBackend == null) {
            timerBackend = new ExecutorTimerBackend(own(Executors.newSingleThreadScheduledExecutor(threads("kairos-timer"))));
        }
        if (workers == null) {
            ownedWorkers = Executors.newFixedThreadPool(settings.maxConcurrency(), threads("kairos-worker"));
            workers = ownedWorkers;
        }
        if (scanExecutor == null) {
            scanExecutor = own(Executors.newSingleThreadScheduledExecutor(threads("kairos-scan")));
        }

        this.definitions = new JobDefinitionRegistry(settings.defaultLockLifetime());
        this.locks = new LockManager(jobs, tx, clock, definitions, settings.workerId());
        this.admission = new AdmissionController(definitions, settings.maxConcurrency(), settings.defaultConcurrency());
        this.planner = new RecurrencePlanner(cron, clock, settings.defaultZone());
        this.dispatcher = new Dispatcher(jobs, tx, clock, definitions, admission, locks, planner, notifier, workers);
        TimerScheduler timers = new TimerScheduler(timerBackend, clock, settings.reevaluationInterval());
        this.scanLoop = new ScanLoop(jobs, tx, clock, locks, admission, timers, dispatcher, settings, scanExecutor);
        this.maintenance = new MaintenanceService(jobs, tx, clock, definitions);
    }

    // --- definitions and observers ---

    public JobScheduler define(JobDefinition definition) {
        definitions.define(definition);
        return this;
    }

    public JobScheduler define(String name, JobHandler handler) {
        return define(JobDefinition.of(name, handler));
    }

    public JobScheduler define(String name, JobHandler handler, JobDefinition.Options options) {
        return define(JobDefinition.of(name, handler, options));
    }

    public JobScheduler on(JobLifecycleListener listener) {
        notifier.add(listener);
        return this;
    }

    public JobScheduler off(JobLifecycleListener listener) {
        notifier.remove(listener);
        return this;
    }

    // --- creating jobs ---

    /** Unsaved NORMAL job carrying the definition's default priority; adjust and pass to {@link #save}. */
    public JobRecord create(String name, Map<String, Object> data) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("job name is required");
        int priority = definitions.find(name).map(JobDefinition::priority).orElse(0);
        return JobRecord.ofNew(name, data).withPriority(priority);
    }

    /** Saves a job due immediately and requests a scan. */
    public JobRecord now(String name, Map<String, Object> data) throws Exception {
        return save(create(name, data).withNextRunAt(clock.now()));
    }

    public JobRecord schedule(Instant when, String name, Map<String, Object> data) throws Exception {
        if (when == null) throw new IllegalArgumentException("run time is required");
        return save(create(name, data).withNextRunAt(when));
    }

    public JobRecord every(String interval, String name, Map<String, Object> data) throws Exception {
        return every(interval, name, data, new EveryOptions());
    }

    /**
     * Upserts the SINGLE repeating job of {@code name}. Re-declaring it on every start keeps the stored
     * schedule; only a first run that lies in the future replaces it.
     */
    public JobRecord every(String interval, String name, Map<String, Object> data, EveryOptions options)
            throws Exception {
        planner.validate(interval, options.timezone);
        if (options.startDate != null && options.endDate != null && options.endDate.isBefore(options.startDate)) {
            throw new IllegalArgumentException("endDate is before startDate");
        }
        JobRecord job = create(name, data)
                .withType(JobType.SINGLE)
                .withRepeat(interval, options.timezone, options.startDate, options.endDate)
                .withDisabled(options.disabled);
        return save(job.withNextRunAt(planner.firstRun(job, options.skipImmediate)));
    }

    /**
     * Inserts a new job, upserts a SINGLE job by name, or overwrites an existing one. A due job triggers a
     * scan, a future one gets a timer wake.
     */
    public JobRecord save(JobRecord job) throws Exception {
        if (job.repeating()) planner.validate(job.repeatInterval(), job.repeatTimezone());
        Instant now = clock.now();

        JobRecord saved = tx.required(() -> {
            if (job.type() == JobType.SINGLE) return jobs.upsertSingle(job, now);
            if (job.id() == null) return jobs.insert(job);
            jobs.save(job);
            return jobs.findById(job.id()).orElse(job);
        });
        log.debug("Saved job '{}' id={} nextRunAt={}", saved.name(), saved.id(), saved.nextRunAt());
        afterChange(saved);
        return saved;
    }

    // --- managing jobs ---

    public int enable(String name) throws Exception {
        int n = tx.required(() -> jobs.setDisabled(name, false));
        for (JobRecord job : jobs(name)) afterChange(job);
        return n;
    }

    public int disable(String name) throws Exception {
        List<JobRecord> current = jobs(name);
        int n = tx.required(() -> jobs.setDisabled(name, true));
        for (JobRecord job : current) scanLoop.unwatch(job.id());
        return n;
    }

    public int cancel(String name) throws Exception {
        List<JobRecord> current = jobs(name);
        int n = tx.required(() -> jobs.deleteByName(name));
        for (JobRecord job : current) scanLoop.unwatch(job.id());
        if (n > 0) log.info("Cancelled {} job(s) named '{}'", n, name);
        return n;
    }

    public boolean cancel(long id) throws Exception {
        boolean removed = tx.required(() -> jobs.delete(id));
        scanLoop.unwatch(id);
        return removed;
    }

    public List<JobRecord> jobs(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    public Optional<JobRecord> job(long id) throws Exception {
        return tx.required(() -> jobs.findById(id));
    }

    /** Deletes every job whose name has no definition in this engine. */
    public int purge() throws Exception {
        int n = tx.required(() -> jobs.deleteNotIn(definitions.names()));
        if (n > 0) log.info("Purged {} job(s) without a definition", n);
        return n;
    }

    // --- lifecycle ---

    public void start() {
        scanLoop.start();
    }

    /**
     * Stops scanning and waits up to the drain timeout for running handlers. A handler still running after
     * that keeps its lock until the lock lifetime expires and its outcome is not recorded.
     *
     * @return false when running handlers had to be abandoned
     */
    public boolean stop() {
        boolean drained = scanLoop.stop(settings.drainTimeout());
        for (ExecutorService e : owned) e.shutdownNow();
        if (ownedWorkers != null) ownedWorkers.shutdown();
        return drained;
    }

    @Override
    public void close() {
        stop();
    }

    public JobDefinitionRegistry definitions() { return definitions; }

    public ScanLoop scanLoop() { return scanLoop; }

    public AdmissionController admission() { return admission; }

    public MaintenanceService maintenance() { return maintenance; }

    public SchedulerSettings settings() { return settings; }

    private void afterChange(JobRecord job) {
        if (job.disabled() || job.nextRunAt() == null || job.id() == null) return;
        if (job.nextRunAt().isAfter(clock.now())) {
            scanLoop.watch(job);
        } else {
            scanLoop.trigger();
        }
    }

    private <E extends ExecutorService> E own(E executor) {
        owned.add(executor);
        return executor;
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Options of {@link #every(String, String, Map, EveryOptions)}. */
    public static final class EveryOptions {
        private String timezone;
        private Instant startDate;
        private Instant endDate;
        private boolean skipImmediate;
        private boolean disabled;

        public EveryOptions timezone(String timezone) { this.timezone = timezone; return this; }
        public EveryOptions startDate(Instant startDate) { this.startDate = startDate; return this; }
        public EveryOptions endDate(Instant endDate) { this.endDate = endDate; return this; }
        public EveryOptions skipImmediate(boolean skipImmediate) { this.skipImmediate = skipImmediate; return this; }
        /** Stores the job disabled; an existing record is switched off in the same upsert. */
        public EveryOptions disabled(boolean disabled) { this.disabled = disabled; return this; }
    }
}
