package net.kairos.core.service;

import net.kairos.core.definition.JobContext;
import net.kairos.core.definition.JobDefinition;
import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.definition.NoSuchDefinitionException;
import net.kairos.core.event.JobEvent;
import net.kairos.core.event.LifecycleNotifier;
import net.kairos.core.lock.LockManager;
import net.kairos.core.model.FailureKind;
import net.kairos.core.model.JobRecord;
import net.kairos.core.model.Outcome;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a locked and admitted job on the worker pool and records its outcome.
 * <p>
 * Whatever happens, one execution ends with exactly one admission release and, unless the record was
 * deleted or the execution abandoned on shutdown, one lock release.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final JobDefinitionRegistry definitions;
    private final AdmissionController admission;
    private final LockManager locks;
    private final RecurrencePlanner planner;
    private final LifecycleNotifier notifier;
    private final Executor workers;

    private final Map<CompletableFuture<Outcome>, Long> inFlight = new ConcurrentHashMap<>();
    private final Set<Long> abandoned = ConcurrentHashMap.newKeySet();

    public Dispatcher(JobRepository jobs, TxRunner tx, Clock clock,
                      JobDefinitionRegistry definitions,
                      AdmissionController admission,
                      LockManager locks,
                      RecurrencePlanner planner,
                      LifecycleNotifier notifier,
                      Executor workers) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.definitions = definitions;
        this.admission = admission;
        this.locks = locks;
        this.planner = planner;
        this.notifier = notifier;
        this.workers = workers;
    }

    /**
     * Queues the job on the worker pool. The start is recorded and STARTED fired once a worker picks it
     * up, and the definition timeout counts from that moment. The returned future always completes
     * normally, except when the start could not be recorded.
     */
    public CompletableFuture<Outcome> execute(JobRecord job) {
        Optional<JobDefinition> def = definitions.find(job.name());
        if (def.isEmpty()) {
            log.warn("No definition for job '{}' id={}, marking failed", job.name(), job.id());
            Outcome outcome = Outcome.failed(FailureKind.NO_SUCH_DEFINITION,
                    new NoSuchDefinitionException(job.name()));
            finish(job, outcome);
            return CompletableFuture.completedFuture(outcome);
        }

        CompletableFuture<Outcome> done = new CompletableFuture<>();
        inFlight.put(done, job.id());
        done.whenComplete((o, e) -> inFlight.remove(done));
        try {
            workers.execute(() -> run(job, def.get(), done));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool refused job '{}' id={}, releasing it", job.name(), job.id());
            admission.release(job);
            locks.release(job.id());
            done.completeExceptionally(e);
        }
        return done;
    }

    private void run(JobRecord job, JobDefinition definition, CompletableFuture<Outcome> done) {
        JobRecord running = job.started(clock.now(), locks.workerId());
        try {
            tx.required(() -> jobs.saveRunState(running));
        } catch (Exception e) {
            log.warn("Could not record start of job '{}' id={}, releasing it", job.name(), job.id(), e);
            admission.release(job);
            locks.release(job.id());
            done.completeExceptionally(e);
            return;
        }
        notifier.fire(JobEvent.started(job.name(), job.id()));

        CompletableFuture<Void> handler = new CompletableFuture<>();
        if (definition.timeout() != null) {
            handler.orTimeout(definition.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        handler.handle((v, err) -> {
            Outcome outcome = outcomeOf(err, definition.timeout());
            finish(running, outcome);
            return outcome;
        }).whenComplete((outcome, err) -> {
            if (err != null) {
                done.completeExceptionally(err);
            } else {
                done.complete(outcome);
            }
        });

        try {
            definition.handler().handle(new JobContext(running, locks));
            handler.complete(null);
        } catch (Exception | Error e) {
            handler.completeExceptionally(e);
        }
    }

    public int inFlight() {
        return inFlight.size();
    }

    /** @return true when every execution finished within {@code timeout} */
    public boolean drain(Duration timeout) {
        CompletableFuture<?>[] pending = inFlight.keySet().toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) return true;
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} job(s) still running after {}", inFlight.size(), timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("Job execution ended abnormally during drain", e.getCause());
            return true;
        }
    }

    /**
     * Gives up on the executions still running: when their handlers return, nothing is written and the
     * lock stays until its lifetime expires, so another node may pick the job up again.
     */
    public void abandonInFlight() {
        abandoned.addAll(inFlight.values());
        if (!abandoned.isEmpty()) {
            log.warn("Abandoning job id(s) {}; their locks will expire", abandoned);
        }
    }

    private static Outcome outcomeOf(Throwable err, Duration timeout) {
        if (err == null) return Outcome.succeeded();
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof TimeoutException) {
            return Outcome.failed(FailureKind.HANDLER_TIMEOUT,
                    new TimeoutException("handler did not finish within " + timeout));
        }
        return Outcome.failed(FailureKind.HANDLER_FAILURE, cause);
    }

    private void finish(JobRecord job, Outcome outcome) {
        if (job.id() != null && abandoned.remove(job.id())) {
            admission.release(job);
            log.warn("Abandoned job '{}' id={} returned after shutdown, outcome not recorded", job.name(), job.id());
            return;
        }
        Instant finishedAt = clock.now();
        boolean deleted = false;
        try {
            Instant next = outcome.failure() == FailureKind.NO_SUCH_DEFINITION ? null : nextRun(job, finishedAt);
            JobRecord updated = outcome.success()
                    ? job.succeeded(finishedAt, next)
                    : job.failed(finishedAt, outcome.reason(), next);

            boolean remove = outcome.success() && !job.repeating()
                    && definitions.find(job.name()).map(JobDefinition::removeOnComplete).orElse(false);
            if (remove) {
                deleted = tx.required(() -> jobs.delete(job.id()));
            } else {
                tx.required(() -> jobs.saveRunState(updated));
            }
        } catch (Exception e) {
            log.warn("Could not record outcome of job '{}' id={}", job.name(), job.id(), e);
        } finally {
            admission.release(job);
            if (!deleted) locks.release(job.id());
        }

        if (outcome.success()) {
            log.debug("Job '{}' id={} succeeded", job.name(), job.id());
            notifier.fire(JobEvent.succeeded(job.name(), job.id()));
        } else {
            if (outcome.failure() == FailureKind.HANDLER_FAILURE) {
                log.warn("Job '{}' id={} failed", job.name(), job.id(), outcome.error());
            } else {
                log.warn("Job '{}' id={} failed: {}", job.name(), job.id(), outcome.reason());
            }
            notifier.fire(JobEvent.failed(job.name(), job.id(), outcome.error()));
        }
    }

    private Instant nextRun(JobRecord job, Instant finishedAt) {
        try {
            return planner.computeNext(job, finishedAt);
        } catch (RuntimeException e) {
            log.warn("Invalid repeat interval '{}' on job '{}' id={}, not rescheduling",
                    job.repeatInterval(), job.name(), job.id(), e);
            return null;
        }
    }
}
