package net.kairos.core.lock;

import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.model.JobRecord;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Claims, renews and releases the processing lock of a job record. The claim itself is the repository's
 * single conditional update; the surrounding reads only classify the outcome.
 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final JobDefinitionRegistry definitions;
    private final String workerId;

    public LockManager(JobRepository jobs, TxRunner tx, Clock clock,
                       JobDefinitionRegistry definitions, String workerId) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.definitions = definitions;
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }

    /** Due-time claim: the job must also have NEXT_RUN_AT <= now. */
    public LockResult tryAcquire(long jobId) throws Exception {
        return acquire(jobId, true);
    }

    /** Claim regardless of NEXT_RUN_AT (used for explicit runs of an existing record). */
    public LockResult tryAcquireNow(long jobId) throws Exception {
        return acquire(jobId, false);
    }

    private LockResult acquire(long jobId, boolean requireDue) throws Exception {
        LockResult result = tx.requiresNew(() -> {
            Optional<JobRecord> current = jobs.findById(jobId);
            if (current.isEmpty()) return LockResult.notFound();

            JobRecord seen = current.get();
            Instant now = clock.now();
            Instant staleBefore = now.minus(definitions.lockLifetimeFor(seen.name()));
            if (!jobs.lock(jobId, workerId, now, staleBefore, requireDue)) {
                return LockResult.alreadyLocked(seen);
            }
            JobRecord locked = jobs.findById(jobId).orElse(seen.withLock(now, workerId));
            boolean staleReclaimed = seen.lockedAt() != null && seen.lockedAt().isBefore(staleBefore);
            return LockResult.locked(locked, staleReclaimed);
        });

        switch (result.status()) {
            case LOCKED -> {
                if (result.staleReclaimed()) {
                    log.info("Reclaimed stale lock: job='{}' id={} worker={}", result.job().name(), jobId, workerId);
                } else {
                    log.debug("Locked job '{}' id={}", result.job().name(), jobId);
                }
            }
            case ALREADY_LOCKED -> log.debug("Lock contention on job id={}, skipping", jobId);
            case NOT_FOUND -> log.debug("Job id={} not found while locking", jobId);
        }
        return result;
    }

    /** @return false when the lock is no longer held by this worker or the renewal could not be written */
    public boolean renew(long jobId) {
        try {
            return tx.requiresNew(() -> jobs.renewLock(jobId, workerId, clock.now()));
        } catch (Exception e) {
            log.warn("Failed to renew lock of job id={}", jobId, e);
            return false;
        }
    }

    /** Unconditional release. A failed write is left to staleness expiry. */
    public void release(long jobId) {
        try {
            tx.requiresNew(() -> { jobs.unlock(jobId); return null; });
        } catch (Exception e) {
            log.warn("Failed to release lock of job id={}; it will expire after its lock lifetime", jobId, e);
        }
    }

    /** Lower bound of LOCKED_AT for the scan query. */
    public Instant scanStaleBefore(Instant now) {
        return now.minus(definitions.shortestLockLifetime());
    }
}
