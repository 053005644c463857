package net.kairos.core.definition;

import net.kairos.core.lock.LockManager;
import net.kairos.core.model.JobRecord;

import java.util.Map;

/** What a handler sees of the job it is running. */
public final class JobContext {
    private final JobRecord job;
    private final LockManager locks;

    public JobContext(JobRecord job, LockManager locks) {
        this.job = job;
        this.locks = locks;
    }

    public JobRecord job() { return job; }

    public Map<String, Object> data() { return job.data(); }

    /**
     * Pushes the lock expiry forward for handlers that run longer than the lock lifetime.
     *
     * @return false when the lock was lost (reclaimed by another worker)
     */
    public boolean touch() {
        return locks.renew(job.id());
    }
}
