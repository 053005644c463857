package net.kairos.core.lock;

import net.kairos.core.model.JobRecord;

/**
 * @param job            the locked record for LOCKED, the last seen record for ALREADY_LOCKED, null for NOT_FOUND
 * @param staleReclaimed the lock was taken over from a holder whose lock had expired
 */
public record LockResult(Status status, JobRecord job, boolean staleReclaimed) {

    /** ALREADY_LOCKED also covers a record that is disabled or not yet due: it cannot be claimed now. */
    public enum Status { LOCKED, ALREADY_LOCKED, NOT_FOUND }

    static LockResult locked(JobRecord job, boolean staleReclaimed) {
        return new LockResult(Status.LOCKED, job, staleReclaimed);
    }

    static LockResult alreadyLocked(JobRecord seen) {
        return new LockResult(Status.ALREADY_LOCKED, seen, false);
    }

    static LockResult notFound() {
        return new LockResult(Status.NOT_FOUND, null, false);
    }

    public boolean locked() {
        return status == Status.LOCKED;
    }
}
