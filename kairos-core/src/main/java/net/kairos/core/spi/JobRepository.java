package net.kairos.core.spi;

import net.kairos.core.model.JobRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage contract of the engine. Every call runs inside a {@link TxRunner} unit of work.
 */
public interface JobRepository {

    /**
     * Single atomic conditional update: sets LOCKED_AT/LAST_MODIFIED_BY only if the job is enabled, its
     * lock is null or older than {@code staleBefore} and, when {@code requireDue}, NEXT_RUN_AT <= now.
     *
     * @return true when this call took the lock
     */
    boolean lock(long id, String owner, Instant now, Instant staleBefore, boolean requireDue) throws Exception;

    /** Refreshes LOCKED_AT while {@code owner} still holds the lock. */
    boolean renewLock(long id, String owner, Instant now) throws Exception;

    /** Clears LOCKED_AT unconditionally. */
    void unlock(long id) throws Exception;

    /** Enabled, due, unlocked (or stale) jobs by PRIORITY desc, NEXT_RUN_AT asc. */
    List<JobRecord> findLockable(Instant now, Instant staleBefore, int limit) throws Exception;

    Optional<JobRecord> findById(long id) throws Exception;

    List<JobRecord> findByName(String name) throws Exception;

    /** Inserts a new record and returns it with its generated id. */
    JobRecord insert(JobRecord job) throws Exception;

    /**
     * Upsert keyed by NAME for SINGLE jobs. An existing record keeps its NEXT_RUN_AT unless the new one
     * lies after {@code now}.
     */
    JobRecord upsertSingle(JobRecord job, Instant now) throws Exception;

    /** Writes every field except the lock fields (LOCKED_AT, LAST_MODIFIED_BY). */
    void save(JobRecord job) throws Exception;

    /**
     * Writes only the run bookkeeping of {@code job}: NEXT_RUN_AT, LAST_RUN_AT, LAST_FINISHED_AT and the
     * failure fields. Data, repeat settings and DISABLED changed by others while the job ran stay as stored.
     *
     * @return false when the record no longer exists
     */
    boolean saveRunState(JobRecord job) throws Exception;

    boolean delete(long id) throws Exception;

    int deleteByName(String name) throws Exception;

    /** Removes jobs whose name is not in {@code names}. */
    int deleteNotIn(Collection<String> names) throws Exception;

    int setDisabled(String name, boolean disabled) throws Exception;

    // --- maintenance ---

    /** Clears locks taken before {@code staleBefore}. */
    int unlockExpired(Instant staleBefore) throws Exception;

    /** Deletes unlocked one-shot jobs without a next run that finished before {@code threshold}. */
    int deleteFinishedBefore(Instant threshold) throws Exception;
}
