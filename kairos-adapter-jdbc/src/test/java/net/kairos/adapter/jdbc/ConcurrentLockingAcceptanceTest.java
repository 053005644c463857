package net.kairos.adapter.jdbc;

import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.lock.LockManager;
import net.kairos.core.lock.LockResult;
import net.kairos.core.model.JobRecord;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lock contention against a real database: every worker has its own LockManager and transactions, and
 * the only coordination is the conditional UPDATE.
 */
class ConcurrentLockingAcceptanceTest extends TestSupport {

    TxRunner tx;
    JobRepository jobs;
    JobDefinitionRegistry definitions;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        jobs = new JdbcJobRepository(ds);
        definitions = new JobDefinitionRegistry(Duration.ofMinutes(10));
    }

    long seedDue(Instant at) throws Exception {
        return tx.required(() -> jobs.insert(JobRecord.ofNew("contended", Map.of()).withNextRunAt(at))).id();
    }

    // ========== two workers, same record, same millisecond ==========
    @Test
    void t1_simultaneousAcquire_recordEndsLockedByExactlyOneWorker() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long id = seedDue(now.minusSeconds(1));
        Clock frozen = () -> now;

        LockManager a = new LockManager(jobs, tx, frozen, definitions, "worker-a");
        LockManager b = new LockManager(jobs, tx, frozen, definitions, "worker-b");

        ExecutorService es = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Future<LockResult> fa = es.submit(() -> { start.await(); return a.tryAcquire(id); });
        Future<LockResult> fb = es.submit(() -> { start.await(); return b.tryAcquire(id); });
        start.countDown();
        LockResult ra = fa.get();
        LockResult rb = fb.get();
        es.shutdown();

        assertTrue(ra.locked() ^ rb.locked(), "exactly one worker wins");
        String winner = ra.locked() ? "worker-a" : "worker-b";
        JobRecord stored = tx.required(() -> jobs.findById(id).orElseThrow());
        assertEquals(winner, stored.lastModifiedBy());
        assertEquals(now, stored.lockedAt());
    }

    // ========== many workers, one record ==========
    @Test
    void t2_manyWorkers_oneWinner() throws Exception {
        long id = seedDue(Instant.now().minusSeconds(1));

        int threads = 10;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            LockManager w = new LockManager(jobs, tx, Instant::now, definitions, "worker-" + i);
            futures.add(es.submit(() -> {
                start.await();
                return w.tryAcquire(id).locked();
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Boolean> f : futures) wins += f.get() ? 1 : 0;
        es.shutdown();
        assertEquals(1, wins, "exactly one worker should win the lock");
    }

    // ========== many workers, many records: no record claimed twice ==========
    @Test
    void t3_parallelWorkers_partitionDueRecordsWithoutDuplicates() throws Exception {
        int records = 20;
        Instant due = Instant.now().minusSeconds(5);
        for (int i = 0; i < records; i++) seedDue(due);

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            LockManager w = new LockManager(jobs, tx, Instant::now, definitions, "worker-" + t);
            futures.add(es.submit(() -> {
                start.await();
                List<Long> mine = new ArrayList<>();
                Instant now = Instant.now();
                List<JobRecord> candidates = tx.required(() -> jobs.findLockable(now, w.scanStaleBefore(now), 100));
                for (JobRecord c : candidates) {
                    if (w.tryAcquire(c.id()).locked()) mine.add(c.id());
                }
                return mine;
            }));
        }
        start.countDown();

        List<Long> all = new ArrayList<>();
        for (Future<List<Long>> f : futures) all.addAll(f.get());
        es.shutdown();

        Set<Long> unique = new HashSet<>(all);
        assertEquals(all.size(), unique.size(), "no record claimed twice");
        assertEquals(records, unique.size(), "every record claimed once");
    }

    // ========== crashed holder: lock reclaimed once it is stale ==========
    @Test
    void t4_staleLock_isReclaimedByOneWorker() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long id = seedDue(now.minus(Duration.ofHours(1)));
        Instant crashedAt = now.minus(Duration.ofMinutes(15));
        assertTrue(tx.required(() -> jobs.lock(id, "crashed", crashedAt, crashedAt.minusSeconds(1), true)));

        LockManager a = new LockManager(jobs, tx, () -> now, definitions, "worker-a");
        LockManager b = new LockManager(jobs, tx, () -> now, definitions, "worker-b");

        LockResult first = a.tryAcquire(id);
        LockResult second = b.tryAcquire(id);

        assertTrue(first.locked());
        assertTrue(first.staleReclaimed());
        assertEquals(LockResult.Status.ALREADY_LOCKED, second.status());
    }
}
