package net.kairos.core.maintenance;

import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final Duration DEFAULT_FINISHED_TTL = Duration.ofDays(30);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final JobDefinitionRegistry definitions;

    public MaintenanceService(JobRepository jobs,
                              TxRunner tx,
                              Clock clock,
                              JobDefinitionRegistry definitions) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.definitions = definitions;
    }

    /**
     * Periodic cleanup.
     * - clears locks abandoned by crashed workers (older than the longest lock lifetime)
     * - deletes finished one-shot jobs older than {@code finishedTtl} (skipped when null or zero)
     */
    public MaintenanceReport runOnce(Duration finishedTtl) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        Instant staleBefore = now.minus(definitions.longestLockLifetime());
        r.unlockedExpired = tx.required(() -> jobs.unlockExpired(staleBefore));

        if (finishedTtl != null && !finishedTtl.isZero() && !finishedTtl.isNegative()) {
            Instant threshold = now.minus(finishedTtl);
            r.deletedFinished = tx.required(() -> jobs.deleteFinishedBefore(threshold));
        }

        r.timestamp = now;
        if (r.unlockedExpired > 0 || r.deletedFinished > 0) {
            log.info("Maintenance: {}", r);
        }
        return r;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int unlockedExpired;
        public int deletedFinished;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", unlockedExpired=" + unlockedExpired +
                    ", deletedFinished=" + deletedFinished +
                    '}';
        }
    }
}
