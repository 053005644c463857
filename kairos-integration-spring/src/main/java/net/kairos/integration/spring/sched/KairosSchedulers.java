package net.kairos.integration.spring.sched;

import net.kairos.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** Periodic housekeeping driven by Spring's scheduler; the engine runs its own scan loop. */
public class KairosSchedulers {
    private final MaintenanceService maintenance;

    private Duration finishedTtl = MaintenanceService.DEFAULT_FINISHED_TTL;

    public KairosSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${kairos.maintenance.delay-ms:60000}",
               initialDelayString = "${kairos.maintenance.initial-delay-ms:60000}")
    public void maintenance() throws Exception {
        maintenance.runOnce(finishedTtl);
    }

    public void setFinishedTtl(Duration finishedTtl) {
        this.finishedTtl = finishedTtl;
    }

    public Duration getFinishedTtl() {
        return finishedTtl;
    }
}
