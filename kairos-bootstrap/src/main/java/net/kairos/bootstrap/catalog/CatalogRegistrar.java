package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.JobScheduler;
import net.kairos.core.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the configured repeating jobs. Each one is a SINGLE record keyed by name, so registering the
 * same catalog on every node and every restart keeps one record and its schedule.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobScheduler scheduler;

    public CatalogRegistrar(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public int register(KairosProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getJobs()) {
            register(def);
            n++;
        }
        return n;
    }

    private void register(KairosProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank() || def.getInterval() == null) {
            throw new IllegalArgumentException("catalog job needs name and interval: " + def);
        }
        if (scheduler.definitions().find(def.getName()).isEmpty()) {
            log.warn("Catalog job '{}' has no JobDefinition on this node; it runs wherever one is defined", def.getName());
        }

        var options = new JobScheduler.EveryOptions()
                .timezone(def.getTimezone())
                .skipImmediate(def.isSkipImmediate())
                .disabled(!def.isEnabled());
        JobRecord job = scheduler.every(def.getInterval(), def.getName(), def.getData(), options);

        log.info("Catalog registered: job='{}' interval='{}' nextRunAt={} enabled={}",
                def.getName(), def.getInterval(), job.nextRunAt(), def.isEnabled());
    }
}
