package net.kairos.core.service;

import net.kairos.core.definition.JobDefinition;
import net.kairos.core.definition.JobDefinitionRegistry;
import net.kairos.core.model.JobRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Local concurrency gate between lock and dispatch: a process-wide ceiling and a per-name ceiling.
 * Counters live only in this instance; every admit is paired with one {@link #release}.
 */
public final class AdmissionController {
    private final JobDefinitionRegistry definitions;
    private final int maxConcurrency;
    private final int defaultConcurrency;

    private final Map<String, Integer> runningByName = new HashMap<>();
    private int running;

    public AdmissionController(JobDefinitionRegistry definitions, int maxConcurrency, int defaultConcurrency) {
        this.definitions = definitions;
        this.maxConcurrency = maxConcurrency;
        this.defaultConcurrency = defaultConcurrency;
    }

    public synchronized Admission tryAdmit(JobRecord job) {
        if (running >= maxConcurrency) {
            return Admission.rejected("engine at max concurrency " + maxConcurrency);
        }
        int limit = limitFor(job.name());
        int current = runningByName.getOrDefault(job.name(), 0);
        if (limit > 0 && current >= limit) {
            return Admission.rejected("job '" + job.name() + "' at concurrency " + limit);
        }
        running++;
        runningByName.put(job.name(), current + 1);
        return Admission.ok();
    }

    /** Cheap pre-check for the scan loop; {@link #tryAdmit} stays authoritative. */
    public synchronized boolean hasCapacity(String name) {
        if (running >= maxConcurrency) return false;
        int limit = limitFor(name);
        return limit == 0 || runningByName.getOrDefault(name, 0) < limit;
    }

    public synchronized void release(JobRecord job) {
        Integer current = runningByName.get(job.name());
        if (current == null) return;
        if (current <= 1) runningByName.remove(job.name()); else runningByName.put(job.name(), current - 1);
        running = Math.max(0, running - 1);
    }

    public synchronized int running() {
        return running;
    }

    public synchronized int running(String name) {
        return runningByName.getOrDefault(name, 0);
    }

    /** Called on engine start. */
    public synchronized void reset() {
        running = 0;
        runningByName.clear();
    }

    private int limitFor(String name) {
        return definitions.find(name)
                .map(JobDefinition::concurrency)
                .filter(c -> c > 0)
                .orElse(defaultConcurrency);
    }
}
