package net.kairos.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("kairos")
public class KairosProperties {
    private String zone;               // null = process zone
    private Scheduler scheduler = new Scheduler();
    private Maintenance maintenance = new Maintenance();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        /** false = the engine is wired but never started (no scanning on this node) */
        private boolean enabled = true;
        private String workerId;
        private Duration processEvery = Duration.ofSeconds(5);
        private Duration defaultLockLifetime = Duration.ofMinutes(10);
        private int maxConcurrency = 20;
        private int defaultConcurrency = 0;
        private int batchSize = 50;
        private Duration drainTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public Duration getProcessEvery() {
            return processEvery;
        }

        public void setProcessEvery(Duration processEvery) {
            this.processEvery = processEvery;
        }

        public Duration getDefaultLockLifetime() {
            return defaultLockLifetime;
        }

        public void setDefaultLockLifetime(Duration defaultLockLifetime) {
            this.defaultLockLifetime = defaultLockLifetime;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getDefaultConcurrency() {
            return defaultConcurrency;
        }

        public void setDefaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = defaultConcurrency;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private long delayMs = 60_000;
        private long initialDelayMs = 60_000;
        private Duration finishedTtl = Duration.ofDays(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public Duration getFinishedTtl() {
            return finishedTtl;
        }

        public void setFinishedTtl(Duration finishedTtl) {
            this.finishedTtl = finishedTtl;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** A repeating job declared in configuration; its handler comes from a {@code JobDefinition} bean of the same name. */
    public static class JobDef {
        private String name;
        private String interval;           // duration or cron
        private String timezone;
        private boolean enabled = true;
        private boolean skipImmediate = false;
        private Map<String, Object> data = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isSkipImmediate() {
            return skipImmediate;
        }

        public void setSkipImmediate(boolean skipImmediate) {
            this.skipImmediate = skipImmediate;
        }

        public Map<String, Object> getData() {
            return data;
        }

        public void setData(Map<String, Object> data) {
            this.data = data;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", interval='" + interval + '\'' +
                    ", timezone='" + timezone + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
