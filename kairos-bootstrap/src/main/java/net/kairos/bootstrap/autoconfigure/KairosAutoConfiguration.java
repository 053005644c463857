package net.kairos.bootstrap.autoconfigure;

import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.JobScheduler;
import net.kairos.core.definition.JobDefinition;
import net.kairos.core.event.JobLifecycleListener;
import net.kairos.core.maintenance.MaintenanceService;
import net.kairos.core.service.SchedulerSettings;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.KairosSpringConfig;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.sched.KairosSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.ZoneId;

@AutoConfiguration(after = DataSourceTransactionManagerAutoConfiguration.class)
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: repository/tx/clock wiring
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    // --- SPI default (if missing) ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    // --- engine ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings kairosSchedulerSettings(KairosProperties props) {
        var s = props.getScheduler();
        var b = SchedulerSettings.builder()
                .processEvery(s.getProcessEvery())
                .defaultLockLifetime(s.getDefaultLockLifetime())
                .maxConcurrency(s.getMaxConcurrency())
                .defaultConcurrency(s.getDefaultConcurrency())
                .batchSize(s.getBatchSize())
                .drainTimeout(s.getDrainTimeout());
        if (s.getWorkerId() != null && !s.getWorkerId().isBlank()) b.workerId(s.getWorkerId());
        if (props.getZone() != null && !props.getZone().isBlank()) b.defaultZone(ZoneId.of(props.getZone()));
        return b.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobRepository jobs,
                                     TxRunner tx,
                                     Clock clock,
                                     CronCalculator cron,
                                     SchedulerSettings settings,
                                     ObjectProvider<JobLifecycleListener> listeners) {
        var scheduler = new JobScheduler(jobs, tx, clock, cron, settings);
        listeners.orderedStream().forEach(scheduler::on);
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(JobScheduler scheduler) {
        return scheduler.maintenance();
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobScheduler scheduler) {
        return new CatalogRegistrar(scheduler);
    }

    /**
     * Handlers first, then the catalog that refers to them, then the scan loop: a due catalog job must not
     * be picked up before its handler is known.
     */
    @Bean
    public ApplicationRunner kairosRunner(JobScheduler scheduler,
                                          ObjectProvider<JobDefinition> definitions,
                                          CatalogRegistrar registrar,
                                          KairosProperties props) {
        return args -> {
            definitions.orderedStream().forEach(scheduler::define);
            log.info("[Kairos] definitions: {}", scheduler.definitions().names());

            // a disabled node only writes jobs: stopping first keeps it from arming wakes for them
            if (!props.getScheduler().isEnabled()) {
                scheduler.stop();
                log.info("[Kairos] scheduler disabled on this node, jobs are stored but not processed");
            }
            if (props.getCatalog().isEnabled()) {
                int n = registrar.register(props.getCatalog());
                log.info("[Kairos] catalog: {} job(s) registered", n);
            }
            if (props.getScheduler().isEnabled()) {
                scheduler.start();
                log.info("[Kairos] scheduler started: workerId={}", scheduler.settings().workerId());
            }
        };
    }

    // --- maintenance timer (delays read from kairos.maintenance.delay-ms / initial-delay-ms) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "kairos.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MaintenanceScheduling {

        @Bean
        public KairosSchedulers kairosSchedulers(MaintenanceService maintenance, KairosProperties props) {
            var s = new KairosSchedulers(maintenance);
            s.setFinishedTtl(props.getMaintenance().getFinishedTtl());
            return s;
        }
    }
}
