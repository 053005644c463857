package net.kairos.bootstrap.autoconfigure;

import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.core.JobScheduler;
import net.kairos.core.definition.JobDefinition;
import net.kairos.core.model.JobRecord;
import net.kairos.core.model.JobType;
import net.kairos.core.service.SchedulerSettings;
import net.kairos.core.spi.CronCalculator;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.sched.KairosSchedulers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KairosAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    FlywayAutoConfiguration.class,
                    KairosAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:KairosAutoConfigurationTest;DB_CLOSE_DELAY=-1",
                    "spring.flyway.locations=classpath:db/migration/kairos",
                    "kairos.scheduler.enabled=false",
                    "kairos.maintenance.enabled=false");

    @Test
    void wiresEngine_fromProperties() {
        runner.withPropertyValues(
                        "kairos.zone=Asia/Seoul",
                        "kairos.scheduler.worker-id=node-1",
                        "kairos.scheduler.process-every=2s",
                        "kairos.scheduler.max-concurrency=7",
                        "kairos.scheduler.default-lock-lifetime=3m")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(JobScheduler.class);
                    assertThat(ctx).hasSingleBean(CatalogRegistrar.class);
                    assertThat(ctx).doesNotHaveBean(KairosSchedulers.class);
                    assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(CronUtilsCalculator.class);

                    SchedulerSettings settings = ctx.getBean(SchedulerSettings.class);
                    assertThat(settings.workerId()).isEqualTo("node-1");
                    assertThat(settings.processEvery()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(settings.maxConcurrency()).isEqualTo(7);
                    assertThat(settings.defaultLockLifetime()).isEqualTo(Duration.ofMinutes(3));
                    assertThat(settings.defaultZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
                });
    }

    @Test
    void applicationCronCalculator_wins() {
        CronCalculator custom = (from, expr, zone) -> from.plusSeconds(60);
        runner.withBean("customCron", CronCalculator.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(CronCalculator.class)).isSameAs(custom));
    }

    @Test
    void maintenanceTimer_registeredByDefault() {
        runner.withPropertyValues("kairos.maintenance.enabled=true", "kairos.maintenance.finished-ttl=7d")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(KairosSchedulers.class);
                    assertThat(ctx.getBean(KairosSchedulers.class).getFinishedTtl()).isEqualTo(Duration.ofDays(7));
                });
    }

    @Test
    void runner_definesHandlers_andRegistersCatalogOnce() {
        runner.withBean("reportJob", JobDefinition.class, () -> JobDefinition.of("report", ctx -> { }))
                .withPropertyValues(
                        "kairos.catalog.jobs[0].name=report",
                        "kairos.catalog.jobs[0].interval=1 hour",
                        "kairos.catalog.jobs[0].data.region=eu",
                        "kairos.catalog.jobs[1].name=legacy-sync",
                        "kairos.catalog.jobs[1].interval=0 3 * * *",
                        "kairos.catalog.jobs[1].timezone=UTC",
                        "kairos.catalog.jobs[1].skip-immediate=true",
                        "kairos.catalog.jobs[1].enabled=false")
                .run(ctx -> {
                    ApplicationRunner kairosRunner = ctx.getBean("kairosRunner", ApplicationRunner.class);
                    kairosRunner.run(new DefaultApplicationArguments());
                    kairosRunner.run(new DefaultApplicationArguments());

                    JobScheduler scheduler = ctx.getBean(JobScheduler.class);
                    assertThat(scheduler.definitions().names()).contains("report");

                    List<JobRecord> report = scheduler.jobs("report");
                    assertThat(report).hasSize(1);
                    assertThat(report.get(0).type()).isEqualTo(JobType.SINGLE);
                    assertThat(report.get(0).repeatInterval()).isEqualTo("1 hour");
                    assertThat(report.get(0).data()).containsEntry("region", "eu");

                    List<JobRecord> legacy = scheduler.jobs("legacy-sync");
                    assertThat(legacy).hasSize(1);
                    assertThat(legacy.get(0).disabled()).isTrue();
                    assertThat(legacy.get(0).nextRunAt()).isAfter(Instant.now());
                });
    }
}
