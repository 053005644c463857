package net.kairos.integration.spring;

import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Engine SPI implementations on top of the application's DataSource and transaction manager. */
@Configuration
public class KairosSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // adapter-jdbc reused as is
    @Bean public JobRepository jobRepository(DataSource ds) { return new JdbcJobRepository(ds); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }

    // CronCalculator: cron.CronUtilsCalculator, registered by the auto-configuration unless the app has one
}
