package net.kairos.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;

/**
 * Pooled DataSource migrated with the production scripts. An in-memory H2 database per test class unless
 * KAIROS_JDBC_URL (with KAIROS_JDBC_USERNAME / KAIROS_JDBC_PASSWORD) points at a real one.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("KAIROS_JDBC_URL");
        String user = System.getenv("KAIROS_JDBC_USERNAME");
        String pass = System.getenv("KAIROS_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            url = "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
            user = "sa";
            pass = "";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/kairos")
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    @BeforeEach
    void truncateJobs() throws Exception {
        new JdbcTxRunner(ds).required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.execute("DELETE FROM KAIROS_JOB");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
