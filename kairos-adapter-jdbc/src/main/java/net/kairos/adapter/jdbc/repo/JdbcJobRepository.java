package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.JsonData;
import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.JobRecord;
import net.kairos.core.model.JobType;
import net.kairos.core.spi.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.clip;
import static net.kairos.adapter.jdbc.JdbcUtil.ts;
import static net.kairos.adapter.jdbc.JdbcUtil.yn;

/**
 * KAIROS_JOB on plain JDBC. Every method runs on the {@link TxContext} connection; lock state changes are
 * single conditional UPDATEs whose update count is the result.
 */
public final class JdbcJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    static final int FAIL_REASON_WIDTH = 2000;

    private final DataSource ds;
    private final JsonData json;

    public JdbcJobRepository(DataSource ds) { this(ds, new JsonData()); }

    public JdbcJobRepository(DataSource ds, JsonData json) {
        this.ds = ds;
        this.json = json;
    }

    public DataSource dataSource() { return ds; }

    // === locking ===

    @Override
    public boolean lock(long id, String owner, Instant now, Instant staleBefore, boolean requireDue) throws Exception {
        String sql = """
            UPDATE KAIROS_JOB
               SET LOCKED_AT = ?, LAST_MODIFIED_BY = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND DISABLED = 'N'
               AND (LOCKED_AT IS NULL OR LOCKED_AT < ?)
            """ + (requireDue ? "   AND NEXT_RUN_AT IS NOT NULL AND NEXT_RUN_AT <= ?\n" : "");
        try (var ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            ps.setTimestamp(i++, ts(now));
            ps.setString(i++, owner);
            ps.setLong(i++, id);
            ps.setTimestamp(i++, ts(staleBefore));
            if (requireDue) ps.setTimestamp(i, ts(now));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean renewLock(long id, String owner, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB
               SET LOCKED_AT = ?, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ? AND LOCKED_AT IS NOT NULL AND LAST_MODIFIED_BY = ?
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setLong(2, id);
            ps.setString(3, owner);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void unlock(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB SET LOCKED_AT = NULL, UPDATED_AT = CURRENT_TIMESTAMP WHERE ID = ?
        """)) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public List<JobRecord> findLockable(Instant now, Instant staleBefore, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM KAIROS_JOB
             WHERE DISABLED = 'N'
               AND NEXT_RUN_AT IS NOT NULL
               AND NEXT_RUN_AT <= ?
               AND (LOCKED_AT IS NULL OR LOCKED_AT < ?)
             ORDER BY PRIORITY DESC, NEXT_RUN_AT ASC, ID ASC
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setTimestamp(2, ts(staleBefore));
            ps.setMaxRows(limit);
            return list(ps);
        }
    }

    // === lookups ===

    @Override
    public Optional<JobRecord> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KAIROS_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return first(ps);
        }
    }

    @Override
    public List<JobRecord> findByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM KAIROS_JOB WHERE NAME = ? ORDER BY ID")) {
            ps.setString(1, name);
            return list(ps);
        }
    }

    // === writes ===

    @Override
    public JobRecord insert(JobRecord job) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO KAIROS_JOB(NAME, JOB_DATA, PRIORITY, JOB_TYPE, SINGLE_KEY,
                                   NEXT_RUN_AT, LAST_RUN_AT, LAST_FINISHED_AT,
                                   REPEAT_INTERVAL, REPEAT_TIMEZONE, START_DATE, END_DATE, DISABLED,
                                   FAIL_COUNT, FAIL_REASON, FAILED_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """, new String[]{"ID"})) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, json.write(job.data()));
            ps.setInt(i++, job.priority());
            ps.setString(i++, job.type().code());
            ps.setString(i++, job.type() == JobType.SINGLE ? job.name() : null);
            ps.setTimestamp(i++, ts(job.nextRunAt()));
            ps.setTimestamp(i++, ts(job.lastRunAt()));
            ps.setTimestamp(i++, ts(job.lastFinishedAt()));
            ps.setString(i++, job.repeatInterval());
            ps.setString(i++, job.repeatTimezone());
            ps.setTimestamp(i++, ts(job.startDate()));
            ps.setTimestamp(i++, ts(job.endDate()));
            ps.setString(i++, yn(job.disabled()));
            ps.setInt(i++, job.failCount());
            ps.setString(i++, clip(job.failReason(), FAIL_REASON_WIDTH));
            ps.setTimestamp(i, ts(job.failedAt()));
            ps.executeUpdate();
            try (var k = ps.getGeneratedKeys()) {
                k.next();
                id = k.getLong(1);
            }
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + job.name()));
    }

    @Override
    public JobRecord upsertSingle(JobRecord job, Instant now) throws Exception {
        if (updateSingle(job, now) == 0) {
            Connection c = mustConn();
            Savepoint sp = c.setSavepoint();
            try {
                insert(job.withType(JobType.SINGLE));
            } catch (SQLException e) {
                if (!isDuplicateKey(e)) throw e;
                // lost the insert race to another worker; its row is updated instead
                log.debug("Concurrent insert of SINGLE job '{}', updating instead", job.name());
                c.rollback(sp);
                updateSingle(job, now);
            }
        }
        try (var ps = mustConn().prepareStatement("SELECT * FROM KAIROS_JOB WHERE SINGLE_KEY = ?")) {
            ps.setString(1, job.name());
            return first(ps).orElseThrow(() -> new IllegalStateException("upsert failed to load job: " + job.name()));
        }
    }

    /** An existing NEXT_RUN_AT is kept unless the new value lies in the future. */
    private int updateSingle(JobRecord job, Instant now) throws SQLException {
        boolean future = job.nextRunAt() != null && job.nextRunAt().isAfter(now);
        String nextRun = future ? "NEXT_RUN_AT = ?" : "NEXT_RUN_AT = COALESCE(NEXT_RUN_AT, ?)";
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB
               SET JOB_DATA = ?, PRIORITY = ?, REPEAT_INTERVAL = ?, REPEAT_TIMEZONE = ?,
                   START_DATE = ?, END_DATE = ?, DISABLED = ?, %s, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE SINGLE_KEY = ?
        """.formatted(nextRun))) {
            int i = 1;
            ps.setString(i++, json.write(job.data()));
            ps.setInt(i++, job.priority());
            ps.setString(i++, job.repeatInterval());
            ps.setString(i++, job.repeatTimezone());
            ps.setTimestamp(i++, ts(job.startDate()));
            ps.setTimestamp(i++, ts(job.endDate()));
            ps.setString(i++, yn(job.disabled()));
            ps.setTimestamp(i++, ts(job.nextRunAt()));
            ps.setString(i, job.name());
            return ps.executeUpdate();
        }
    }

    @Override
    public void save(JobRecord job) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB
               SET NAME             = ?,
                   JOB_DATA         = ?,
                   PRIORITY         = ?,
                   NEXT_RUN_AT      = ?,
                   LAST_RUN_AT      = ?,
                   LAST_FINISHED_AT = ?,
                   REPEAT_INTERVAL  = ?,
                   REPEAT_TIMEZONE  = ?,
                   START_DATE       = ?,
                   END_DATE         = ?,
                   DISABLED         = ?,
                   FAIL_COUNT       = ?,
                   FAIL_REASON      = ?,
                   FAILED_AT        = ?,
                   UPDATED_AT       = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, json.write(job.data()));
            ps.setInt(i++, job.priority());
            ps.setTimestamp(i++, ts(job.nextRunAt()));
            ps.setTimestamp(i++, ts(job.lastRunAt()));
            ps.setTimestamp(i++, ts(job.lastFinishedAt()));
            ps.setString(i++, job.repeatInterval());
            ps.setString(i++, job.repeatTimezone());
            ps.setTimestamp(i++, ts(job.startDate()));
            ps.setTimestamp(i++, ts(job.endDate()));
            ps.setString(i++, yn(job.disabled()));
            ps.setInt(i++, job.failCount());
            ps.setString(i++, clip(job.failReason(), FAIL_REASON_WIDTH));
            ps.setTimestamp(i++, ts(job.failedAt()));
            ps.setLong(i, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("KAIROS_JOB not found for ID=" + job.id());
            }
        }
    }

    @Override
    public boolean saveRunState(JobRecord job) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB
               SET NEXT_RUN_AT      = ?,
                   LAST_RUN_AT      = ?,
                   LAST_FINISHED_AT = ?,
                   FAIL_COUNT       = ?,
                   FAIL_REASON      = ?,
                   FAILED_AT        = ?,
                   UPDATED_AT       = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            int i = 1;
            ps.setTimestamp(i++, ts(job.nextRunAt()));
            ps.setTimestamp(i++, ts(job.lastRunAt()));
            ps.setTimestamp(i++, ts(job.lastFinishedAt()));
            ps.setInt(i++, job.failCount());
            ps.setString(i++, clip(job.failReason(), FAIL_REASON_WIDTH));
            ps.setTimestamp(i++, ts(job.failedAt()));
            ps.setLong(i, job.id());
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM KAIROS_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int deleteByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM KAIROS_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            return ps.executeUpdate();
        }
    }

    @Override
    public int deleteNotIn(Collection<String> names) throws Exception {
        if (names.isEmpty()) {
            try (var ps = mustConn().prepareStatement("DELETE FROM KAIROS_JOB")) {
                return ps.executeUpdate();
            }
        }
        String marks = String.join(", ", Collections.nCopies(names.size(), "?"));
        try (var ps = mustConn().prepareStatement("DELETE FROM KAIROS_JOB WHERE NAME NOT IN (" + marks + ")")) {
            int i = 1;
            for (String n : names) ps.setString(i++, n);
            return ps.executeUpdate();
        }
    }

    @Override
    public int setDisabled(String name, boolean disabled) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB SET DISABLED = ?, UPDATED_AT = CURRENT_TIMESTAMP WHERE NAME = ?
        """)) {
            ps.setString(1, yn(disabled));
            ps.setString(2, name);
            return ps.executeUpdate();
        }
    }

    // === maintenance ===

    @Override
    public int unlockExpired(Instant staleBefore) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE KAIROS_JOB
               SET LOCKED_AT = NULL, UPDATED_AT = CURRENT_TIMESTAMP
             WHERE LOCKED_AT IS NOT NULL AND LOCKED_AT < ?
        """)) {
            ps.setTimestamp(1, ts(staleBefore));
            return ps.executeUpdate();
        }
    }

    @Override
    public int deleteFinishedBefore(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM KAIROS_JOB
             WHERE LOCKED_AT IS NULL
               AND NEXT_RUN_AT IS NULL
               AND REPEAT_INTERVAL IS NULL
               AND LAST_FINISHED_AT < ?
        """)) {
            ps.setTimestamp(1, ts(threshold));
            return ps.executeUpdate();
        }
    }

    // === utils ===

    private Connection mustConn() {
        return TxContext.require();
    }

    private Optional<JobRecord> first(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJob(rs, json));
        }
    }

    private List<JobRecord> list(PreparedStatement ps) throws SQLException {
        List<JobRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs, json));
        }
        return out;
    }

    /** SQLState class 23 is integrity constraint violation. */
    private static boolean isDuplicateKey(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }
}
