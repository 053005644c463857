package net.kairos.adapter.jdbc.mapper;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.adapter.jdbc.JsonData;
import net.kairos.core.model.JobRecord;
import net.kairos.core.model.JobType;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- JobRecord ---
    public static JobRecord toJob(ResultSet rs, JsonData json) throws SQLException {
        return new JobRecord(
                rs.getLong("ID"),
                rs.getString("NAME"),
                json.read(rs.getString("JOB_DATA")),
                rs.getInt("PRIORITY"),
                JobType.from(rs.getString("JOB_TYPE")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_FINISHED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LOCKED_AT")),
                rs.getString("LAST_MODIFIED_BY"),
                rs.getString("REPEAT_INTERVAL"),
                rs.getString("REPEAT_TIMEZONE"),
                JdbcUtil.toInstant(rs.getTimestamp("START_DATE")),
                JdbcUtil.toInstant(rs.getTimestamp("END_DATE")),
                "Y".equals(rs.getString("DISABLED")),
                rs.getInt("FAIL_COUNT"),
                rs.getString("FAIL_REASON"),
                JdbcUtil.toInstant(rs.getTimestamp("FAILED_AT"))
        );
    }
}
