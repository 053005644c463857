package net.kairos.adapter.jdbc;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    /** Cuts text to a column width. */
    public static String clip(String s, int max) { return s == null || s.length() <= max ? s : s.substring(0, max); }
}
