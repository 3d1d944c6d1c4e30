package net.batchq.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static void setTs(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP); else ps.setTimestamp(idx, ts(i));
    }

    public static void setStr(PreparedStatement ps, int idx, String s) throws SQLException {
        if (s == null) ps.setNull(idx, Types.VARCHAR); else ps.setString(idx, s);
    }
}
