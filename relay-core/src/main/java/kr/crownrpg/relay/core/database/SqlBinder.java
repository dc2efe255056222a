package kr.crownrpg.relay.core.database;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Positional parameter binding. Every timestamp column is {@code TIMESTAMP(3)}, so instants are cut to milliseconds
 * here rather than left to the driver's rounding.
 */
final class SqlBinder {

    private SqlBinder() {}

    static void bind(PreparedStatement ps, Object... params) throws SQLException {
        if (params == null) return;

        for (int i = 0; i < params.length; i++) {
            try {
                ps.setObject(i + 1, toJdbc(params[i]));
            } catch (SQLException e) {
                throw new SQLException("파라미터 바인딩 실패 (index=" + (i + 1) + ")", e.getSQLState(), e);
            }
        }
    }

    static Object toJdbc(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
        }
        return value;
    }
}
