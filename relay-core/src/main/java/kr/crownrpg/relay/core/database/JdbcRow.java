package kr.crownrpg.relay.core.database;

import kr.crownrpg.relay.api.database.Row;

import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Row copied out of a {@link ResultSet}. Labels are matched case-insensitively because drivers disagree on case
 * (H2 upper-cases unquoted identifiers, MySQL keeps them).
 */
final class JdbcRow implements Row {

    private final Map<String, Object> values;

    private JdbcRow(Map<String, Object> values) {
        this.values = values;
    }

    static JdbcRow from(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();

        Map<String, Object> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 1; i <= count; i++) {
            Object value = rs.getObject(i);
            // a Clob is only readable while the result set is open
            if (value instanceof Clob clob) {
                value = clob.getSubString(1, (int) clob.length());
            }
            map.put(md.getColumnLabel(i), value);
        }
        return new JdbcRow(map);
    }

    @Override
    public String getString(String column) {
        Object v = values.get(column);
        return v == null ? null : String.valueOf(v);
    }

    @Override
    public int getInt(String column) {
        Object v = values.get(column);
        if (v == null) return 0;
        if (v instanceof Number n) return n.intValue();
        return Integer.parseInt(String.valueOf(v));
    }

    @Override
    public long getLong(String column) {
        Object v = values.get(column);
        if (v == null) return 0L;
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(v));
    }

    @Override
    public boolean getBoolean(String column) {
        Object v = values.get(column);
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return Boolean.parseBoolean(String.valueOf(v));
    }

    @Override
    public Instant getInstant(String column) {
        Object v = values.get(column);
        if (v == null) return null;
        if (v instanceof Timestamp ts) return ts.toInstant();
        if (v instanceof Instant instant) return instant;
        if (v instanceof OffsetDateTime odt) return odt.toInstant();
        // SqlBinder writes instants through Timestamp, i.e. in the JVM zone
        if (v instanceof LocalDateTime ldt) return ldt.atZone(ZoneId.systemDefault()).toInstant();
        return Instant.parse(String.valueOf(v));
    }

    @Override
    public Optional<Object> get(String column) {
        return Optional.ofNullable(values.get(column));
    }
}
