package kr.crownrpg.relay.core.database;

import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.QueryExecutor;
import kr.crownrpg.relay.api.database.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs statements on one borrowed connection. Rows are copied out of the {@link ResultSet} before it closes.
 */
class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    protected final Connection connection;

    JdbcQueryExecutor(Connection connection) {
        this.connection = connection;
    }

    @Override
    public int executeUpdate(String sql, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            SqlBinder.bind(ps, params);
            int affected = ps.executeUpdate();
            LOGGER.debug("update affected={} sql={}", affected, sql);
            return affected;
        } catch (SQLException e) {
            throw new DatabaseException("Update failed [" + e.getSQLState() + "]: " + sql, e);
        }
    }

    @Override
    public List<Row> executeQuery(String sql, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            SqlBinder.bind(ps, params);
            List<Row> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(JdbcRow.from(rs));
                }
            }
            LOGGER.debug("query rows={} sql={}", rows.size(), sql);
            return rows;
        } catch (SQLException e) {
            throw new DatabaseException("Query failed [" + e.getSQLState() + "]: " + sql, e);
        }
    }
}
