package kr.crownrpg.relay.api.database;

import java.util.List;
import java.util.Optional;

public interface QueryExecutor {

    int executeUpdate(String sql, Object... params);

    List<Row> executeQuery(String sql, Object... params);

    default Optional<Row> executeQueryOne(String sql, Object... params) {
        List<Row> rows = executeQuery(sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
