package kr.crownrpg.relay.core.database;

import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.Row;
import kr.crownrpg.relay.api.database.Transaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * One {@code setAutoCommit(false)} scope. The scope is settled exactly once, either by an explicit {@link #commit()}
 * inside the action or by {@link JdbcDatabaseClient} when the action returns or throws; statements issued after that
 * are refused.
 */
final class JdbcTransaction extends JdbcQueryExecutor implements Transaction {

    private boolean rollbackOnly;
    private boolean settled;
    private int statements;

    JdbcTransaction(Connection connection) {
        super(connection);
    }

    @Override
    public int executeUpdate(String sql, Object... params) {
        ensureActive();
        statements++;
        return super.executeUpdate(sql, params);
    }

    @Override
    public List<Row> executeQuery(String sql, Object... params) {
        ensureActive();
        statements++;
        return super.executeQuery(sql, params);
    }

    /**
     * Commits now, or rolls back when the scope was already marked rollback-only.
     */
    @Override
    public void commit() {
        settle();
    }

    /**
     * Marks the scope rollback-only. Later statements still run; the scope rolls back when it settles.
     */
    @Override
    public void rollback() {
        rollbackOnly = true;
    }

    boolean isRollbackOnly() {
        return rollbackOnly;
    }

    int statementCount() {
        return statements;
    }

    /**
     * @return {@code true} when the work was committed
     */
    boolean settle() {
        if (settled) {
            return !rollbackOnly;
        }
        settled = true;
        try {
            if (rollbackOnly) {
                connection.rollback();
                return false;
            }
            connection.commit();
            return true;
        } catch (SQLException e) {
            throw new DatabaseException(rollbackOnly ? "Rollback failed" : "Commit failed", e);
        }
    }

    /**
     * Rolls back after the action failed. A rollback failure is attached to {@code cause} instead of replacing it.
     */
    void abort(RuntimeException cause) {
        if (settled) {
            return;
        }
        settled = true;
        rollbackOnly = true;
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void ensureActive() {
        if (settled) {
            throw new IllegalStateException("Transaction already completed");
        }
    }
}
