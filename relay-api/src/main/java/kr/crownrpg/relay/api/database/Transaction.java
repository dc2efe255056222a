package kr.crownrpg.relay.api.database;

/**
 * Query executor bound to a single transaction scope.
 * <p>
 * Calling {@link #rollback()} marks the scope rollback-only; the client then rolls back instead of committing.
 */
public interface Transaction extends QueryExecutor {

    void commit();

    void rollback();
}
