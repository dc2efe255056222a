package kr.crownrpg.relay.core.database;

import kr.crownrpg.relay.api.database.ConnectionProvider;
import kr.crownrpg.relay.api.database.DatabaseClient;
import kr.crownrpg.relay.api.database.DatabaseConfig;
import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.QueryExecutor;
import kr.crownrpg.relay.api.database.Transaction;
import kr.crownrpg.relay.core.internal.ThreadFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * DatabaseClient 구현체.
 *
 * - query(...) : 커넥션 1회 사용 후 반환 (auto-commit)
 * - transaction(...) : setAutoCommit(false) 스코프, 예외 또는 rollback() 호출 시 롤백
 *
 * 모든 작업은 전용 executor에서 실행되므로 Netty 이벤트 루프를 막지 않는다.
 */
public final class JdbcDatabaseClient implements DatabaseClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcDatabaseClient.class);

    private final ConnectionProvider provider;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private volatile boolean closed = false;

    public JdbcDatabaseClient(ConnectionProvider provider, Executor executor) {
        this(provider, executor, null);
    }

    private JdbcDatabaseClient(ConnectionProvider provider, Executor executor, ExecutorService ownedExecutor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * HikariCP 풀과 풀 크기만큼의 전용 스레드를 소유하는 클라이언트를 만든다. close() 시 둘 다 정리된다.
     */
    public static JdbcDatabaseClient create(DatabaseConfig config) {
        HikariConnectionProvider provider = HikariConnectionProvider.create(config);
        ExecutorService pool = ThreadFactories.fixed(config.maxPoolSize(), "relay-db");
        return new JdbcDatabaseClient(provider, pool, pool);
    }

    @Override
    public <T> CompletableFuture<T> query(Function<QueryExecutor, T> action) {
        ensureOpen();
        Objects.requireNonNull(action, "action");

        return CompletableFuture.supplyAsync(() -> {
            try (Connection c = provider.getConnection()) {
                return action.apply(new JdbcQueryExecutor(c));
            } catch (SQLException | RuntimeException e) {
                throw wrap(e, "Database query failed");
            }
        }, executor);
    }

    @Override
    public <T> CompletableFuture<T> transaction(Function<Transaction, T> action) {
        ensureOpen();
        Objects.requireNonNull(action, "action");

        return CompletableFuture.supplyAsync(() -> {
            try (Connection c = provider.getConnection()) {
                c.setAutoCommit(false);
                JdbcTransaction tx = new JdbcTransaction(c);
                try {
                    T result = action.apply(tx);
                    if (!tx.settle()) {
                        LOGGER.debug("트랜잭션 롤백 (statements={})", tx.statementCount());
                    }
                    return result;
                } catch (RuntimeException userEx) {
                    tx.abort(userEx);
                    throw userEx;
                } finally {
                    restoreAutoCommit(c);
                }
            } catch (SQLException | RuntimeException e) {
                throw wrap(e, "Database transaction failed");
            }
        }, executor);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            provider.close();
        } catch (RuntimeException e) {
            LOGGER.warn("커넥션 풀 종료 중 오류", e);
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("DatabaseClient is closed");
    }

    private static void restoreAutoCommit(Connection c) {
        try {
            c.setAutoCommit(true);
        } catch (SQLException e) {
            LOGGER.debug("auto-commit 복구 실패", e);
        }
    }

    private static DatabaseException wrap(Throwable t, String msg) {
        if (t instanceof DatabaseException de) return de;
        return new DatabaseException(msg, t);
    }
}
