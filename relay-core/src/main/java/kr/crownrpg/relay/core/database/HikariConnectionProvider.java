package kr.crownrpg.relay.core.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kr.crownrpg.relay.api.database.ConnectionProvider;
import kr.crownrpg.relay.api.database.DatabaseConfig;
import kr.crownrpg.relay.api.database.DatabaseException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * HikariCP 기반 ConnectionProvider 구현체.
 * <p>
 * JDBC URL은 그대로 사용하므로 MySQL과 H2 모두 같은 경로로 붙는다. MySQL일 때만 prepared statement 캐시 옵션을 켠다.
 */
public final class HikariConnectionProvider implements ConnectionProvider {

    private static final String POOL_NAME = "Relay-Hikari";

    private final HikariDataSource dataSource;

    private HikariConnectionProvider(HikariDataSource ds) {
        this.dataSource = ds;
    }

    public static HikariConnectionProvider create(DatabaseConfig config) {
        Objects.requireNonNull(config, "config");

        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(config.jdbcUrl());
        hc.setUsername(config.username());
        hc.setPassword(config.password());
        hc.setMaximumPoolSize(config.maxPoolSize());
        hc.setMinimumIdle(config.minIdle());
        hc.setConnectionTimeout(config.connectionTimeoutMillis());

        if (config.jdbcUrl().startsWith("jdbc:mysql:")) {
            hc.addDataSourceProperty("cachePrepStmts", "true");
            hc.addDataSourceProperty("prepStmtCacheSize", "250");
            hc.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
            hc.addDataSourceProperty("useServerPrepStmts", "true");
        }
        hc.setPoolName(POOL_NAME);

        try {
            return new HikariConnectionProvider(new HikariDataSource(hc));
        } catch (RuntimeException e) {
            throw new DatabaseException("Failed to initialize connection pool for " + config.jdbcUrl(), e);
        }
    }

    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void close() {
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            throw new DatabaseException("Failed to close HikariDataSource", e);
        }
    }
}
