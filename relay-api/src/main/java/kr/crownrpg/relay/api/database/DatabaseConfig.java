package kr.crownrpg.relay.api.database;

import kr.crownrpg.relay.api.Preconditions;

/**
 * Immutable connection pool settings.
 */
public record DatabaseConfig(
        String jdbcUrl,
        String username,
        String password,
        int maxPoolSize,
        int minIdle,
        long connectionTimeoutMillis
) {

    public DatabaseConfig {
        Preconditions.checkNotBlank(jdbcUrl, "jdbcUrl");
        username = username == null ? "" : username;
        password = password == null ? "" : password;
        maxPoolSize = Math.max(1, maxPoolSize);
        minIdle = Math.max(0, Math.min(minIdle, maxPoolSize));
        connectionTimeoutMillis = Math.max(250L, connectionTimeoutMillis);
    }

    public static DatabaseConfig of(String jdbcUrl, String username, String password) {
        return new DatabaseConfig(jdbcUrl, username, password, 10, 2, 3000L);
    }

    @Override
    public String toString() {
        return "DatabaseConfig{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                ", password='" + (password.isEmpty() ? "" : "****") + '\'' +
                ", maxPoolSize=" + maxPoolSize +
                ", minIdle=" + minIdle +
                ", connectionTimeoutMillis=" + connectionTimeoutMillis +
                '}';
    }
}
