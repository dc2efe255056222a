package kr.crownrpg.relay.server.config;

import kr.crownrpg.relay.api.database.DatabaseConfig;

import java.util.Map;

import static kr.crownrpg.relay.server.config.ConfigValues.bool;
import static kr.crownrpg.relay.server.config.ConfigValues.toInt;
import static kr.crownrpg.relay.server.config.ConfigValues.toLong;
import static kr.crownrpg.relay.server.config.ConfigValues.trimToEmpty;

public record DatabaseYamlConfig(boolean enabled,
                                 String jdbcUrl,
                                 String username,
                                 String password,
                                 int maxPoolSize,
                                 int minIdle,
                                 long connectionTimeoutMs) {

    public static DatabaseYamlConfig fromMap(Map<String, Object> section) {
        boolean enabled = bool(section.get("enabled"), false);
        String jdbcUrl = trimToEmpty(section.get("jdbc-url"));
        String username = trimToEmpty(section.get("username"));
        String password = section.get("password") == null ? "" : section.get("password").toString();
        int maxPoolSize = toInt(section.get("max-pool-size"), 10);
        int minIdle = toInt(section.get("min-idle"), 2);
        long connectionTimeout = toLong(section.get("connection-timeout-ms"), 3000L);
        if (enabled && jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("database.jdbc-url 값이 비어 있습니다.");
        }
        return new DatabaseYamlConfig(enabled, jdbcUrl, username, password, maxPoolSize, minIdle, connectionTimeout);
    }

    public DatabaseConfig toDatabaseConfig() {
        return new DatabaseConfig(jdbcUrl, username, password, maxPoolSize, minIdle, connectionTimeoutMs);
    }
}
