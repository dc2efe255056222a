package kr.crownrpg.relay.server.config;

import kr.crownrpg.relay.core.server.RealtimeServerSettings;

import java.time.Duration;
import java.util.Map;

import static kr.crownrpg.relay.server.config.ConfigValues.str;
import static kr.crownrpg.relay.server.config.ConfigValues.toInt;
import static kr.crownrpg.relay.server.config.ConfigValues.toLong;

public record ServerYamlConfig(String host, int port, String path, int maxFrameBytes, long heartbeatIntervalMs) {

    public static ServerYamlConfig fromMap(Map<String, Object> section) {
        String host = str(section.get("host"), RealtimeServerSettings.DEFAULT_HOST);
        int port = toInt(section.get("port"), RealtimeServerSettings.DEFAULT_PORT);
        String path = str(section.get("path"), RealtimeServerSettings.DEFAULT_PATH);
        int maxFrameBytes = toInt(section.get("max-frame-bytes"), RealtimeServerSettings.DEFAULT_MAX_FRAME_BYTES);
        long heartbeat = toLong(section.get("heartbeat-interval-ms"), 30_000L);
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("server.port 값이 범위를 벗어났습니다: " + port);
        }
        if (heartbeat <= 0) {
            throw new IllegalArgumentException("server.heartbeat-interval-ms 값은 0보다 커야 합니다.");
        }
        return new ServerYamlConfig(host, port, path, maxFrameBytes, heartbeat);
    }

    public RealtimeServerSettings toSettings() {
        return new RealtimeServerSettings(host, port, path, maxFrameBytes, Duration.ofMillis(heartbeatIntervalMs));
    }
}
