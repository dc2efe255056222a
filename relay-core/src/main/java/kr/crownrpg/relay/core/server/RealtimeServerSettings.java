package kr.crownrpg.relay.core.server;

import kr.crownrpg.relay.api.Preconditions;

import java.time.Duration;
import java.util.Objects;

/**
 * 실시간 서버 바인딩/프레이밍/하트비트 옵션.
 */
public final class RealtimeServerSettings {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 3001;
    public static final String DEFAULT_PATH = "/ws";
    public static final int DEFAULT_MAX_FRAME_BYTES = 65_536;

    private final String host;
    private final int port;
    private final String path;
    private final int maxFrameBytes;
    private final Duration heartbeatInterval;

    public RealtimeServerSettings(String host, int port, String path, int maxFrameBytes, Duration heartbeatInterval) {
        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host;
        Preconditions.checkArgument(port >= 0 && port <= 65_535, "port out of range: " + port);
        this.port = port;
        String normalizedPath = path == null || path.isBlank() ? DEFAULT_PATH : path;
        this.path = normalizedPath.startsWith("/") ? normalizedPath : "/" + normalizedPath;
        this.maxFrameBytes = Math.max(1024, maxFrameBytes);
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Preconditions.checkArgument(!heartbeatInterval.isNegative() && !heartbeatInterval.isZero(),
                "heartbeatInterval must be positive");
        this.heartbeatInterval = heartbeatInterval;
    }

    public static RealtimeServerSettings defaults() {
        return new RealtimeServerSettings(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_PATH, DEFAULT_MAX_FRAME_BYTES,
                Duration.ofSeconds(30));
    }

    public RealtimeServerSettings withPort(int newPort) {
        return new RealtimeServerSettings(host, newPort, path, maxFrameBytes, heartbeatInterval);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String path() {
        return path;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    @Override
    public String toString() {
        return "RealtimeServerSettings{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", path='" + path + '\'' +
                ", maxFrameBytes=" + maxFrameBytes +
                ", heartbeatInterval=" + heartbeatInterval +
                '}';
    }
}
