package kr.crownrpg.relay.core.client;

import kr.crownrpg.relay.api.Preconditions;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 클라이언트 재연결/하트비트 정책.
 */
public final class ClientSettings {

    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofMillis(3000);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(30_000);
    public static final int DEFAULT_MAX_FRAME_BYTES = 65_536;

    private final URI url;
    private final boolean reconnectEnabled;
    private final Duration reconnectInterval;
    private final int maxReconnectAttempts;
    private final boolean heartbeatEnabled;
    private final Duration heartbeatInterval;
    private final int maxFrameBytes;

    public ClientSettings(URI url,
                          boolean reconnectEnabled,
                          Duration reconnectInterval,
                          int maxReconnectAttempts,
                          boolean heartbeatEnabled,
                          Duration heartbeatInterval,
                          int maxFrameBytes) {
        this.url = Objects.requireNonNull(url, "url");
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        Preconditions.checkArgument(scheme.equals("ws") || scheme.equals("wss"), "url must use ws or wss: " + url);
        Preconditions.checkArgument(url.getHost() != null, "url has no host: " + url);
        this.reconnectEnabled = reconnectEnabled;
        this.reconnectInterval = positive(reconnectInterval, "reconnectInterval");
        this.maxReconnectAttempts = Math.max(0, maxReconnectAttempts);
        this.heartbeatEnabled = heartbeatEnabled;
        this.heartbeatInterval = positive(heartbeatInterval, "heartbeatInterval");
        this.maxFrameBytes = Math.max(1024, maxFrameBytes);
    }

    public static ClientSettings defaults(URI url) {
        return new ClientSettings(url, true, DEFAULT_RECONNECT_INTERVAL, DEFAULT_MAX_RECONNECT_ATTEMPTS,
                true, DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_MAX_FRAME_BYTES);
    }

    public ClientSettings withReconnect(boolean enabled, Duration interval, int maxAttempts) {
        return new ClientSettings(url, enabled, interval, maxAttempts, heartbeatEnabled, heartbeatInterval, maxFrameBytes);
    }

    public ClientSettings withHeartbeat(boolean enabled, Duration interval) {
        return new ClientSettings(url, reconnectEnabled, reconnectInterval, maxReconnectAttempts, enabled, interval, maxFrameBytes);
    }

    public URI url() {
        return url;
    }

    public boolean secure() {
        return "wss".equalsIgnoreCase(url.getScheme());
    }

    public String host() {
        return url.getHost();
    }

    public int port() {
        if (url.getPort() != -1) {
            return url.getPort();
        }
        return secure() ? 443 : 80;
    }

    public boolean reconnectEnabled() {
        return reconnectEnabled;
    }

    public Duration reconnectInterval() {
        return reconnectInterval;
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public boolean heartbeatEnabled() {
        return heartbeatEnabled;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        Preconditions.checkArgument(!value.isNegative() && !value.isZero(), name + " must be positive");
        return value;
    }
}
