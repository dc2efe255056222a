package kr.crownrpg.relay.core.event;

/**
 * Bus event types the realtime server emits for connection lifecycle changes, all with source {@value #SOURCE}.
 */
public final class ConnectionEvents {

    public static final String SOURCE = "websocket";

    public static final String CLIENT_CONNECTED = "websocket.client.connected";
    public static final String CLIENT_DISCONNECTED = "websocket.client.disconnected";
    public static final String CLIENT_ERROR = "websocket.client.error";

    private ConnectionEvents() {
    }

    public static boolean isConnectionEvent(String type) {
        return CLIENT_CONNECTED.equals(type) || CLIENT_DISCONNECTED.equals(type) || CLIENT_ERROR.equals(type);
    }
}
