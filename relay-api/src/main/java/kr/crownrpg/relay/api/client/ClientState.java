package kr.crownrpg.relay.api.client;

/**
 * 재연결 클라이언트 상태 머신.
 * <p>
 * DISCONNECTED → CONNECTING → CONNECTED → (DISCONNECTED | ERROR) → CONNECTING ...
 */
public enum ClientState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
