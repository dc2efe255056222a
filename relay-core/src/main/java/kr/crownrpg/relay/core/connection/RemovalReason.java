package kr.crownrpg.relay.core.connection;

public enum RemovalReason {
    /** Peer closed the transport normally. */
    CLOSED,
    /** Socket-level failure; no reply is attempted. */
    TRANSPORT_ERROR,
    /** Two consecutive liveness probes went unacknowledged. */
    LIVENESS_TIMEOUT,
    /** Server shutdown. */
    SHUTDOWN
}
