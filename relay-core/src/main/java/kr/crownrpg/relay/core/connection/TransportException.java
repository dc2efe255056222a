package kr.crownrpg.relay.core.connection;

import kr.crownrpg.relay.core.RelayException;

/**
 * Socket-level failure on a connection. The connection is evicted; the peer is not notified.
 */
public class TransportException extends RelayException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
