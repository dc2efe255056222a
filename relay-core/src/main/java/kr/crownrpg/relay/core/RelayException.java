package kr.crownrpg.relay.core;

/**
 * Root of the realtime core's failure taxonomy. All subclasses are recovered locally and never cross connections.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
