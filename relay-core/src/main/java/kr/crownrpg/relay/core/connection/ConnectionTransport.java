package kr.crownrpg.relay.core.connection;

/**
 * Transport handle owned by a {@link Connection}. Implementations wrap a socket; tests use in-memory fakes.
 */
public interface ConnectionTransport {

    /**
     * Queues one text frame. Asynchronous write failures surface through the transport's own close/error path.
     *
     * @throws TransportException when the transport is already closed
     */
    void send(String text);

    /**
     * Sends a transport-level liveness probe.
     */
    void ping();

    /**
     * Closes the transport immediately. Must not throw, even when the socket is already broken.
     */
    void terminate();

    boolean isOpen();

    String remoteAddress();
}
