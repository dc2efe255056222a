package kr.crownrpg.relay.core.server;

import io.netty.channel.Channel;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.TransportException;
import kr.crownrpg.relay.core.routing.HandlerInvocationException;
import kr.crownrpg.relay.core.routing.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * Server-side view of one inbound message. Replies and handler errors go back over the originating connection.
 */
final class ServerMessageContext implements MessageContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerMessageContext.class);

    private final Connection connection;
    private final EnvelopeCodec codec;
    private final Executor executor;

    ServerMessageContext(Connection connection, EnvelopeCodec codec, Executor executor) {
        this.connection = connection;
        this.codec = codec;
        this.executor = executor;
    }

    static ServerMessageContext forChannel(Connection connection, EnvelopeCodec codec, Channel channel) {
        return new ServerMessageContext(connection, codec, channel.eventLoop());
    }

    @Override
    public String connectionId() {
        return connection.id();
    }

    @Override
    public void reply(Envelope envelope) {
        try {
            connection.send(codec.encodeToString(envelope));
        } catch (TransportException e) {
            LOGGER.debug("Dropping {} reply to closed connection {}", envelope.type(), connection.id());
        }
    }

    @Override
    public void onHandlerFailure(Envelope error, HandlerInvocationException failure) {
        reply(error);
    }

    @Override
    public Executor executor() {
        return executor;
    }
}
