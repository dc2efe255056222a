package kr.crownrpg.relay.core.server;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import kr.crownrpg.relay.core.connection.ConnectionTransport;
import kr.crownrpg.relay.core.connection.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link ConnectionTransport} over an upgraded WebSocket channel. Writes are thread-safe; Netty hands them to the
 * channel's event loop.
 */
final class NettyConnectionTransport implements ConnectionTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyConnectionTransport.class);

    private final Channel channel;

    NettyConnectionTransport(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    Channel channel() {
        return channel;
    }

    @Override
    public void send(String text) {
        if (!channel.isActive()) {
            throw new TransportException("Channel is not active: " + channel.id().asShortText());
        }
        channel.writeAndFlush(new TextWebSocketFrame(text));
    }

    @Override
    public void ping() {
        if (!channel.isActive()) {
            throw new TransportException("Channel is not active: " + channel.id().asShortText());
        }
        channel.writeAndFlush(new PingWebSocketFrame());
    }

    @Override
    public void terminate() {
        try {
            channel.close();
        } catch (RuntimeException e) {
            LOGGER.debug("Ignoring failure while closing {}", channel, e);
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public String remoteAddress() {
        SocketAddress address = channel.remoteAddress();
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString() + ":" + inet.getPort();
        }
        return address == null ? "unknown" : address.toString();
    }
}
