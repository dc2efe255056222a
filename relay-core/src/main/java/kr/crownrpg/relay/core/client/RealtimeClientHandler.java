package kr.crownrpg.relay.core.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import kr.crownrpg.relay.core.connection.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Pipeline end of one client connection attempt. Every callback carries the attempt's session number so the client
 * can ignore events from an attempt it has already given up on.
 */
class RealtimeClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeClientHandler.class);

    private final ReconnectingClient client;
    private final long session;

    RealtimeClientHandler(ReconnectingClient client, long session) {
        this.client = Objects.requireNonNull(client, "client");
        this.session = session;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            client.onOpen(session, ctx.channel());
            return;
        }
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            client.onTransportError(session, new TransportException("WebSocket handshake timed out"));
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame text) {
            client.onText(session, ctx.channel(), text.text());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        client.onTransportClosed(session);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Realtime client handler error", cause);
        client.onTransportError(session, cause);
        ctx.close();
    }
}
