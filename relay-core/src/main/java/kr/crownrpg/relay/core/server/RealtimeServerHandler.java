package kr.crownrpg.relay.core.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Per-channel bridge between the WebSocket pipeline and {@link RealtimeServer}. Not sharable: it remembers the id
 * assigned to its channel once the upgrade completes.
 */
class RealtimeServerHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeServerHandler.class);

    private final RealtimeServer server;
    private String connectionId;

    RealtimeServerHandler(RealtimeServer server) {
        this.server = Objects.requireNonNull(server, "server");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            String userAgent = handshake.requestHeaders().get(HttpHeaderNames.USER_AGENT);
            connectionId = server.accept(ctx.channel(), userAgent);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (connectionId == null) {
            LOGGER.warn("Dropping frame on channel {} before handshake completed", ctx.channel().id().asShortText());
            return;
        }
        if (frame instanceof TextWebSocketFrame text) {
            server.onText(ctx.channel(), connectionId, text.text());
        } else if (frame instanceof PongWebSocketFrame) {
            server.onPong(connectionId);
        } else if (frame instanceof BinaryWebSocketFrame) {
            server.onUnsupportedFrame(connectionId);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connectionId != null) {
            server.onClosed(connectionId);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Realtime server handler error on {}", connectionId, cause);
        if (connectionId != null) {
            server.onTransportError(connectionId, cause);
        }
        ctx.close();
    }
}
