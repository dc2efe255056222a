package kr.crownrpg.relay.core.server;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.ErrorCodes;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.event.ConnectionEvents;
import kr.crownrpg.relay.core.event.InMemoryEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the server callbacks over an {@link EmbeddedChannel}; no socket is bound.
 */
class RealtimeServerTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private InMemoryEventBus events;
    private RealtimeServer server;
    private List<EventPayload> lifecycle;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventBus();
        lifecycle = new ArrayList<>();
        events.subscribeAll(lifecycle::add);
        server = new RealtimeServer(
                new RealtimeServerSettings("127.0.0.1", 0, "/ws", 65_536, Duration.ofSeconds(30)), events);
    }

    @Test
    void shouldGreetAcceptedConnectionWithItsId() {
        EmbeddedChannel channel = new EmbeddedChannel();

        String id = server.accept(channel, "junit");

        Envelope greeting = readEnvelope(channel);
        assertEquals(MessageTypes.CONNECTION, greeting.type());
        assertEquals(id, greeting.data().get("clientId").asText());
        assertEquals(RealtimeServer.GREETING, greeting.data().get("message").asText());
        assertEquals(1, server.connectedClients().size());
        assertEquals("junit", server.connectedClients().get(0).metadata().get(Connection.META_USER_AGENT));

        assertEquals(ConnectionEvents.CLIENT_CONNECTED, lifecycle.get(0).type());
        assertEquals(ConnectionEvents.SOURCE, lifecycle.get(0).source());
        assertEquals(id, lifecycle.get(0).data().get("clientId").asText());
    }

    @Test
    void shouldReplyWithProcessingErrorForMalformedFrame() {
        EmbeddedChannel channel = new EmbeddedChannel();
        String id = server.accept(channel, null);
        readEnvelope(channel);

        server.onText(channel, id, "{\"data\":1}");

        Envelope error = readEnvelope(channel);
        assertEquals(MessageTypes.ERROR, error.type());
        assertEquals("Message processing error", error.data().get("message").asText());
        assertEquals(ErrorCodes.MESSAGE_PROCESSING_ERROR, error.data().get("code").asText());
        assertTrue(server.registry().find(id).isPresent());
    }

    @Test
    void shouldRouteControlMessages() {
        EmbeddedChannel channel = new EmbeddedChannel();
        String id = server.accept(channel, null);
        readEnvelope(channel);

        server.onText(channel, id, "{\"type\":\"ping\"}");
        assertEquals(MessageTypes.PONG, readEnvelope(channel).type());

        server.onText(channel, id, "{\"type\":\"subscribe\",\"data\":{\"eventTypes\":[\"chat.message\"]}}");
        assertEquals(MessageTypes.SUBSCRIBED, readEnvelope(channel).type());
        assertFalse(server.registry().find(id).orElseThrow().isSubscribedTo("other.type"));
    }

    @Test
    void shouldReportHandlerFailureToSenderOnly() {
        EmbeddedChannel sender = new EmbeddedChannel();
        EmbeddedChannel bystander = new EmbeddedChannel();
        String senderId = server.accept(sender, null);
        server.accept(bystander, null);
        readEnvelope(sender);
        readEnvelope(bystander);
        server.handlers().register("game.move", (ctx, env) -> {
            throw new IllegalStateException("illegal move");
        });

        server.onText(sender, senderId, "{\"type\":\"game.move\"}");

        Envelope error = readEnvelope(sender);
        assertEquals(ErrorCodes.HANDLER_ERROR, error.data().get("code").asText());
        assertEquals("illegal move", error.data().get("details").asText());
        assertNull(bystander.readOutbound());
    }

    @Test
    void shouldRejectBinaryFramesAndRecordPongs() {
        EmbeddedChannel channel = new EmbeddedChannel();
        String id = server.accept(channel, null);
        readEnvelope(channel);
        Connection connection = server.registry().find(id).orElseThrow();
        connection.clearAlive();

        server.onPong(id);
        server.onUnsupportedFrame(id);

        assertTrue(connection.isAlive());
        assertEquals(ErrorCodes.UNSUPPORTED_FRAME, readEnvelope(channel).data().get("code").asText());
    }

    @Test
    void shouldProbeWithWebSocketPing() {
        EmbeddedChannel channel = new EmbeddedChannel();
        server.accept(channel, null);
        readEnvelope(channel);

        server.heartbeat().sweep();

        Object frame = channel.readOutbound();
        assertInstanceOf(PingWebSocketFrame.class, frame);
        ((PingWebSocketFrame) frame).release();
    }

    @Test
    void shouldEmitDisconnectAndErrorEvents() {
        EmbeddedChannel closed = new EmbeddedChannel();
        EmbeddedChannel broken = new EmbeddedChannel();
        String closedId = server.accept(closed, null);
        String brokenId = server.accept(broken, null);
        lifecycle.clear();

        server.onClosed(closedId);
        server.onTransportError(brokenId, new IllegalStateException("reset by peer"));
        server.onTransportError(brokenId, new IllegalStateException("reported twice"));

        assertEquals(List.of(ConnectionEvents.CLIENT_DISCONNECTED, ConnectionEvents.CLIENT_ERROR,
                ConnectionEvents.CLIENT_DISCONNECTED), lifecycle.stream().map(EventPayload::type).toList());
        assertEquals("closed", lifecycle.get(0).data().get("reason").asText());
        assertEquals("reset by peer", lifecycle.get(1).data().get("error").asText());
        assertEquals("transport_error", lifecycle.get(2).data().get("reason").asText());
        assertTrue(server.connectedClients().isEmpty());
    }

    @Test
    void shouldNormalizeSettings() {
        RealtimeServerSettings settings = new RealtimeServerSettings(" ", 8080, "relay", 10, Duration.ofSeconds(5));

        assertEquals(RealtimeServerSettings.DEFAULT_HOST, settings.host());
        assertEquals("/relay", settings.path());
        assertEquals(1024, settings.maxFrameBytes());
        assertThrows(IllegalArgumentException.class, () -> settings.withPort(70_000));
    }

    private Envelope readEnvelope(EmbeddedChannel channel) {
        TextWebSocketFrame frame = channel.readOutbound();
        assertNotNull(frame, "expected an outbound frame");
        try {
            return codec.decode(frame.text());
        } finally {
            frame.release();
        }
    }
}
