package kr.crownrpg.relay.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.broadcast.Broadcaster;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.connection.RecordingTransport;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventBridgeTest {

    private EnvelopeCodec codec;
    private InMemoryEventBus bus;
    private RecordingTransport transport;
    private Broadcaster broadcaster;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec();
        bus = new InMemoryEventBus();
        ConnectionRegistry registry = new ConnectionRegistry();
        transport = new RecordingTransport();
        registry.add(new Connection("c1", transport, Map.of()));
        broadcaster = new Broadcaster(registry, codec);
    }

    @Test
    void shouldForwardBusEventsWhileRunning() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper());
        bridge.start();

        EventPayload emitted = bus.emit("user.joined", codec.mapper().createObjectNode().put("name", "steve"),
                "backend", Map.of("room", "lobby"));

        assertEquals(1, transport.sent().size());
        Envelope envelope = codec.decode(transport.sent().get(0));
        JsonNode data = envelope.data();
        assertEquals(MessageTypes.EVENT, envelope.type());
        assertEquals("user.joined", data.get("eventType").asText());
        assertEquals("steve", data.get("data").get("name").asText());
        assertEquals("backend", data.get("source").asText());
        assertEquals(emitted.id(), data.get("eventId").asText());
        assertEquals(emitted.timestamp().toString(), data.get("timestamp").asText());
        assertEquals("lobby", data.get("metadata").get("room").asText());

        bridge.stop();
        bus.emit("user.joined", null, "backend");
        assertEquals(1, transport.sent().size());
        assertFalse(bridge.isRunning());
    }

    @Test
    void shouldOmitMetadataWhenAbsent() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper());

        ObjectNode wrapped = bridge.wrap(EventPayload.create("t", null, "backend", null));

        assertFalse(wrapped.has("metadata"));
        assertFalse(wrapped.has("data"));
    }

    @Test
    void shouldFilterForwardedTypes() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper(), Set.of("chat.message"), false);

        assertTrue(bridge.shouldForward("chat.message"));
        assertFalse(bridge.shouldForward("user.joined"));
        assertFalse(bridge.shouldForward(ConnectionEvents.CLIENT_CONNECTED));
    }

    @Test
    void shouldHoldBackConnectionEventsUnlessEnabled() {
        EventBridge quiet = new EventBridge(bus, broadcaster, codec.mapper());
        EventBridge chatty = new EventBridge(bus, broadcaster, codec.mapper(), Set.of(), true);

        assertFalse(quiet.shouldForward(ConnectionEvents.CLIENT_DISCONNECTED));
        assertTrue(quiet.shouldForward("anything.else"));
        assertTrue(chatty.shouldForward(ConnectionEvents.CLIENT_DISCONNECTED));
    }

    @Test
    void shouldEmitClientEventWithClientSource() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper());
        List<EventPayload> seen = new ArrayList<>();
        bus.subscribe("game.score", seen::add);
        ObjectNode data = codec.mapper().createObjectNode();
        data.put("eventType", "game.score");
        data.putObject("data").put("points", 10);
        data.putObject("metadata").put("level", 3);

        bridge.onClientEvent(context("c9"), Envelope.of(MessageTypes.EVENT, data));

        assertEquals(1, seen.size());
        EventPayload event = seen.get(0);
        assertEquals("client:c9", event.source());
        assertEquals(10, event.data().get("points").asInt());
        assertEquals(3, event.metadata().get("level"));
    }

    @Test
    void shouldRejectClientEventWithoutType() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper());
        ObjectNode data = codec.mapper().createObjectNode().put("eventType", 5);

        assertThrows(IllegalArgumentException.class,
                () -> bridge.onClientEvent(context("c9"), Envelope.of(MessageTypes.EVENT, data)));
        assertThrows(IllegalArgumentException.class,
                () -> bridge.onClientEvent(context("c9"), Envelope.of(MessageTypes.EVENT, null)));
    }

    @Test
    void shouldRegisterInboundHandlerAtItsPriority() {
        EventBridge bridge = new EventBridge(bus, broadcaster, codec.mapper());
        HandlerTable table = new HandlerTable();

        bridge.registerInbound(table);

        assertEquals(EventBridge.INBOUND_PRIORITY, table.chain(MessageTypes.EVENT).get(0).priority());
    }

    private static MessageContext context(String id) {
        MessageContext context = mock(MessageContext.class);
        when(context.connectionId()).thenReturn(id);
        return context;
    }
}
