package kr.crownrpg.relay.core.broadcast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.connection.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BroadcasterTest {

    private EnvelopeCodec codec;
    private ConnectionRegistry registry;
    private Broadcaster broadcaster;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec();
        registry = new ConnectionRegistry();
        broadcaster = new Broadcaster(registry, codec);
    }

    @Test
    void shouldDeliverEventOnlyToMatchingSubscribers() {
        RecordingTransport chat = register("a", List.of("chat.message"));
        RecordingTransport everything = register("b", List.of(MessageTypes.WILDCARD));
        RecordingTransport other = register("c", List.of("other.type"));

        ObjectNode data = codec.mapper().createObjectNode().put("content", "hi");
        int delivered = broadcaster.broadcastEvent("chat.message", data);

        assertEquals(2, delivered);
        assertEquals(1, chat.sent().size());
        assertEquals(1, everything.sent().size());
        assertTrue(other.sent().isEmpty());

        Envelope received = codec.decode(chat.sent().get(0));
        assertEquals(MessageTypes.EVENT, received.type());
        assertEquals("chat.message", received.data().get("eventType").asText());
        assertEquals("hi", received.data().get("data").get("content").asText());
    }

    @Test
    void shouldSendIdenticalBytesToEveryRecipient() {
        RecordingTransport first = register("a", List.of(MessageTypes.WILDCARD));
        RecordingTransport second = register("b", List.of(MessageTypes.WILDCARD));

        broadcaster.broadcast(Envelope.of("notice", null));

        assertEquals(first.sent(), second.sent());
    }

    @Test
    void shouldExcludeGivenConnectionAndIgnoreSubscriptions() {
        RecordingTransport sender = register("a", List.of(MessageTypes.WILDCARD));
        RecordingTransport narrow = register("b", List.of("other.type"));

        int delivered = broadcaster.broadcast(Envelope.of("notice", null), "a");

        assertEquals(1, delivered);
        assertTrue(sender.sent().isEmpty());
        assertEquals(1, narrow.sent().size());
    }

    @Test
    void shouldSkipClosedTransportsAndContinuePastFailures() {
        RecordingTransport closed = new RecordingTransport().closed();
        RecordingTransport failing = new RecordingTransport().failWrites();
        RecordingTransport healthy = new RecordingTransport();
        registry.add(new Connection("a", closed, Map.of()));
        registry.add(new Connection("b", failing, Map.of()));
        registry.add(new Connection("c", healthy, Map.of()));

        int delivered = broadcaster.broadcast(Envelope.of("notice", null));

        assertEquals(1, delivered);
        assertEquals(1, healthy.sent().size());
    }

    @Test
    void shouldSendToSingleIdentity() {
        RecordingTransport target = register("a", List.of("none"));
        register("b", List.of(MessageTypes.WILDCARD));

        assertTrue(broadcaster.sendToIdentity("a", Envelope.of("direct", null)));
        assertFalse(broadcaster.sendToIdentity("missing", Envelope.of("direct", null)));

        assertEquals(1, target.sent().size());
        assertEquals("direct", codec.decode(target.sent().get(0)).type());
    }

    @Test
    void shouldReturnZeroWhenNobodyIsConnected() {
        assertEquals(0, broadcaster.broadcastEvent("chat.message", null));
    }

    private RecordingTransport register(String id, List<String> subscriptions) {
        RecordingTransport transport = new RecordingTransport();
        Connection connection = new Connection(id, transport, Map.of());
        connection.replaceSubscriptions(subscriptions);
        registry.add(connection);
        return transport;
    }
}
