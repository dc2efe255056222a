package kr.crownrpg.relay.core.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Built-in server handlers for {@code ping}, {@code subscribe} and {@code unsubscribe}.
 */
public final class ControlHandlers {

    public static final int PING_PRIORITY = 1000;
    public static final int SUBSCRIPTION_PRIORITY = 100;

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlHandlers.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;

    public ControlHandlers(ConnectionRegistry registry, EnvelopeCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    public void registerOn(HandlerTable handlers) {
        handlers.register(MessageTypes.PING, this::onPing, PING_PRIORITY);
        handlers.register(MessageTypes.SUBSCRIBE, this::onSubscribe, SUBSCRIPTION_PRIORITY);
        handlers.register(MessageTypes.UNSUBSCRIBE, this::onUnsubscribe, SUBSCRIPTION_PRIORITY);
    }

    void onPing(MessageContext context, Envelope envelope) {
        ObjectNode data = codec.mapper().createObjectNode();
        data.put("timestamp", Instant.now().toString());
        context.reply(codec.envelope(MessageTypes.PONG, data));
    }

    void onSubscribe(MessageContext context, Envelope envelope) throws Exception {
        List<String> eventTypes = eventTypes(envelope);
        Connection connection = registry.find(context.connectionId()).orElse(null);
        if (connection == null) {
            return;
        }
        connection.replaceSubscriptions(eventTypes);
        LOGGER.debug("Client {} subscribed to {}", connection.id(), eventTypes);
        context.reply(codec.envelope(MessageTypes.SUBSCRIBED, ack(eventTypes)));
    }

    void onUnsubscribe(MessageContext context, Envelope envelope) throws Exception {
        List<String> eventTypes = eventTypes(envelope);
        Connection connection = registry.find(context.connectionId()).orElse(null);
        if (connection == null) {
            return;
        }
        connection.removeSubscriptions(eventTypes);
        LOGGER.debug("Client {} unsubscribed from {}", connection.id(), eventTypes);
        context.reply(codec.envelope(MessageTypes.UNSUBSCRIBED, ack(eventTypes)));
    }

    private List<String> eventTypes(Envelope envelope) throws Exception {
        JsonNode data = envelope.data();
        if (data == null || !data.isObject() || !data.path("eventTypes").isArray()) {
            throw new IllegalArgumentException("Invalid " + envelope.type() + " payload: eventTypes must be an array");
        }
        SubscriptionRequest request = codec.mapper().treeToValue(data, SubscriptionRequest.class);
        return List.copyOf(request.eventTypes());
    }

    private ObjectNode ack(List<String> eventTypes) {
        ObjectMapper mapper = codec.mapper();
        ObjectNode data = mapper.createObjectNode();
        data.set("eventTypes", mapper.valueToTree(eventTypes));
        return data;
    }
}
