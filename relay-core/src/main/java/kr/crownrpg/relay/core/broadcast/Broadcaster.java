package kr.crownrpg.relay.core.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Fan-out of outbound envelopes over the registry.
 * <p>
 * Each call encodes once and attempts delivery exactly once to every live connection of the registry snapshot taken
 * at call time. A failed write is logged and does not stop delivery to the others.
 */
public final class Broadcaster {

    private static final Logger LOGGER = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;

    public Broadcaster(ConnectionRegistry registry, EnvelopeCodec codec) {
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.codec = Preconditions.checkNotNull(codec, "codec");
    }

    public int broadcast(Envelope envelope) {
        return broadcast(envelope, null);
    }

    /**
     * Unfiltered fan-out to every live connection except {@code excludeId}.
     *
     * @return number of connections written to
     */
    public int broadcast(Envelope envelope, String excludeId) {
        return deliver(envelope, SubscriptionFilter.everyoneExcept(excludeId));
    }

    /**
     * Wraps {@code data} as {@code {eventType, data}} in an {@code event} envelope and sends it to subscribers of
     * {@code eventType}.
     */
    public int broadcastEvent(String eventType, JsonNode data) {
        Preconditions.checkNotBlank(eventType, "eventType");
        ObjectNode wrapped = codec.mapper().createObjectNode();
        wrapped.put("eventType", eventType);
        if (data != null) {
            wrapped.set("data", data);
        }
        return broadcastEvent(eventType, wrapped, Instant.now().toString());
    }

    /**
     * Sends an already wrapped {@code event} payload to subscribers of {@code eventType}.
     */
    public int broadcastEvent(String eventType, ObjectNode wrapped, String timestamp) {
        Envelope envelope = new Envelope(MessageTypes.EVENT, wrapped, timestamp, codec.generateId());
        int delivered = deliver(envelope, SubscriptionFilter.subscribedTo(eventType));
        LOGGER.debug("Broadcasted event {} to {} client(s)", eventType, delivered);
        return delivered;
    }

    /**
     * @return whether the target was registered and its transport open
     */
    public boolean sendToIdentity(String id, Envelope envelope) {
        Connection connection = registry.find(id).orElse(null);
        if (connection == null || !connection.transport().isOpen()) {
            LOGGER.debug("Cannot send {} to {}: not connected", envelope.type(), id);
            return false;
        }
        return write(connection, codec.encodeToString(envelope));
    }

    private int deliver(Envelope envelope, Predicate<Connection> filter) {
        Preconditions.checkNotNull(envelope, "envelope");
        String text = codec.encodeToString(envelope);
        AtomicInteger delivered = new AtomicInteger();
        registry.forEach(connection -> {
            if (connection.transport().isOpen() && filter.test(connection) && write(connection, text)) {
                delivered.incrementAndGet();
            }
        });
        return delivered.get();
    }

    private boolean write(Connection connection, String text) {
        try {
            connection.send(text);
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to deliver message to {}", connection.id(), e);
            return false;
        }
    }
}
