package kr.crownrpg.relay.core.event;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.event.EventBus;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.api.event.EventSubscription;
import kr.crownrpg.relay.api.lifecycle.ManagedLifecycle;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.broadcast.Broadcaster;
import kr.crownrpg.relay.core.routing.HandlerRegistration;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Two-way seam between the {@link EventBus} and connected clients.
 * <p>
 * Outbound, every bus event of a forwarded type is sent to its subscribers as
 * {@code {eventType, data, source, eventId, timestamp, metadata?}}. Inbound, an {@code event} message
 * {@code {eventType, data, metadata?}} is emitted onto the bus with source {@code client:<connectionId>}.
 */
public final class EventBridge implements ManagedLifecycle {

    public static final int INBOUND_PRIORITY = 100;
    public static final String CLIENT_SOURCE_PREFIX = "client:";

    private static final Logger LOGGER = LoggerFactory.getLogger(EventBridge.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final EventBus bus;
    private final Broadcaster broadcaster;
    private final ObjectMapper mapper;
    private final Set<String> forwardedTypes;
    private final boolean forwardConnectionEvents;

    private EventSubscription subscription;

    public EventBridge(EventBus bus, Broadcaster broadcaster, ObjectMapper mapper) {
        this(bus, broadcaster, mapper, Set.of(), false);
    }

    /**
     * @param forwardedTypes          types sent to clients; empty forwards every type
     * @param forwardConnectionEvents whether {@link ConnectionEvents} types are sent to clients as well
     */
    public EventBridge(EventBus bus,
                       Broadcaster broadcaster,
                       ObjectMapper mapper,
                       Set<String> forwardedTypes,
                       boolean forwardConnectionEvents) {
        this.bus = Preconditions.checkNotNull(bus, "bus");
        this.broadcaster = Preconditions.checkNotNull(broadcaster, "broadcaster");
        this.mapper = Preconditions.checkNotNull(mapper, "mapper");
        this.forwardedTypes = Set.copyOf(Preconditions.checkNotNull(forwardedTypes, "forwardedTypes"));
        this.forwardConnectionEvents = forwardConnectionEvents;
    }

    @Override
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = bus.subscribeAll(this::forward);
        LOGGER.info("이벤트 브리지 시작 (forwarded types: {})", forwardedTypes.isEmpty() ? "*" : forwardedTypes);
    }

    @Override
    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.close();
        subscription = null;
        LOGGER.info("이벤트 브리지 중지");
    }

    public synchronized boolean isRunning() {
        return subscription != null;
    }

    /**
     * Installs the inbound {@code event} handler on {@code handlers}.
     */
    public HandlerRegistration registerInbound(HandlerTable handlers) {
        return handlers.register(MessageTypes.EVENT, this::onClientEvent, INBOUND_PRIORITY);
    }

    public boolean shouldForward(String eventType) {
        if (!forwardConnectionEvents && ConnectionEvents.isConnectionEvent(eventType)) {
            return false;
        }
        return forwardedTypes.isEmpty() || forwardedTypes.contains(eventType);
    }

    void forward(EventPayload event) {
        if (!shouldForward(event.type())) {
            return;
        }
        broadcaster.broadcastEvent(event.type(), wrap(event), event.timestamp().toString());
    }

    ObjectNode wrap(EventPayload event) {
        ObjectNode wrapped = mapper.createObjectNode();
        wrapped.put("eventType", event.type());
        if (event.data() != null) {
            wrapped.set("data", event.data());
        }
        wrapped.put("source", event.source());
        wrapped.put("eventId", event.id());
        wrapped.put("timestamp", event.timestamp().toString());
        if (event.hasMetadata()) {
            wrapped.set("metadata", mapper.valueToTree(event.metadata()));
        }
        return wrapped;
    }

    void onClientEvent(MessageContext context, Envelope envelope) {
        JsonNode data = envelope.data();
        JsonNode eventType = data == null ? null : data.get("eventType");
        if (eventType == null || !eventType.isTextual() || eventType.asText().isBlank()) {
            throw new IllegalArgumentException("Invalid event payload: eventType is required");
        }
        Map<String, Object> metadata = null;
        JsonNode metadataNode = data.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            metadata = mapper.convertValue(metadataNode, METADATA_TYPE);
        }
        EventPayload emitted = bus.emit(eventType.asText(), data.get("data"),
                CLIENT_SOURCE_PREFIX + context.connectionId(), metadata);
        LOGGER.debug("Client {} emitted event {} ({})", context.connectionId(), emitted.type(), emitted.id());
    }
}
