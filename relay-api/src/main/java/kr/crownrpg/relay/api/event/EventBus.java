package kr.crownrpg.relay.api.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Process-local publish/subscribe bus for domain events.
 * <p>
 * The realtime core only talks to the bus through this contract: it emits client-originated events onto it and
 * forwards bus emissions to subscribed connections.
 */
public interface EventBus {

    /**
     * Builds an {@link EventPayload} and delivers it to the listeners of {@code type}, then to all-types listeners.
     *
     * @return the payload that was delivered
     */
    EventPayload emit(String type, JsonNode data, String source, Map<String, Object> metadata);

    default EventPayload emit(String type, JsonNode data, String source) {
        return emit(type, data, source, null);
    }

    /**
     * Delivers an already built payload unchanged, keeping its id and timestamp.
     */
    void publish(EventPayload event);

    EventSubscription subscribe(String type, EventListener listener);

    EventSubscription subscribeAll(EventListener listener);
}
