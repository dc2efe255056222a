package kr.crownrpg.relay.api.message;

import com.fasterxml.jackson.databind.JsonNode;
import kr.crownrpg.relay.api.Preconditions;

import java.time.Instant;

/**
 * Immutable unit of wire exchange between a relay server and its clients.
 * <p>
 * {@code data} is kept as an opaque JSON tree; handlers convert it to their own payload types.
 * {@code timestamp} and {@code id} may be absent on an outbound envelope, in which case the codec fills them on decode.
 */
public record Envelope(
        String type,
        JsonNode data,
        String timestamp,
        String id
) {

    public Envelope {
        Preconditions.checkNotBlank(type, "type");
        if (timestamp != null && timestamp.isBlank()) {
            timestamp = null;
        }
        if (id != null && id.isBlank()) {
            id = null;
        }
    }

    /**
     * Creates a fully populated envelope stamped with the current time and a fresh id.
     */
    public static Envelope of(String type, JsonNode data) {
        return new Envelope(type, data, Instant.now().toString(), MessageIds.generate());
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public boolean hasId() {
        return id != null;
    }

    public Envelope withTimestamp(String newTimestamp) {
        return new Envelope(type, data, newTimestamp, id);
    }

    public Envelope withId(String newId) {
        return new Envelope(type, data, timestamp, newId);
    }
}
