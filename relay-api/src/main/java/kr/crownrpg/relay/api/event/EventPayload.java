package kr.crownrpg.relay.api.event;

import com.fasterxml.jackson.databind.JsonNode;
import kr.crownrpg.relay.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Domain event travelling through an {@link EventBus}.
 * <p>
 * {@code metadata} is optional; an absent map is normalized to an empty one so callers never null-check it.
 */
public record EventPayload(
        String id,
        String type,
        JsonNode data,
        String source,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public EventPayload {
        Preconditions.checkNotBlank(type, "type");
        Preconditions.checkNotBlank(source, "source");
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = toUnmodifiable(metadata);
    }

    public static EventPayload create(String type, JsonNode data, String source, Map<String, Object> metadata) {
        return new EventPayload(UUID.randomUUID().toString(), type, data, source, Instant.now(), metadata);
    }

    public boolean hasMetadata() {
        return !metadata.isEmpty();
    }

    private static Map<String, Object> toUnmodifiable(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        // metadata values may be null
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
