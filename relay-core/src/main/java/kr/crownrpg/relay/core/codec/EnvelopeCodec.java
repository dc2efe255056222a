package kr.crownrpg.relay.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageIds;
import kr.crownrpg.relay.api.message.MessageTypes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Envelope <-> JSON 변환만 담당.
 * <p>
 * Encoding always writes {@code type, data, timestamp, id} in that order and skips absent fields, so the same
 * envelope yields the same bytes. Decoding fills a missing {@code timestamp} and {@code id}.
 */
public final class EnvelopeCodec {

    private static final int MAX_ECHO_LENGTH = 200;

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses raw frame bytes. Bytes that are not well-formed UTF-8 are rejected by the parser rather than replaced.
     */
    public Envelope decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("Malformed message: " + safe(new String(bytes, StandardCharsets.UTF_8)), e);
        }
        return fromTree(root);
    }

    public Envelope decode(String text) {
        if (text == null) {
            throw new EnvelopeDecodeException("Invalid message format: empty frame");
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Malformed message: " + safe(text), e);
        }
        return fromTree(root);
    }

    private Envelope fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("Invalid message format: expected a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new EnvelopeDecodeException("Invalid message format: missing or invalid type");
        }
        String timestamp = scalarText(root.get("timestamp"));
        String id = scalarText(root.get("id"));
        return new Envelope(
                typeNode.asText(),
                root.get("data"),
                timestamp == null ? Instant.now().toString() : timestamp,
                id == null ? generateId() : id
        );
    }

    public byte[] encode(Envelope envelope) {
        try {
            return mapper.writeValueAsBytes(toTree(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope: " + envelope.type(), e);
        }
    }

    public String encodeToString(Envelope envelope) {
        try {
            return mapper.writeValueAsString(toTree(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode envelope: " + envelope.type(), e);
        }
    }

    public String generateId() {
        return MessageIds.generate();
    }

    /**
     * Stamped envelope whose {@code data} is the JSON tree of {@code payload}.
     */
    public Envelope envelope(String type, Object payload) {
        JsonNode data = payload == null ? null : mapper.valueToTree(payload);
        return new Envelope(type, data, Instant.now().toString(), generateId());
    }

    public Envelope error(String message, String code, String details) {
        ObjectNode data = mapper.createObjectNode();
        data.put("message", message);
        data.put("code", code);
        if (details != null) {
            data.put("details", details);
        }
        return new Envelope(MessageTypes.ERROR, data, Instant.now().toString(), generateId());
    }

    private ObjectNode toTree(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        ObjectNode node = mapper.createObjectNode();
        node.put("type", envelope.type());
        if (envelope.data() != null) {
            node.set("data", envelope.data());
        }
        if (envelope.timestamp() != null) {
            node.put("timestamp", envelope.timestamp());
        }
        if (envelope.id() != null) {
            node.put("id", envelope.id());
        }
        return node;
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static String safe(String s) {
        if (s.length() <= MAX_ECHO_LENGTH) return s;
        return s.substring(0, MAX_ECHO_LENGTH) + "...(truncated)";
    }
}
