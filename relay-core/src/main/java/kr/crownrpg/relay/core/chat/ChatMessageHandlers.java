package kr.crownrpg.relay.core.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.chat.ChatMessage;
import kr.crownrpg.relay.api.chat.ChatStore;
import kr.crownrpg.relay.api.event.EventBus;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.event.EventBridge;
import kr.crownrpg.relay.core.routing.HandlerRegistration;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * {@code chat.message} handler: validates, persists, acknowledges with {@code chat.message.saved} and announces the
 * stored message on the event bus so subscribers receive it through the bridge.
 */
public final class ChatMessageHandlers {

    public static final int PRIORITY = 0;

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatMessageHandlers.class);

    private final ChatStore store;
    private final EventBus events;
    private final EnvelopeCodec codec;

    public ChatMessageHandlers(ChatStore store, EventBus events, EnvelopeCodec codec) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.events = Preconditions.checkNotNull(events, "events");
        this.codec = Preconditions.checkNotNull(codec, "codec");
    }

    public HandlerRegistration registerOn(HandlerTable handlers) {
        return handlers.registerAsync(MessageTypes.CHAT_MESSAGE, this::onChatMessage, PRIORITY);
    }

    CompletionStage<?> onChatMessage(MessageContext context, Envelope envelope) throws Exception {
        ChatMessage message = validate(envelope.data());
        return store.saveMessage(message).thenAccept(saved -> {
            ObjectNode json = toJson(codec.mapper(), saved);
            context.reply(codec.envelope(MessageTypes.CHAT_MESSAGE_SAVED, json));
            events.emit(MessageTypes.CHAT_MESSAGE, json, EventBridge.CLIENT_SOURCE_PREFIX + context.connectionId());
            LOGGER.debug("Saved chat message {} in channel {}", saved.id(), saved.channelId());
        });
    }

    private ChatMessage validate(JsonNode data) throws Exception {
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("Invalid chat.message payload: expected an object");
        }
        ChatMessageRequest request = codec.mapper().treeToValue(data, ChatMessageRequest.class);
        if (request.channelId() == null || request.channelId().isBlank()) {
            throw new IllegalArgumentException("Invalid chat.message payload: channelId is required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("Invalid chat.message payload: content is required");
        }
        if (request.content().length() > ChatMessage.MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("Invalid chat.message payload: content exceeds "
                    + ChatMessage.MAX_CONTENT_LENGTH + " characters");
        }
        Instant now = Instant.now();
        return new ChatMessage(UUID.randomUUID().toString(), request.channelId(), request.userId(),
                request.content(), now, now, false);
    }

    static ObjectNode toJson(ObjectMapper mapper, ChatMessage message) {
        ObjectNode json = mapper.createObjectNode();
        json.put("id", message.id());
        json.put("channelId", message.channelId());
        json.put("userId", message.userId());
        json.put("content", message.content());
        json.put("createdAt", message.createdAt().toString());
        json.put("updatedAt", message.updatedAt().toString());
        json.put("edited", message.edited());
        return json;
    }
}
