package kr.crownrpg.relay.api.chat;

import kr.crownrpg.relay.api.event.EventPayload;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence seam for chat entities, used from message handlers and never by the realtime core itself.
 * <p>
 * Every operation is asynchronous; failures complete the future exceptionally with a
 * {@link kr.crownrpg.relay.api.database.DatabaseException}.
 */
public interface ChatStore {

    CompletableFuture<ChatChannel> createChannel(ChatChannel channel);

    CompletableFuture<Optional<ChatChannel>> findChannel(String channelId);

    CompletableFuture<List<ChatChannel>> listChannels(boolean includeArchived);

    CompletableFuture<Boolean> updateChannel(ChatChannel channel);

    /**
     * Deletes the channel together with its messages.
     *
     * @return {@code false} when no such channel existed
     */
    CompletableFuture<Boolean> deleteChannel(String channelId);

    CompletableFuture<ChatMessage> saveMessage(ChatMessage message);

    /**
     * Newest-first page of a channel's messages.
     *
     * @param before exclusive upper bound on {@code createdAt}, or {@code null} for the newest page
     */
    CompletableFuture<List<ChatMessage>> findMessages(String channelId, int limit, Instant before);

    CompletableFuture<Boolean> updateMessage(ChatMessage message);

    CompletableFuture<Boolean> deleteMessage(String messageId);

    CompletableFuture<Void> recordEvent(EventPayload event);
}
