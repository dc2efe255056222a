package kr.crownrpg.relay.api.chat;

import kr.crownrpg.relay.api.Preconditions;

import java.time.Instant;

public record ChatMessage(
        String id,
        String channelId,
        String userId,
        String content,
        Instant createdAt,
        Instant updatedAt,
        boolean edited
) {

    /** Longest accepted message body in characters. */
    public static final int MAX_CONTENT_LENGTH = 4000;

    public ChatMessage {
        Preconditions.checkNotBlank(id, "id");
        Preconditions.checkNotBlank(channelId, "channelId");
        Preconditions.checkNotBlank(content, "content");
        Preconditions.checkArgument(content.length() <= MAX_CONTENT_LENGTH,
                "content exceeds " + MAX_CONTENT_LENGTH + " characters");
        userId = userId == null || userId.isBlank() ? "anonymous" : userId;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public ChatMessage edit(String newContent, Instant at) {
        return new ChatMessage(id, channelId, userId, newContent, createdAt, at, true);
    }
}
