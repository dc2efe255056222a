package kr.crownrpg.relay.api.chat;

import kr.crownrpg.relay.api.Preconditions;

import java.time.Instant;

public record ChatChannel(
        String id,
        String name,
        String description,
        String type,
        String creatorId,
        Instant createdAt,
        Instant updatedAt,
        boolean archived
) {

    public static final String TYPE_PUBLIC = "public";

    public ChatChannel {
        Preconditions.checkNotBlank(id, "id");
        Preconditions.checkNotBlank(name, "name");
        type = type == null || type.isBlank() ? TYPE_PUBLIC : type.trim().toLowerCase();
        creatorId = creatorId == null ? "system" : creatorId;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public ChatChannel rename(String newName, String newDescription, Instant at) {
        return new ChatChannel(id, newName, newDescription, type, creatorId, createdAt, at, archived);
    }

    public ChatChannel archive(Instant at) {
        return new ChatChannel(id, name, description, type, creatorId, createdAt, at, true);
    }
}
