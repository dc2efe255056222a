package kr.crownrpg.relay.core.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.chat.ChatChannel;
import kr.crownrpg.relay.api.chat.ChatMessage;
import kr.crownrpg.relay.api.chat.ChatStore;
import kr.crownrpg.relay.api.database.DatabaseClient;
import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.Row;
import kr.crownrpg.relay.api.event.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ChatStore} over a {@link DatabaseClient}. The SQL sticks to what MySQL 8 and H2 both accept.
 * <p>
 * Timestamps are stored with millisecond precision; the records returned by write operations are truncated the same
 * way so they compare equal to what a later read returns.
 */
public final class JdbcChatStore implements ChatStore {

    public static final int MAX_PAGE_SIZE = 500;

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcChatStore.class);

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS channels ("
                    + "id VARCHAR(64) NOT NULL PRIMARY KEY, "
                    + "name VARCHAR(100) NOT NULL, "
                    + "description VARCHAR(500), "
                    + "channel_type VARCHAR(32) NOT NULL, "
                    + "creator_id VARCHAR(64) NOT NULL, "
                    + "created_at TIMESTAMP(3) NOT NULL, "
                    + "updated_at TIMESTAMP(3) NOT NULL, "
                    + "archived BOOLEAN NOT NULL DEFAULT FALSE)",
            "CREATE TABLE IF NOT EXISTS messages ("
                    + "id VARCHAR(64) NOT NULL PRIMARY KEY, "
                    + "channel_id VARCHAR(64) NOT NULL, "
                    + "user_id VARCHAR(64) NOT NULL, "
                    + "content VARCHAR(4000) NOT NULL, "
                    + "created_at TIMESTAMP(3) NOT NULL, "
                    + "updated_at TIMESTAMP(3) NOT NULL, "
                    + "edited BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "CONSTRAINT fk_messages_channel FOREIGN KEY (channel_id) REFERENCES channels (id))",
            "CREATE TABLE IF NOT EXISTS events ("
                    + "id VARCHAR(64) NOT NULL PRIMARY KEY, "
                    + "event_type VARCHAR(200) NOT NULL, "
                    + "data TEXT, "
                    + "source VARCHAR(200) NOT NULL, "
                    + "metadata TEXT, "
                    + "created_at TIMESTAMP(3) NOT NULL, "
                    + "processed BOOLEAN NOT NULL DEFAULT FALSE)"
    );

    private static final String CHANNEL_COLUMNS =
            "id, name, description, channel_type, creator_id, created_at, updated_at, archived";
    private static final String MESSAGE_COLUMNS =
            "id, channel_id, user_id, content, created_at, updated_at, edited";

    private final DatabaseClient db;
    private final ObjectMapper mapper;

    public JdbcChatStore(DatabaseClient db, ObjectMapper mapper) {
        this.db = Preconditions.checkNotNull(db, "db");
        this.mapper = Preconditions.checkNotNull(mapper, "mapper");
    }

    /**
     * Creates the {@code channels}, {@code messages} and {@code events} tables when missing.
     */
    public CompletableFuture<Void> initializeSchema() {
        return db.transaction(tx -> {
            for (String ddl : SCHEMA) {
                tx.executeUpdate(ddl);
            }
            LOGGER.info("채팅 스키마 확인 완료");
            return null;
        });
    }

    @Override
    public CompletableFuture<ChatChannel> createChannel(ChatChannel channel) {
        Preconditions.checkNotNull(channel, "channel");
        ChatChannel stored = normalize(channel);
        return db.query(q -> {
            q.executeUpdate("INSERT INTO channels (" + CHANNEL_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    stored.id(), stored.name(), stored.description(), stored.type(), stored.creatorId(),
                    stored.createdAt(), stored.updatedAt(), stored.archived());
            return stored;
        });
    }

    @Override
    public CompletableFuture<Optional<ChatChannel>> findChannel(String channelId) {
        return db.query(q -> q.executeQueryOne(
                "SELECT " + CHANNEL_COLUMNS + " FROM channels WHERE id = ?", channelId
        ).map(JdbcChatStore::toChannel));
    }

    @Override
    public CompletableFuture<List<ChatChannel>> listChannels(boolean includeArchived) {
        String sql = "SELECT " + CHANNEL_COLUMNS + " FROM channels"
                + (includeArchived ? "" : " WHERE archived = FALSE")
                + " ORDER BY created_at, id";
        return db.query(q -> {
            List<ChatChannel> channels = new ArrayList<>();
            for (Row row : q.executeQuery(sql)) {
                channels.add(toChannel(row));
            }
            return channels;
        });
    }

    @Override
    public CompletableFuture<Boolean> updateChannel(ChatChannel channel) {
        Preconditions.checkNotNull(channel, "channel");
        ChatChannel stored = normalize(channel);
        return db.query(q -> q.executeUpdate(
                "UPDATE channels SET name = ?, description = ?, channel_type = ?, updated_at = ?, archived = ? WHERE id = ?",
                stored.name(), stored.description(), stored.type(), stored.updatedAt(), stored.archived(), stored.id()
        ) > 0);
    }

    @Override
    public CompletableFuture<Boolean> deleteChannel(String channelId) {
        return db.transaction(tx -> {
            int messages = tx.executeUpdate("DELETE FROM messages WHERE channel_id = ?", channelId);
            boolean deleted = tx.executeUpdate("DELETE FROM channels WHERE id = ?", channelId) > 0;
            if (deleted) {
                LOGGER.debug("Deleted channel {} with {} message(s)", channelId, messages);
            }
            return deleted;
        });
    }

    @Override
    public CompletableFuture<ChatMessage> saveMessage(ChatMessage message) {
        Preconditions.checkNotNull(message, "message");
        ChatMessage stored = normalize(message);
        return db.transaction(tx -> {
            if (tx.executeQueryOne("SELECT id FROM channels WHERE id = ?", stored.channelId()).isEmpty()) {
                throw new DatabaseException("Unknown channel: " + stored.channelId());
            }
            tx.executeUpdate("INSERT INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                    stored.id(), stored.channelId(), stored.userId(), stored.content(),
                    stored.createdAt(), stored.updatedAt(), stored.edited());
            return stored;
        });
    }

    @Override
    public CompletableFuture<List<ChatMessage>> findMessages(String channelId, int limit, Instant before) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return db.query(q -> {
            List<Row> rows = before == null
                    ? q.executeQuery("SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE channel_id = ?"
                    + " ORDER BY created_at DESC, id DESC LIMIT ?", channelId, pageSize)
                    : q.executeQuery("SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE channel_id = ? AND created_at < ?"
                    + " ORDER BY created_at DESC, id DESC LIMIT ?", channelId, before, pageSize);
            List<ChatMessage> messages = new ArrayList<>(rows.size());
            for (Row row : rows) {
                messages.add(toMessage(row));
            }
            return messages;
        });
    }

    @Override
    public CompletableFuture<Boolean> updateMessage(ChatMessage message) {
        Preconditions.checkNotNull(message, "message");
        ChatMessage stored = normalize(message);
        return db.query(q -> q.executeUpdate(
                "UPDATE messages SET content = ?, updated_at = ?, edited = ? WHERE id = ?",
                stored.content(), stored.updatedAt(), stored.edited(), stored.id()
        ) > 0);
    }

    @Override
    public CompletableFuture<Boolean> deleteMessage(String messageId) {
        return db.query(q -> q.executeUpdate("DELETE FROM messages WHERE id = ?", messageId) > 0);
    }

    @Override
    public CompletableFuture<Void> recordEvent(EventPayload event) {
        Preconditions.checkNotNull(event, "event");
        String data = toJson(event.data());
        String metadata = event.hasMetadata() ? toJson(event.metadata()) : null;
        return db.query(q -> {
            q.executeUpdate("INSERT INTO events (id, event_type, data, source, metadata, created_at) VALUES (?, ?, ?, ?, ?, ?)",
                    event.id(), event.type(), data, event.source(), metadata, millis(event.timestamp()));
            return null;
        });
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DatabaseException("Failed to serialize event column", e);
        }
    }

    private static ChatChannel toChannel(Row row) {
        return new ChatChannel(
                row.getString("id"),
                row.getString("name"),
                row.getString("description"),
                row.getString("channel_type"),
                row.getString("creator_id"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"),
                row.getBoolean("archived")
        );
    }

    private static ChatMessage toMessage(Row row) {
        return new ChatMessage(
                row.getString("id"),
                row.getString("channel_id"),
                row.getString("user_id"),
                row.getString("content"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"),
                row.getBoolean("edited")
        );
    }

    private static ChatChannel normalize(ChatChannel c) {
        return new ChatChannel(c.id(), c.name(), c.description(), c.type(), c.creatorId(),
                millis(c.createdAt()), millis(c.updatedAt()), c.archived());
    }

    private static ChatMessage normalize(ChatMessage m) {
        return new ChatMessage(m.id(), m.channelId(), m.userId(), m.content(),
                millis(m.createdAt()), millis(m.updatedAt()), m.edited());
    }

    private static Instant millis(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
