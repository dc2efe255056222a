package kr.crownrpg.relay.core.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import kr.crownrpg.relay.api.chat.ChatChannel;
import kr.crownrpg.relay.api.chat.ChatMessage;
import kr.crownrpg.relay.api.database.DatabaseConfig;
import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.Row;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.core.database.JdbcDatabaseClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcChatStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00.123456Z");

    private JdbcDatabaseClient db;
    private JdbcChatStore store;

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:chat_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        db = JdbcDatabaseClient.create(new DatabaseConfig(url, "sa", "", 2, 0, 1000L));
        store = new JdbcChatStore(db, new ObjectMapper());
        store.initializeSchema().join();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldCreateSchemaIdempotently() {
        assertDoesNotThrow(() -> store.initializeSchema().join());
    }

    @Test
    void shouldRoundTripChannelWithMillisecondTimestamps() {
        ChatChannel created = store.createChannel(channel("general")).join();

        Optional<ChatChannel> found = store.findChannel("general").join();

        assertTrue(found.isPresent());
        assertEquals(created, found.get());
        assertEquals(Instant.parse("2024-05-01T10:00:00.123Z"), found.get().createdAt());
        assertTrue(store.findChannel("missing").join().isEmpty());
    }

    @Test
    void shouldHideArchivedChannelsUnlessAsked() {
        store.createChannel(channel("general")).join();
        ChatChannel old = store.createChannel(channel("old")).join();
        assertTrue(store.updateChannel(old.archive(T0.plusSeconds(60))).join());

        assertEquals(List.of("general"), ids(store.listChannels(false).join()));
        assertEquals(2, store.listChannels(true).join().size());
    }

    @Test
    void shouldRenameChannel() {
        ChatChannel created = store.createChannel(channel("general")).join();

        assertTrue(store.updateChannel(created.rename("lobby", "new topic", T0.plusSeconds(5))).join());

        ChatChannel renamed = store.findChannel("general").join().orElseThrow();
        assertEquals("lobby", renamed.name());
        assertEquals("new topic", renamed.description());
        assertFalse(store.updateChannel(channel("missing")).join());
    }

    @Test
    void shouldPageMessagesNewestFirst() {
        store.createChannel(channel("general")).join();
        for (int i = 0; i < 5; i++) {
            store.saveMessage(message("m" + i, "general", T0.plusSeconds(i))).join();
        }

        List<ChatMessage> newest = store.findMessages("general", 2, null).join();
        assertEquals(List.of("m4", "m3"), messageIds(newest));

        List<ChatMessage> older = store.findMessages("general", 10, newest.get(1).createdAt()).join();
        assertEquals(List.of("m2", "m1", "m0"), messageIds(older));
    }

    @Test
    void shouldRejectMessageForUnknownChannel() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> store.saveMessage(message("m1", "nowhere", T0)).join());

        assertInstanceOf(DatabaseException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("nowhere"));
    }

    @Test
    void shouldEditAndDeleteMessages() {
        store.createChannel(channel("general")).join();
        ChatMessage saved = store.saveMessage(message("m1", "general", T0)).join();

        assertTrue(store.updateMessage(saved.edit("fixed typo", T0.plusSeconds(1))).join());
        ChatMessage edited = store.findMessages("general", 1, null).join().get(0);
        assertEquals("fixed typo", edited.content());
        assertTrue(edited.edited());

        assertTrue(store.deleteMessage("m1").join());
        assertFalse(store.deleteMessage("m1").join());
    }

    @Test
    void shouldDeleteChannelWithItsMessages() {
        store.createChannel(channel("general")).join();
        store.saveMessage(message("m1", "general", T0)).join();

        assertTrue(store.deleteChannel("general").join());

        assertTrue(store.findMessages("general", 10, null).join().isEmpty());
        assertFalse(store.deleteChannel("general").join());
    }

    @Test
    void shouldRecordEventsWithJsonColumns() {
        EventPayload event = EventPayload.create("user.joined", TextNode.valueOf("steve"), "backend",
                Map.of("room", "lobby"));

        store.recordEvent(event).join();

        Row row = db.query(q -> q.executeQueryOne("SELECT * FROM events WHERE id = ?", event.id())).join()
                .orElseThrow();
        assertEquals("user.joined", row.getString("event_type"));
        assertEquals("\"steve\"", row.getString("data"));
        assertEquals("{\"room\":\"lobby\"}", row.getString("metadata"));
        assertFalse(row.getBoolean("processed"));
    }

    private static ChatChannel channel(String id) {
        return new ChatChannel(id, id, null, null, "admin", T0, T0, false);
    }

    private static ChatMessage message(String id, String channelId, Instant at) {
        return new ChatMessage(id, channelId, "steve", "hello " + id, at, at, false);
    }

    private static List<String> ids(List<ChatChannel> channels) {
        return channels.stream().map(ChatChannel::id).toList();
    }

    private static List<String> messageIds(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::id).toList();
    }
}
