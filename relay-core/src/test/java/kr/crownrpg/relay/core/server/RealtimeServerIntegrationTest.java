package kr.crownrpg.relay.core.server;

import kr.crownrpg.relay.api.client.ClientState;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.client.ClientSettings;
import kr.crownrpg.relay.core.client.ReconnectingClient;
import kr.crownrpg.relay.core.event.EventBridge;
import kr.crownrpg.relay.core.event.InMemoryEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real sockets on the loopback interface: a bound server and {@link ReconnectingClient}s talking to it.
 */
class RealtimeServerIntegrationTest {

    private static final long TIMEOUT_SECONDS = 5;

    private InMemoryEventBus events;
    private RealtimeServer server;
    private EventBridge bridge;
    private final List<ReconnectingClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() {
        events = new InMemoryEventBus();
        server = new RealtimeServer(
                new RealtimeServerSettings("127.0.0.1", 0, "/ws", 65_536, Duration.ofSeconds(30)), events);
        bridge = new EventBridge(events, server.broadcaster(), server.codec().mapper());
        bridge.registerInbound(server.handlers());
        bridge.start();
        server.start();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(ReconnectingClient::destroy);
        bridge.stop();
        server.stop();
    }

    @Test
    void shouldGreetClientWithAssignedId() throws Exception {
        ReconnectingClient client = client();
        BlockingQueue<Envelope> greetings = new LinkedBlockingQueue<>();
        client.register(MessageTypes.CONNECTION, (ctx, env) -> greetings.add(env));

        client.connect();

        Envelope greeting = greetings.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(greeting);
        assertEquals(greeting.data().get("clientId").asText(), client.clientId());
        assertTrue(client.isConnected());
        assertFalse(client.connect());
        assertEquals(1, server.connectedClients().size());
    }

    @Test
    void shouldDeliverEventsOnlyToSubscribers() throws Exception {
        ReconnectingClient chat = client();
        ReconnectingClient other = client();
        BlockingQueue<Envelope> chatInbox = inbox(chat, MessageTypes.EVENT);
        BlockingQueue<Envelope> otherInbox = inbox(other, MessageTypes.EVENT);
        BlockingQueue<Envelope> acks = new LinkedBlockingQueue<>();
        chat.register(MessageTypes.SUBSCRIBED, (ctx, env) -> acks.add(env));
        other.register(MessageTypes.SUBSCRIBED, (ctx, env) -> acks.add(env));
        connectAndAwaitGreeting(chat);
        connectAndAwaitGreeting(other);

        assertTrue(chat.subscribe(List.of("chat.message")));
        assertTrue(other.subscribe(List.of("other.type")));
        assertNotNull(acks.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertNotNull(acks.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));

        events.emit("chat.message", server.codec().mapper().createObjectNode().put("content", "hello"), "backend");

        Envelope delivered = chatInbox.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(delivered);
        assertEquals("chat.message", delivered.data().get("eventType").asText());
        assertEquals("hello", delivered.data().get("data").get("content").asText());
        assertEquals("backend", delivered.data().get("source").asText());
        assertNull(otherInbox.poll(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldAnswerClientPing() throws Exception {
        ReconnectingClient client = client();
        BlockingQueue<Envelope> pongs = inbox(client, MessageTypes.PONG);
        connectAndAwaitGreeting(client);

        assertTrue(client.send(MessageTypes.PING, null));

        assertNotNull(pongs.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void shouldEmitClientEventsOntoBus() throws Exception {
        ReconnectingClient client = client();
        BlockingQueue<String> sources = new LinkedBlockingQueue<>();
        events.subscribe("game.score", event -> sources.add(event.source()));
        connectAndAwaitGreeting(client);

        client.send(MessageTypes.EVENT, Map.of("eventType", "game.score", "data", Map.of("points", 3)));

        assertEquals("client:" + client.clientId(), sources.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void shouldReconnectAfterServerDrop() throws Exception {
        ReconnectingClient client = client();
        List<ClientState> transitions = new CopyOnWriteArrayList<>();
        client.onStateChange((previous, current) -> transitions.add(current));
        connectAndAwaitGreeting(client);

        server.stop();

        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        int connected = transitions.indexOf(ClientState.CONNECTED);
        while (transitions.size() < connected + 3) {
            assertTrue(System.currentTimeMillis() < deadline, "client did not try to reconnect: " + transitions);
            TimeUnit.MILLISECONDS.sleep(20);
        }
        // an abrupt close may surface as an error instead of a clean close
        assertTrue(transitions.get(connected + 1) == ClientState.DISCONNECTED
                || transitions.get(connected + 1) == ClientState.ERROR, transitions::toString);
        assertEquals(ClientState.CONNECTING, transitions.get(connected + 2));
    }

    @Test
    void shouldAcceptClientsAgainAfterRestart() throws Exception {
        server.stop();
        assertFalse(server.isStarted());

        server.start();
        assertTrue(server.isStarted());

        ReconnectingClient client = client();
        connectAndAwaitGreeting(client);
        assertEquals(1, server.connectedClients().size());
    }

    private ReconnectingClient client() {
        URI url = URI.create("ws://127.0.0.1:" + server.port() + "/ws");
        ReconnectingClient client = new ReconnectingClient(ClientSettings.defaults(url)
                .withReconnect(true, Duration.ofMillis(100), 3)
                .withHeartbeat(false, ClientSettings.DEFAULT_HEARTBEAT_INTERVAL));
        clients.add(client);
        return client;
    }

    private static BlockingQueue<Envelope> inbox(ReconnectingClient client, String type) {
        BlockingQueue<Envelope> inbox = new LinkedBlockingQueue<>();
        client.register(type, (ctx, env) -> inbox.add(env));
        return inbox;
    }

    private static void connectAndAwaitGreeting(ReconnectingClient client) throws InterruptedException {
        BlockingQueue<Envelope> greetings = inbox(client, MessageTypes.CONNECTION);
        client.connect();
        assertNotNull(greetings.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS), "no greeting received");
    }
}
