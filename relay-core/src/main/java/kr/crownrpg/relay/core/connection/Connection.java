package kr.crownrpg.relay.core.connection;

import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.message.MessageTypes;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Control-plane record for one accepted session: identity, liveness flag, subscription set and metadata.
 * <p>
 * The transport is one field of the record; callers refer to a connection by {@link #id()} and look it up in the
 * {@link ConnectionRegistry} again instead of holding the record across asynchronous steps.
 */
public final class Connection {

    public static final String META_REMOTE_ADDRESS = "remoteAddress";
    public static final String META_CONNECTED_AT = "connectedAt";
    public static final String META_USER_AGENT = "userAgent";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final ConnectionTransport transport;
    private final Map<String, String> metadata;
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private volatile Set<String> subscriptions = Set.of(MessageTypes.WILDCARD);

    public Connection(String id, ConnectionTransport transport, Map<String, String> metadata) {
        this.id = Preconditions.checkNotBlank(id, "id");
        this.transport = Preconditions.checkNotNull(transport, "transport");
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Process-unique id: {@code client_<epochMillis>_<sequence>_<random>}.
     */
    public static String nextId() {
        long sequence = SEQUENCE.incrementAndGet();
        int random = ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36);
        return "client_" + System.currentTimeMillis() + "_" + Long.toString(sequence, 36) + "_" + Integer.toString(random, 36);
    }

    public String id() {
        return id;
    }

    public ConnectionTransport transport() {
        return transport;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public boolean isAlive() {
        return alive.get();
    }

    /**
     * Records a liveness acknowledgment.
     */
    public void markAlive() {
        alive.set(true);
    }

    /**
     * Clears the liveness flag ahead of a probe.
     *
     * @return the flag's previous value; {@code false} means the previous probe was never acknowledged
     */
    public boolean clearAlive() {
        return alive.getAndSet(false);
    }

    public Set<String> subscriptions() {
        return subscriptions;
    }

    public boolean isSubscribedTo(String eventType) {
        Set<String> current = subscriptions;
        return current.contains(MessageTypes.WILDCARD) || current.contains(eventType);
    }

    public synchronized void replaceSubscriptions(Collection<String> eventTypes) {
        subscriptions = Collections.unmodifiableSet(new LinkedHashSet<>(eventTypes));
    }

    public synchronized void removeSubscriptions(Collection<String> eventTypes) {
        Set<String> next = new LinkedHashSet<>(subscriptions);
        next.removeAll(eventTypes);
        subscriptions = Collections.unmodifiableSet(next);
    }

    public void send(String text) {
        transport.send(text);
    }

    @Override
    public String toString() {
        return "Connection{" +
                "id='" + id + '\'' +
                ", alive=" + alive.get() +
                ", subscriptions=" + subscriptions +
                '}';
    }
}
