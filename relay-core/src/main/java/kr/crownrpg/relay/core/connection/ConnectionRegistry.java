package kr.crownrpg.relay.core.connection;

import kr.crownrpg.relay.api.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Thread-safe registry of live connections keyed by connection id.
 * <p>
 * Mutations are serialized on one monitor and are visible to the very next call. Iteration always walks a copy,
 * so a visitor may remove connections (including the one it is visiting) while iterating.
 */
public final class ConnectionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @throws IllegalStateException if a connection with the same id is already registered
     */
    public void add(Connection connection) {
        Preconditions.checkNotNull(connection, "connection");
        synchronized (connections) {
            if (connections.containsKey(connection.id())) {
                throw new IllegalStateException("Connection already registered: " + connection.id());
            }
            connections.put(connection.id(), connection);
        }
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnected(connection);
            } catch (RuntimeException e) {
                LOGGER.warn("Connection listener failed on connect of {}", connection.id(), e);
            }
        }
    }

    public Optional<Connection> remove(String id) {
        return remove(id, RemovalReason.CLOSED);
    }

    /**
     * Removes the connection if present. Removing an unknown id is a no-op and notifies nobody.
     */
    public Optional<Connection> remove(String id, RemovalReason reason) {
        if (id == null) {
            return Optional.empty();
        }
        Connection removed;
        synchronized (connections) {
            removed = connections.remove(id);
        }
        if (removed == null) {
            return Optional.empty();
        }
        for (ConnectionListener listener : listeners) {
            try {
                listener.onDisconnected(removed, reason);
            } catch (RuntimeException e) {
                LOGGER.warn("Connection listener failed on disconnect of {}", id, e);
            }
        }
        return Optional.of(removed);
    }

    public Optional<Connection> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (connections) {
            return Optional.ofNullable(connections.get(id));
        }
    }

    /**
     * Visits a snapshot of the registry in insertion order.
     */
    public void forEach(Consumer<Connection> visitor) {
        for (Connection connection : snapshot()) {
            visitor.accept(connection);
        }
    }

    public List<Connection> snapshot() {
        synchronized (connections) {
            return new ArrayList<>(connections.values());
        }
    }

    public int size() {
        synchronized (connections) {
            return connections.size();
        }
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Preconditions.checkNotNull(listener, "listener"));
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Removes every connection with {@link RemovalReason#SHUTDOWN} and terminates its transport.
     */
    public void closeAll() {
        for (Connection connection : snapshot()) {
            remove(connection.id(), RemovalReason.SHUTDOWN);
            connection.transport().terminate();
        }
    }
}
