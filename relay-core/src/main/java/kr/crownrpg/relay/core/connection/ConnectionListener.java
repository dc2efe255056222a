package kr.crownrpg.relay.core.connection;

/**
 * Registry membership callbacks. Invoked after the registry has been updated, outside its lock.
 */
public interface ConnectionListener {

    default void onConnected(Connection connection) {
    }

    default void onDisconnected(Connection connection, RemovalReason reason) {
    }
}
