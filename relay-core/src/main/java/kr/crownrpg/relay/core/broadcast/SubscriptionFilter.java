package kr.crownrpg.relay.core.broadcast;

import kr.crownrpg.relay.core.connection.Connection;

import java.util.function.Predicate;

/**
 * Selects the connections an event-typed broadcast goes to.
 */
public final class SubscriptionFilter {

    private SubscriptionFilter() {
    }

    /**
     * Connections whose subscription set holds {@code eventType} or the wildcard.
     */
    public static Predicate<Connection> subscribedTo(String eventType) {
        return connection -> connection.isSubscribedTo(eventType);
    }

    public static Predicate<Connection> everyoneExcept(String excludedId) {
        if (excludedId == null) {
            return connection -> true;
        }
        return connection -> !excludedId.equals(connection.id());
    }
}
