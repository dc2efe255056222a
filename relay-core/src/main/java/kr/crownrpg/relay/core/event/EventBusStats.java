package kr.crownrpg.relay.core.event;

import java.util.Set;

/**
 * @param totalEvents   events currently held in history
 * @param listenerCount typed plus all-types listeners
 * @param eventTypes    types with at least one typed listener
 */
public record EventBusStats(int totalEvents, int listenerCount, Set<String> eventTypes) {

    public EventBusStats {
        eventTypes = Set.copyOf(eventTypes);
    }
}
