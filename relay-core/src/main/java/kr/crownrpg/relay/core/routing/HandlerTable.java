package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Type → priority-ordered handler chain.
 * <p>
 * Chains are immutable lists swapped on every mutation, so {@link #chain(String)} never blocks and a dispatch in
 * progress keeps the chain it started with. A type whose last handler is removed disappears from the table.
 */
public final class HandlerTable {

    public static final int DEFAULT_PRIORITY = 0;

    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerTable.class);

    private final Map<String, List<HandlerRegistration>> chains = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public HandlerRegistration register(String type, MessageHandler handler) {
        return register(type, handler, DEFAULT_PRIORITY);
    }

    public HandlerRegistration register(String type, MessageHandler handler, int priority) {
        Preconditions.checkNotNull(handler, "handler");
        return add(type, handler, priority);
    }

    public HandlerRegistration registerAsync(String type, AsyncMessageHandler handler, int priority) {
        Preconditions.checkNotNull(handler, "handler");
        return add(type, handler, priority);
    }

    /**
     * Removes the whole chain for {@code type}.
     *
     * @return whether anything was registered
     */
    public synchronized boolean unregister(String type) {
        boolean removed = chains.remove(type) != null;
        if (removed) {
            LOGGER.debug("Unregistered all handlers for type: {}", type);
        }
        return removed;
    }

    public boolean unregister(String type, MessageHandler handler) {
        return removeFirst(type, handler);
    }

    public boolean unregister(String type, AsyncMessageHandler handler) {
        return removeFirst(type, handler);
    }

    public synchronized boolean unregister(HandlerRegistration registration) {
        if (registration == null) {
            return false;
        }
        List<HandlerRegistration> chain = chains.get(registration.type());
        if (chain == null || !chain.contains(registration)) {
            return false;
        }
        replace(registration.type(), chain, chain.indexOf(registration));
        return true;
    }

    /**
     * @return the current chain in execution order; empty when nothing is registered
     */
    public List<HandlerRegistration> chain(String type) {
        List<HandlerRegistration> chain = chains.get(type);
        return chain == null ? List.of() : chain;
    }

    public boolean hasHandlers(String type) {
        return chains.containsKey(type);
    }

    public int handlerCount(String type) {
        return chain(type).size();
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(chains.keySet());
    }

    public synchronized void clear() {
        chains.clear();
    }

    private synchronized HandlerRegistration add(String type, Object handler, int priority) {
        Preconditions.checkNotBlank(type, "type");
        HandlerRegistration registration = new HandlerRegistration(type, handler, priority, sequence.incrementAndGet());
        List<HandlerRegistration> next = new ArrayList<>(chain(type));
        next.add(registration);
        next.sort(HandlerRegistration.CHAIN_ORDER);
        chains.put(type, List.copyOf(next));
        LOGGER.debug("Registered handler for type: {} (priority: {})", type, priority);
        return registration;
    }

    private synchronized boolean removeFirst(String type, Object handler) {
        List<HandlerRegistration> chain = chains.get(type);
        if (chain == null || handler == null) {
            return false;
        }
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i).wraps(handler)) {
                replace(type, chain, i);
                return true;
            }
        }
        return false;
    }

    private void replace(String type, List<HandlerRegistration> chain, int removeIndex) {
        List<HandlerRegistration> next = new ArrayList<>(chain);
        next.remove(removeIndex);
        if (next.isEmpty()) {
            chains.remove(type);
        } else {
            chains.put(type, List.copyOf(next));
        }
        LOGGER.debug("Unregistered handler for type: {}", type);
    }
}
