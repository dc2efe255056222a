package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;

import java.util.Comparator;
import java.util.concurrent.CompletionStage;

/**
 * One (type, handler, priority) entry of a chain. Higher priority runs first; ties keep registration order.
 */
public final class HandlerRegistration {

    static final Comparator<HandlerRegistration> CHAIN_ORDER = Comparator
            .comparingInt(HandlerRegistration::priority).reversed()
            .thenComparingLong(HandlerRegistration::sequence);

    private final String type;
    private final Object handler;
    private final int priority;
    private final long sequence;

    HandlerRegistration(String type, Object handler, int priority, long sequence) {
        this.type = type;
        this.handler = handler;
        this.priority = priority;
        this.sequence = sequence;
    }

    public String type() {
        return type;
    }

    public int priority() {
        return priority;
    }

    long sequence() {
        return sequence;
    }

    boolean wraps(Object candidate) {
        return handler == candidate;
    }

    /**
     * @return the pending stage of an asynchronous handler, or {@code null} once a synchronous one returned
     */
    CompletionStage<?> invoke(MessageContext context, Envelope envelope) throws Exception {
        if (handler instanceof AsyncMessageHandler async) {
            return async.handle(context, envelope);
        }
        ((MessageHandler) handler).handle(context, envelope);
        return null;
    }

    @Override
    public String toString() {
        return "HandlerRegistration{type='" + type + "', priority=" + priority + ", sequence=" + sequence + '}';
    }
}
