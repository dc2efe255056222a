package kr.crownrpg.relay.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.event.EventBus;
import kr.crownrpg.relay.api.event.EventListener;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.api.event.EventSubscription;
import kr.crownrpg.relay.api.message.MessageTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 프로세스 내부 이벤트 버스.
 * <p>
 * 발행된 이벤트는 먼저 이력(최대 {@code historySize}개, 오래된 것부터 버림)에 쌓이고, 해당 타입 리스너 → 전체 리스너 순으로
 * 호출 스레드에서 동기 전달된다. 리스너 예외는 로그만 남기고 다음 리스너로 넘어간다.
 */
public final class InMemoryEventBus implements EventBus {

    public static final int DEFAULT_HISTORY_SIZE = 1000;

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();
    private final List<EventListener> allTypesListeners = new CopyOnWriteArrayList<>();
    private final Deque<EventPayload> history = new ArrayDeque<>();
    private final int historySize;

    public InMemoryEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public InMemoryEventBus(int historySize) {
        Preconditions.checkArgument(historySize >= 0, "historySize must be >= 0");
        this.historySize = historySize;
    }

    @Override
    public EventPayload emit(String type, JsonNode data, String source, Map<String, Object> metadata) {
        EventPayload event = EventPayload.create(type, data, source, metadata);
        publish(event);
        return event;
    }

    @Override
    public void publish(EventPayload event) {
        Preconditions.checkNotNull(event, "event");
        remember(event);
        List<EventListener> typed = listeners.get(event.type());
        if (typed != null) {
            notifyListeners(typed, event);
        }
        notifyListeners(allTypesListeners, event);
        LOGGER.debug("Emitted event \"{}\" from \"{}\"", event.type(), event.source());
    }

    @Override
    public EventSubscription subscribe(String type, EventListener listener) {
        Preconditions.checkNotBlank(type, "type");
        Preconditions.checkNotNull(listener, "listener");
        if (MessageTypes.WILDCARD.equals(type)) {
            return subscribeAll(listener);
        }
        listeners.compute(type, (key, typed) -> {
            List<EventListener> next = typed == null ? new CopyOnWriteArrayList<>() : typed;
            next.add(listener);
            return next;
        });
        return new Subscription(type, () -> listeners.computeIfPresent(type, (key, typed) -> {
            typed.remove(listener);
            return typed.isEmpty() ? null : typed;
        }));
    }

    @Override
    public EventSubscription subscribeAll(EventListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        allTypesListeners.add(listener);
        return new Subscription(MessageTypes.WILDCARD, () -> allTypesListeners.remove(listener));
    }

    /**
     * Oldest-first tail of the history.
     *
     * @param limit maximum number of events; {@code <= 0} means all
     * @param type  only events of this type, or {@code null} for every type
     */
    public List<EventPayload> history(int limit, String type) {
        List<EventPayload> matching = new ArrayList<>();
        synchronized (history) {
            for (EventPayload event : history) {
                if (type == null || type.equals(event.type())) {
                    matching.add(event);
                }
            }
        }
        if (limit > 0 && matching.size() > limit) {
            return List.copyOf(matching.subList(matching.size() - limit, matching.size()));
        }
        return List.copyOf(matching);
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
        LOGGER.info("이벤트 이력을 비웠습니다");
    }

    public EventBusStats stats() {
        int retained;
        synchronized (history) {
            retained = history.size();
        }
        int listenerCount = allTypesListeners.size();
        for (List<EventListener> typed : listeners.values()) {
            listenerCount += typed.size();
        }
        return new EventBusStats(retained, listenerCount, listeners.keySet());
    }

    private void remember(EventPayload event) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private void notifyListeners(List<EventListener> targets, EventPayload event) {
        for (EventListener listener : targets) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Event listener failed for type {}", event.type(), e);
            }
        }
    }

    private static final class Subscription implements EventSubscription {

        private final String eventType;
        private final Runnable detach;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Subscription(String eventType, Runnable detach) {
            this.eventType = eventType;
            this.detach = detach;
        }

        @Override
        public String eventType() {
            return eventType;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                detach.run();
            }
        }
    }
}
