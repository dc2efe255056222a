package kr.crownrpg.relay.core.chat;

import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.chat.ChatStore;
import kr.crownrpg.relay.api.event.EventBus;
import kr.crownrpg.relay.api.event.EventPayload;
import kr.crownrpg.relay.api.event.EventSubscription;
import kr.crownrpg.relay.api.lifecycle.ManagedLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every bus event to the store's event log. Failed writes are logged and dropped.
 */
public final class EventLogRecorder implements ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventLogRecorder.class);

    private final EventBus events;
    private final ChatStore store;
    private EventSubscription subscription;

    public EventLogRecorder(EventBus events, ChatStore store) {
        this.events = Preconditions.checkNotNull(events, "events");
        this.store = Preconditions.checkNotNull(store, "store");
    }

    @Override
    public synchronized void start() {
        if (subscription == null) {
            subscription = events.subscribeAll(this::record);
        }
    }

    @Override
    public synchronized void stop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    private void record(EventPayload event) {
        store.recordEvent(event).whenComplete((ignored, failure) -> {
            if (failure != null) {
                LOGGER.warn("이벤트 기록 실패: {} ({})", event.type(), event.id(), failure);
            }
        });
    }
}
