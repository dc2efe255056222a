package kr.crownrpg.relay.api.event;

@FunctionalInterface
public interface EventListener {

    void onEvent(EventPayload event);
}
