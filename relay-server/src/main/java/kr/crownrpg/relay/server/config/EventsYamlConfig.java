package kr.crownrpg.relay.server.config;

import kr.crownrpg.relay.core.event.InMemoryEventBus;

import java.util.List;
import java.util.Map;

import static kr.crownrpg.relay.server.config.ConfigValues.bool;
import static kr.crownrpg.relay.server.config.ConfigValues.stringList;
import static kr.crownrpg.relay.server.config.ConfigValues.toInt;

/**
 * @param forwardTypes            event types sent to clients; empty means every type
 * @param forwardConnectionEvents whether {@code websocket.client.*} events reach clients
 */
public record EventsYamlConfig(int historySize, List<String> forwardTypes, boolean forwardConnectionEvents) {

    public EventsYamlConfig {
        forwardTypes = List.copyOf(forwardTypes);
    }

    public static EventsYamlConfig fromMap(Map<String, Object> section) {
        int historySize = toInt(section.get("history-size"), InMemoryEventBus.DEFAULT_HISTORY_SIZE);
        if (historySize < 0) {
            throw new IllegalArgumentException("events.history-size 값은 음수일 수 없습니다.");
        }
        return new EventsYamlConfig(
                historySize,
                stringList(section.get("forward-types")),
                bool(section.get("forward-connection-events"), false)
        );
    }
}
