package kr.crownrpg.relay.core.server;

import java.util.Map;

/**
 * Snapshot of one connected client.
 */
public record ClientInfo(String id, Map<String, String> metadata) {

    public ClientInfo {
        metadata = Map.copyOf(metadata);
    }
}
