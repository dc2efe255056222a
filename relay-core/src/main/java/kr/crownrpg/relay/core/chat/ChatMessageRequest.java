package kr.crownrpg.relay.core.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound {@code chat.message} payload. {@code userId} is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessageRequest(String channelId, String content, String userId) {
}
