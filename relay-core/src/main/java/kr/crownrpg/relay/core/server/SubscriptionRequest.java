package kr.crownrpg.relay.core.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code subscribe}/{@code unsubscribe} payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionRequest(List<String> eventTypes) {
}
