package kr.crownrpg.relay.api.message;

import kr.crownrpg.relay.api.Preconditions;

/**
 * Reserved envelope types and the naming rule for application types.
 * <p>
 * Application types stay plain strings so every module can add its own. The recommended structure is
 * {@code "<domain>.<action>"} using lowercase segments, e.g. {@code "chat.message"} or {@code "chat.channel.created"}.
 */
public final class MessageTypes {

    /** Server greeting carrying the assigned connection id. */
    public static final String CONNECTION = "connection";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    /** Wraps {@code {eventType, data}} for subscription-filtered delivery. */
    public static final String EVENT = "event";
    public static final String ERROR = "error";

    public static final String CHAT_MESSAGE = "chat.message";
    public static final String CHAT_MESSAGE_SAVED = "chat.message.saved";

    /** Subscription sentinel meaning "every event type". */
    public static final String WILDCARD = "*";

    private MessageTypes() {
    }

    /**
     * Builds a message type string following the {@code <domain>.<action>} convention.
     *
     * @param domain non-blank domain segment
     * @param action non-blank action segment
     * @return joined message type string
     */
    public static String compose(String domain, String action) {
        Preconditions.checkNotBlank(domain, "domain");
        Preconditions.checkNotBlank(action, "action");
        return domain + "." + action;
    }
}
