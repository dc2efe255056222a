package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.core.RelayException;

/**
 * A registered handler threw or completed exceptionally. Sibling handlers still run.
 */
public class HandlerInvocationException extends RelayException {

    private final String messageType;
    private final int priority;

    public HandlerInvocationException(String messageType, int priority, Throwable cause) {
        super("Handler for '" + messageType + "' (priority " + priority + ") failed: " + describe(cause), cause);
        this.messageType = messageType;
        this.priority = priority;
    }

    public String messageType() {
        return messageType;
    }

    public int priority() {
        return priority;
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
