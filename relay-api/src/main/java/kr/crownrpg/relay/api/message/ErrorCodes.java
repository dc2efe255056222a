package kr.crownrpg.relay.api.message;

/**
 * Values of the {@code code} field carried by {@link MessageTypes#ERROR} envelopes.
 */
public final class ErrorCodes {

    /** Inbound bytes were not a JSON object or had no usable {@code type}. */
    public static final String MESSAGE_PROCESSING_ERROR = "MESSAGE_PROCESSING_ERROR";
    /** A registered handler threw; sibling handlers still ran. */
    public static final String HANDLER_ERROR = "HANDLER_ERROR";
    public static final String UNSUPPORTED_FRAME = "UNSUPPORTED_FRAME";
    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";

    private ErrorCodes() {
    }
}
