package kr.crownrpg.relay.core.codec;

import kr.crownrpg.relay.core.RelayException;

/**
 * Inbound bytes were not a JSON object, or carried no non-empty string {@code type}.
 */
public class EnvelopeDecodeException extends RelayException {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
