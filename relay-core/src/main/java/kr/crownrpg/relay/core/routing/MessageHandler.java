package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;

/**
 * Synchronous handler; the chain moves on as soon as it returns or throws.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(MessageContext context, Envelope envelope) throws Exception;
}
