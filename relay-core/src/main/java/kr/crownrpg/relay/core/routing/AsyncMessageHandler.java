package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;

import java.util.concurrent.CompletionStage;

/**
 * Handler whose work finishes later. The next handler in the chain starts only after the returned stage completes;
 * an exceptional completion counts as a handler failure.
 */
@FunctionalInterface
public interface AsyncMessageHandler {

    CompletionStage<?> handle(MessageContext context, Envelope envelope) throws Exception;
}
