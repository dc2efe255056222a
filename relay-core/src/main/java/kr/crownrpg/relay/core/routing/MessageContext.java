package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;

import java.util.concurrent.Executor;

/**
 * The peer a dispatched envelope came from, as seen by handlers.
 */
public interface MessageContext {

    /**
     * Id of the originating connection; on the client this is the id the server assigned, or {@code null} before
     * the greeting arrived.
     */
    String connectionId();

    /**
     * Sends an envelope back to the originating peer.
     */
    void reply(Envelope envelope);

    /**
     * Called once per failing handler with the {@code error} envelope describing it.
     */
    void onHandlerFailure(Envelope error, HandlerInvocationException failure);

    /**
     * Executor on which a chain resumes after an asynchronous handler.
     */
    default Executor executor() {
        return Runnable::run;
    }
}
