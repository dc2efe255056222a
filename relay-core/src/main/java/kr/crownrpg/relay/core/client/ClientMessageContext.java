package kr.crownrpg.relay.core.client;

import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.core.routing.HandlerInvocationException;
import kr.crownrpg.relay.core.routing.MessageContext;

import java.util.concurrent.Executor;

/**
 * Client-side view of one message from the server. Handler failures stay local: they are logged and passed to the
 * client's error listeners instead of being sent back.
 */
final class ClientMessageContext implements MessageContext {

    private final ReconnectingClient client;
    private final Executor executor;

    ClientMessageContext(ReconnectingClient client, Executor executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public String connectionId() {
        return client.clientId();
    }

    @Override
    public void reply(Envelope envelope) {
        client.send(envelope);
    }

    @Override
    public void onHandlerFailure(Envelope error, HandlerInvocationException failure) {
        client.reportError(failure);
    }

    @Override
    public Executor executor() {
        return executor;
    }
}
