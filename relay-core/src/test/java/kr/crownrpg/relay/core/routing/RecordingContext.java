package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingContext implements MessageContext {

    final List<Envelope> replies = new CopyOnWriteArrayList<>();
    final List<Envelope> errors = new CopyOnWriteArrayList<>();
    final List<HandlerInvocationException> failures = new CopyOnWriteArrayList<>();

    @Override
    public String connectionId() {
        return "c1";
    }

    @Override
    public void reply(Envelope envelope) {
        replies.add(envelope);
    }

    @Override
    public void onHandlerFailure(Envelope error, HandlerInvocationException failure) {
        errors.add(error);
        failures.add(failure);
    }
}
