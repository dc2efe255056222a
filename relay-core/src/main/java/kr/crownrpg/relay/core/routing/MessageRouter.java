package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.ErrorCodes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatches decoded envelopes through the {@link HandlerTable} chain for their type.
 * <p>
 * Handlers run one at a time in chain order; an asynchronous handler holds the chain until its stage completes.
 * A failing handler produces one {@code error} envelope for the originating peer and the chain continues with the
 * next handler. Used unchanged by the server and by the client.
 */
public final class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    private final HandlerTable handlers;
    private final EnvelopeCodec codec;

    public MessageRouter(HandlerTable handlers, EnvelopeCodec codec) {
        this.handlers = Preconditions.checkNotNull(handlers, "handlers");
        this.codec = Preconditions.checkNotNull(codec, "codec");
    }

    public HandlerTable handlers() {
        return handlers;
    }

    /**
     * @return a future completing once every handler in the chain has finished; it never completes exceptionally
     * because of a handler failure
     */
    public CompletableFuture<Void> dispatch(MessageContext context, Envelope envelope) {
        Preconditions.checkNotNull(context, "context");
        Preconditions.checkNotNull(envelope, "envelope");
        List<HandlerRegistration> chain = handlers.chain(envelope.type());
        if (chain.isEmpty()) {
            LOGGER.debug("No handlers registered for message type: {}", envelope.type());
            return CompletableFuture.completedFuture(null);
        }
        LOGGER.debug("Processing message type: {} with {} handler(s) for {}",
                envelope.type(), chain.size(), context.connectionId());
        return runFrom(chain, 0, context, envelope);
    }

    private CompletableFuture<Void> runFrom(List<HandlerRegistration> chain,
                                            int start,
                                            MessageContext context,
                                            Envelope envelope) {
        for (int i = start; i < chain.size(); i++) {
            HandlerRegistration registration = chain.get(i);
            CompletionStage<?> stage;
            try {
                stage = registration.invoke(context, envelope);
            } catch (Exception e) {
                reportFailure(registration, context, e);
                continue;
            }
            if (stage == null) {
                continue;
            }
            CompletableFuture<?> pending = stage.toCompletableFuture();
            if (pending.isDone()) {
                Throwable failure = failureOf(pending);
                if (failure != null) {
                    reportFailure(registration, context, failure);
                }
                continue;
            }
            return resumeAfter(pending, registration, chain, i + 1, context, envelope);
        }
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> resumeAfter(CompletableFuture<?> pending,
                                                HandlerRegistration registration,
                                                List<HandlerRegistration> chain,
                                                int next,
                                                MessageContext context,
                                                Envelope envelope) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        pending.whenComplete((ignored, failure) -> {
            try {
                context.executor().execute(() -> {
                    if (failure != null) {
                        reportFailure(registration, context, unwrap(failure));
                    }
                    runFrom(chain, next, context, envelope).whenComplete((v, t) -> {
                        if (t != null) {
                            done.completeExceptionally(t);
                        } else {
                            done.complete(null);
                        }
                    });
                });
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Handler chain for '{}' abandoned: executor rejected continuation", envelope.type());
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    private void reportFailure(HandlerRegistration registration, MessageContext context, Throwable cause) {
        HandlerInvocationException failure =
                new HandlerInvocationException(registration.type(), registration.priority(), cause);
        LOGGER.warn("Error in handler for type {} (connection {})", registration.type(), context.connectionId(), cause);
        Envelope error = codec.error("Handler error", ErrorCodes.HANDLER_ERROR, HandlerInvocationException.describe(cause));
        try {
            context.onHandlerFailure(error, failure);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to report handler error to {}", context.connectionId(), e);
        }
    }

    private static Throwable failureOf(CompletableFuture<?> done) {
        if (!done.isCompletedExceptionally()) {
            return null;
        }
        try {
            done.join();
            return null;
        } catch (CompletionException | CancellationException e) {
            return unwrap(e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
