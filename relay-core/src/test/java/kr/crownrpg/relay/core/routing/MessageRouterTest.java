package kr.crownrpg.relay.core.routing;

import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.ErrorCodes;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class MessageRouterTest {

    private HandlerTable table;
    private MessageRouter router;
    private RecordingContext context;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        table = new HandlerTable();
        router = new MessageRouter(table, new EnvelopeCodec());
        context = new RecordingContext();
        calls = new CopyOnWriteArrayList<>();
    }

    @Test
    void shouldCompleteImmediatelyForUnknownType() {
        CompletableFuture<Void> done = router.dispatch(context, Envelope.of("nobody.listens", null));

        assertTrue(done.isDone());
        assertTrue(context.replies.isEmpty());
        assertTrue(context.errors.isEmpty());
    }

    @Test
    void shouldRunHandlersInPriorityOrder() {
        table.register("t", (ctx, env) -> calls.add("p1"), 1);
        table.register("t", (ctx, env) -> calls.add("p10"), 10);
        table.register("t", (ctx, env) -> calls.add("p5"), 5);

        router.dispatch(context, Envelope.of("t", null)).join();

        assertEquals(List.of("p10", "p5", "p1"), calls);
    }

    @Test
    void shouldIsolateFailingHandlerAndReportOneError() {
        table.register("t", (ctx, env) -> {
            throw new IllegalStateException("boom");
        }, 10);
        table.register("t", (ctx, env) -> calls.add("p5-first"), 5);
        table.register("t", (ctx, env) -> calls.add("p5-second"), 5);
        table.register("t", (ctx, env) -> calls.add("p1"), 1);

        router.dispatch(context, Envelope.of("t", null)).join();

        assertEquals(List.of("p5-first", "p5-second", "p1"), calls);
        assertEquals(1, context.errors.size());
        Envelope error = context.errors.get(0);
        assertEquals(MessageTypes.ERROR, error.type());
        assertEquals("Handler error", error.data().get("message").asText());
        assertEquals(ErrorCodes.HANDLER_ERROR, error.data().get("code").asText());
        assertEquals("boom", error.data().get("details").asText());
        assertEquals(10, context.failures.get(0).priority());
        assertEquals("t", context.failures.get(0).messageType());
    }

    @Test
    void shouldFallBackToExceptionNameWhenMessageMissing() {
        table.register("t", (ctx, env) -> {
            throw new UnsupportedOperationException();
        });

        router.dispatch(context, Envelope.of("t", null)).join();

        assertEquals("UnsupportedOperationException", context.errors.get(0).data().get("details").asText());
    }

    @Test
    void shouldWaitForAsyncHandlerBeforeRunningNext() {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        table.registerAsync("t", (ctx, env) -> gate.thenRun(() -> calls.add("async")), 10);
        table.register("t", (ctx, env) -> calls.add("sync"), 1);

        CompletableFuture<Void> done = router.dispatch(context, Envelope.of("t", null));

        assertFalse(done.isDone());
        assertTrue(calls.isEmpty());

        gate.complete(null);
        done.join();

        assertEquals(List.of("async", "sync"), calls);
    }

    @Test
    void shouldReportAsyncFailureAndContinue() {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        table.registerAsync("t", (ctx, env) -> gate, 10);
        table.register("t", (ctx, env) -> calls.add("after"), 1);

        CompletableFuture<Void> done = router.dispatch(context, Envelope.of("t", null));
        gate.completeExceptionally(new IllegalArgumentException("bad payload"));
        done.join();

        assertEquals(List.of("after"), calls);
        assertEquals(1, context.errors.size());
        assertEquals("bad payload", context.errors.get(0).data().get("details").asText());
    }

    @Test
    void shouldTreatAlreadyFailedStageLikeThrow() {
        table.registerAsync("t", (ctx, env) -> CompletableFuture.failedFuture(new IllegalStateException("early")), 10);
        table.register("t", (ctx, env) -> calls.add("after"), 1);

        CompletableFuture<Void> done = router.dispatch(context, Envelope.of("t", null));

        assertTrue(done.isDone());
        assertEquals(List.of("after"), calls);
        assertEquals("early", context.errors.get(0).data().get("details").asText());
    }

    @Test
    void shouldLetHandlersReplyThroughContext() {
        table.register("t", (ctx, env) -> ctx.reply(Envelope.of("t.ack", null)));

        router.dispatch(context, Envelope.of("t", null)).join();

        assertEquals("t.ack", context.replies.get(0).type());
    }

    @Test
    void shouldSurviveFailingErrorReport() {
        MessageContext broken = new RecordingContext() {
            @Override
            public void onHandlerFailure(Envelope error, HandlerInvocationException failure) {
                throw new IllegalStateException("peer gone");
            }
        };
        table.register("t", (ctx, env) -> {
            throw new IllegalStateException("boom");
        }, 2);
        table.register("t", (ctx, env) -> calls.add("after"), 1);

        assertDoesNotThrow(() -> router.dispatch(broken, Envelope.of("t", null)).join());
        assertEquals(List.of("after"), calls);
    }
}
