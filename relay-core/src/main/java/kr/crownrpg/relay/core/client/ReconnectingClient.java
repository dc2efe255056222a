package kr.crownrpg.relay.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import kr.crownrpg.relay.api.client.ClientState;
import kr.crownrpg.relay.api.client.ClientStateListener;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.codec.EnvelopeDecodeException;
import kr.crownrpg.relay.core.internal.ThreadFactories;
import kr.crownrpg.relay.core.routing.AsyncMessageHandler;
import kr.crownrpg.relay.core.routing.HandlerRegistration;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageHandler;
import kr.crownrpg.relay.core.routing.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * WebSocket client with a reconnect state machine.
 * <p>
 * {@code DISCONNECTED → CONNECTING → CONNECTED → (DISCONNECTED | ERROR) → CONNECTING …}. After a drop or a failed
 * attempt a reconnect is scheduled {@code reconnectInterval} later as long as fewer than {@code maxReconnectAttempts}
 * have been scheduled since the last successful open or explicit {@link #connect()}. {@link #disconnect()} cancels
 * every timer and stops automatic reconnection until {@code connect()} is called again.
 * <p>
 * State listeners run synchronously, in registration order, on the thread that caused the transition.
 */
public final class ReconnectingClient implements AutoCloseable {

    public static final int DEFAULT_HANDLER_PRIORITY = 1000;
    static final String USER_AGENT = "crown-relay-client";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectingClient.class);

    private final ClientSettings settings;
    private final EnvelopeCodec codec;
    private final HandlerTable handlers;
    private final MessageRouter router;
    private final EventLoopGroup group;
    private final List<ClientStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    private volatile ClientState state = ClientState.DISCONNECTED;
    private volatile Channel channel;
    private volatile String clientId;

    // guarded by this
    private long session;
    private long settledSession;
    private int reconnectAttempts;
    private boolean autoReconnect;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> heartbeatTask;
    private boolean destroyed;

    public ReconnectingClient(ClientSettings settings) {
        this(settings, new EnvelopeCodec(), new HandlerTable());
    }

    public ReconnectingClient(ClientSettings settings, EnvelopeCodec codec, HandlerTable handlers) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.router = new MessageRouter(handlers, codec);
        this.group = new NioEventLoopGroup(1, ThreadFactories.named("relay-client"));
        registerDefaultHandlers();
    }

    /**
     * Opens the transport. Only valid from {@code DISCONNECTED} or {@code ERROR}; resets the reconnect counter.
     *
     * @return whether a connection attempt was started
     */
    public synchronized boolean connect() {
        if (destroyed) {
            throw new IllegalStateException("client has been destroyed");
        }
        if (state == ClientState.CONNECTING || state == ClientState.CONNECTED) {
            LOGGER.debug("connect() ignored in state {}", state);
            return false;
        }
        autoReconnect = true;
        reconnectAttempts = 0;
        cancel(reconnectTask);
        reconnectTask = null;
        openTransport();
        return true;
    }

    /**
     * Closes the transport and cancels every timer. No reconnect is scheduled afterwards.
     */
    public synchronized void disconnect() {
        autoReconnect = false;
        cancel(reconnectTask);
        cancel(heartbeatTask);
        reconnectTask = null;
        heartbeatTask = null;
        // events of the abandoned attempt are ignored from here on
        session++;
        Channel current = channel;
        channel = null;
        if (current != null) {
            if (current.isActive()) {
                current.writeAndFlush(new CloseWebSocketFrame());
            }
            current.close();
        }
        setState(ClientState.DISCONNECTED);
    }

    /**
     * Disconnects, drops every handler and listener and releases the event loop.
     */
    public void destroy() {
        synchronized (this) {
            if (destroyed) {
                return;
            }
            disconnect();
            destroyed = true;
        }
        handlers.clear();
        stateListeners.clear();
        errorListeners.clear();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        LOGGER.info("실시간 클라이언트 종료");
    }

    @Override
    public void close() {
        destroy();
    }

    public boolean send(String type, Object payload) {
        return send(codec.envelope(type, payload));
    }

    /**
     * @return {@code false} with a warning unless the client is {@code CONNECTED}
     */
    public boolean send(Envelope envelope) {
        Channel current = channel;
        if (state != ClientState.CONNECTED || current == null || !current.isActive()) {
            LOGGER.warn("WebSocket not connected, cannot send message: {}", envelope.type());
            return false;
        }
        current.writeAndFlush(new TextWebSocketFrame(codec.encodeToString(envelope)));
        return true;
    }

    public boolean subscribe(Collection<String> eventTypes) {
        return send(MessageTypes.SUBSCRIBE, Map.of("eventTypes", List.copyOf(eventTypes)));
    }

    public boolean unsubscribe(Collection<String> eventTypes) {
        return send(MessageTypes.UNSUBSCRIBE, Map.of("eventTypes", List.copyOf(eventTypes)));
    }

    public HandlerRegistration register(String type, MessageHandler handler) {
        return handlers.register(type, handler);
    }

    public HandlerRegistration register(String type, MessageHandler handler, int priority) {
        return handlers.register(type, handler, priority);
    }

    public HandlerRegistration registerAsync(String type, AsyncMessageHandler handler, int priority) {
        return handlers.registerAsync(type, handler, priority);
    }

    public boolean unregister(String type) {
        return handlers.unregister(type);
    }

    public boolean unregister(String type, MessageHandler handler) {
        return handlers.unregister(type, handler);
    }

    /**
     * @return a callback removing the listener again
     */
    public Runnable onStateChange(ClientStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    /**
     * Listens for transport errors and local handler failures.
     */
    public Runnable onError(Consumer<Throwable> listener) {
        Objects.requireNonNull(listener, "listener");
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    public ClientState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ClientState.CONNECTED;
    }

    /**
     * Id the server assigned in its {@code connection} greeting, or {@code null} before it arrived.
     */
    public String clientId() {
        return clientId;
    }

    public synchronized int reconnectAttempts() {
        return reconnectAttempts;
    }

    public ClientSettings settings() {
        return settings;
    }

    public HandlerTable handlers() {
        return handlers;
    }

    // --- transport callbacks ---

    synchronized void onOpen(long attempt, Channel opened) {
        if (attempt != session) {
            opened.close();
            return;
        }
        channel = opened;
        reconnectAttempts = 0;
        setState(ClientState.CONNECTED);
        startHeartbeat();
    }

    void onText(long attempt, Channel source, String text) {
        if (attempt != currentSession()) {
            return;
        }
        Envelope envelope;
        try {
            envelope = codec.decode(text);
        } catch (EnvelopeDecodeException e) {
            LOGGER.warn("Failed to parse WebSocket message: {}", e.getMessage());
            reportError(e);
            return;
        }
        router.dispatch(new ClientMessageContext(this, source.eventLoop()), envelope);
    }

    void onTransportClosed(long attempt) {
        settle(attempt, ClientState.DISCONNECTED, null);
    }

    void onTransportError(long attempt, Throwable cause) {
        settle(attempt, ClientState.ERROR, cause);
    }

    void reportError(Throwable error) {
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(error);
            } catch (RuntimeException e) {
                LOGGER.warn("Error listener failed", e);
            }
        }
    }

    private synchronized long currentSession() {
        return session;
    }

    /**
     * Ends an attempt once; the first of error or close decides the resulting state.
     */
    private void settle(long attempt, ClientState next, Throwable cause) {
        synchronized (this) {
            if (attempt != session || settledSession == attempt) {
                return;
            }
            settledSession = attempt;
            channel = null;
            clientId = null;
            cancel(heartbeatTask);
            heartbeatTask = null;
            if (cause != null) {
                LOGGER.warn("실시간 클라이언트 연결 오류: {}", cause.toString());
            }
            setState(next);
            if (autoReconnect && settings.reconnectEnabled()) {
                scheduleReconnect();
            }
        }
        if (cause != null) {
            reportError(cause);
        }
    }

    private void scheduleReconnect() {
        if (reconnectAttempts >= settings.maxReconnectAttempts()) {
            LOGGER.warn("재연결 최대 시도({})를 초과하여 중단합니다", settings.maxReconnectAttempts());
            return;
        }
        reconnectAttempts++;
        long delayMillis = settings.reconnectInterval().toMillis();
        LOGGER.info("실시간 클라이언트 재연결 대기 {}ms (시도 {}/{})", delayMillis, reconnectAttempts, settings.maxReconnectAttempts());
        reconnectTask = group.schedule(this::reconnect, delayMillis, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        if (!autoReconnect || destroyed || state == ClientState.CONNECTING || state == ClientState.CONNECTED) {
            return;
        }
        openTransport();
    }

    private void openTransport() {
        long attempt = ++session;
        setState(ClientState.CONNECTING);
        SslContext sslContext;
        try {
            sslContext = settings.secure() ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            onTransportError(attempt, e);
            return;
        }
        HttpHeaders headers = new DefaultHttpHeaders().set(HttpHeaderNames.USER_AGENT, USER_AGENT);
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                settings.url(), WebSocketVersion.V13, null, true, headers, settings.maxFrameBytes());
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (sslContext != null) {
                            ch.pipeline().addLast(sslContext.newHandler(ch.alloc(), settings.host(), settings.port()));
                        }
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(8192))
                                .addLast(new WebSocketClientProtocolHandler(handshaker, true, true))
                                .addLast(new WebSocketFrameAggregator(settings.maxFrameBytes()))
                                .addLast(new RealtimeClientHandler(ReconnectingClient.this, attempt));
                    }
                });
        LOGGER.info("실시간 서버 연결 시도: {}", settings.url());
        ChannelFuture future = bootstrap.connect(settings.host(), settings.port());
        future.addListener(result -> {
            if (!result.isSuccess()) {
                onTransportError(attempt, result.cause());
            }
        });
    }

    private void startHeartbeat() {
        if (!settings.heartbeatEnabled()) {
            return;
        }
        long period = settings.heartbeatInterval().toMillis();
        heartbeatTask = group.scheduleAtFixedRate(
                () -> send(codec.envelope(MessageTypes.PING, null)), period, period, TimeUnit.MILLISECONDS);
    }

    private void setState(ClientState next) {
        ClientState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.info("실시간 클라이언트 상태 변경: {} -> {}", previous, next);
        for (ClientStateListener listener : stateListeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (RuntimeException e) {
                LOGGER.warn("State listener failed on {} -> {}", previous, next, e);
            }
        }
    }

    private void registerDefaultHandlers() {
        handlers.register(MessageTypes.CONNECTION, (context, envelope) -> {
            JsonNode data = envelope.data();
            String assigned = data == null ? null : data.path("clientId").asText(null);
            if (assigned != null) {
                clientId = assigned;
                LOGGER.info("서버가 할당한 클라이언트 ID: {}", assigned);
            }
        }, DEFAULT_HANDLER_PRIORITY);
        handlers.register(MessageTypes.PONG,
                (context, envelope) -> LOGGER.debug("Received pong from server"), DEFAULT_HANDLER_PRIORITY);
        handlers.register(MessageTypes.ERROR,
                (context, envelope) -> LOGGER.warn("Server error: {}", envelope.data()), DEFAULT_HANDLER_PRIORITY);
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
