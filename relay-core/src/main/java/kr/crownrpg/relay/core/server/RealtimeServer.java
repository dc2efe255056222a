package kr.crownrpg.relay.core.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketDecoderConfig;
import kr.crownrpg.relay.api.Preconditions;
import kr.crownrpg.relay.api.event.EventBus;
import kr.crownrpg.relay.api.lifecycle.ManagedLifecycle;
import kr.crownrpg.relay.api.message.Envelope;
import kr.crownrpg.relay.api.message.ErrorCodes;
import kr.crownrpg.relay.api.message.MessageTypes;
import kr.crownrpg.relay.core.broadcast.Broadcaster;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.codec.EnvelopeDecodeException;
import kr.crownrpg.relay.core.connection.Connection;
import kr.crownrpg.relay.core.connection.ConnectionListener;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.connection.RemovalReason;
import kr.crownrpg.relay.core.connection.TransportException;
import kr.crownrpg.relay.core.event.ConnectionEvents;
import kr.crownrpg.relay.core.heartbeat.HeartbeatMonitor;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.routing.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실시간 메시지를 중계하는 Netty WebSocket 서버 엔드포인트.
 * <p>
 * 업그레이드가 끝난 채널마다 {@link Connection}을 만들어 레지스트리에 등록하고, 텍스트 프레임을 디코딩해
 * {@link MessageRouter}로 넘긴다. 하트비트 스윕과 연결 수명주기 이벤트 발행도 이 클래스가 묶는다.
 */
public final class RealtimeServer implements ManagedLifecycle {

    static final String GREETING = "Connected to realtime relay server";

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeServer.class);

    private final RealtimeServerSettings settings;
    private final EventBus events;
    private final EnvelopeCodec codec;
    private final ConnectionRegistry registry;
    private final HandlerTable handlers;
    private final MessageRouter router;
    private final Broadcaster broadcaster;
    private final HeartbeatMonitor heartbeat;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RealtimeServer(RealtimeServerSettings settings, EventBus events) {
        this(settings, events, new EnvelopeCodec(), new ConnectionRegistry(), new HandlerTable());
    }

    public RealtimeServer(RealtimeServerSettings settings,
                          EventBus events,
                          EnvelopeCodec codec,
                          ConnectionRegistry registry,
                          HandlerTable handlers) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.events = Objects.requireNonNull(events, "events");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.router = new MessageRouter(handlers, codec);
        this.broadcaster = new Broadcaster(registry, codec);
        this.heartbeat = new HeartbeatMonitor(registry, settings.heartbeatInterval());
        new ControlHandlers(registry, codec).registerOn(handlers);
        registry.addListener(new LifecycleEventEmitter());
    }

    /**
     * 서버를 바인딩하고 하트비트 스윕을 시작한다. 이미 시작된 경우 아무 것도 하지 않는다.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
                    .websocketPath(settings.path())
                    .checkStartsWith(true)
                    .dropPongFrames(false)
                    .decoderConfig(WebSocketDecoderConfig.newBuilder()
                            .maxFramePayloadLength(settings.maxFrameBytes())
                            .build())
                    .build();
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpObjectAggregator(settings.maxFrameBytes()))
                                    .addLast(new WebSocketServerProtocolHandler(protocolConfig))
                                    .addLast(new WebSocketFrameAggregator(settings.maxFrameBytes()))
                                    .addLast(new RealtimeServerHandler(RealtimeServer.this));
                        }
                    });
            ChannelFuture future = bootstrap.bind(new InetSocketAddress(settings.host(), settings.port())).sync();
            serverChannel = future.channel();
            heartbeat.start();
            LOGGER.info("실시간 서버 시작: ws://{}:{}{}", settings.host(), port(), settings.path());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("Interrupted while starting realtime server", e);
        } catch (Exception e) {
            LOGGER.error("실시간 서버 시작 실패", e);
            stop();
            throw new IllegalStateException("Failed to start realtime server", e);
        }
    }

    public boolean isStarted() {
        return started.get() && serverChannel != null && serverChannel.isActive();
    }

    /**
     * Bound port; differs from the configured one when that was {@code 0}.
     */
    public int port() {
        Channel channel = serverChannel;
        if (channel != null && channel.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return settings.port();
    }

    /**
     * 하트비트를 멈추고 모든 연결을 닫은 뒤 이벤트 루프를 해제한다.
     */
    @Override
    public void stop() {
        if (!started.get()) {
            return;
        }
        heartbeat.stop();
        registry.closeAll();
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        started.set(false);
        LOGGER.info("실시간 서버 중지");
    }

    public List<ClientInfo> connectedClients() {
        List<ClientInfo> clients = new ArrayList<>();
        for (Connection connection : registry.snapshot()) {
            clients.add(new ClientInfo(connection.id(), connection.metadata()));
        }
        return clients;
    }

    public RealtimeServerSettings settings() {
        return settings;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public HandlerTable handlers() {
        return handlers;
    }

    public MessageRouter router() {
        return router;
    }

    public Broadcaster broadcaster() {
        return broadcaster;
    }

    public HeartbeatMonitor heartbeat() {
        return heartbeat;
    }

    String accept(Channel channel, String userAgent) {
        NettyConnectionTransport transport = new NettyConnectionTransport(channel);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(Connection.META_REMOTE_ADDRESS, transport.remoteAddress());
        metadata.put(Connection.META_CONNECTED_AT, Instant.now().toString());
        if (userAgent != null && !userAgent.isBlank()) {
            metadata.put(Connection.META_USER_AGENT, userAgent);
        }
        Connection connection = new Connection(Connection.nextId(), transport, metadata);
        registry.add(connection);
        LOGGER.info("클라이언트 연결: {} ({})", connection.id(), transport.remoteAddress());

        ObjectNode greeting = codec.mapper().createObjectNode();
        greeting.put("clientId", connection.id());
        greeting.put("timestamp", Instant.now().toString());
        greeting.put("message", GREETING);
        send(connection, codec.envelope(MessageTypes.CONNECTION, greeting));
        return connection.id();
    }

    void onText(Channel channel, String connectionId, String text) {
        Connection connection = registry.find(connectionId).orElse(null);
        if (connection == null) {
            LOGGER.debug("Dropping message from unregistered connection {}", connectionId);
            return;
        }
        Envelope envelope;
        try {
            envelope = codec.decode(text);
        } catch (EnvelopeDecodeException e) {
            LOGGER.warn("Error processing message from {}: {}", connectionId, e.getMessage());
            send(connection, codec.error("Message processing error", ErrorCodes.MESSAGE_PROCESSING_ERROR, e.getMessage()));
            return;
        }
        router.dispatch(ServerMessageContext.forChannel(connection, codec, channel), envelope)
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        LOGGER.warn("Dispatch of {} for {} did not complete", envelope.type(), connectionId, failure);
                    }
                });
    }

    void onPong(String connectionId) {
        registry.find(connectionId).ifPresent(Connection::markAlive);
    }

    void onUnsupportedFrame(String connectionId) {
        registry.find(connectionId).ifPresent(connection -> send(connection,
                codec.error("Binary frames are not supported", ErrorCodes.UNSUPPORTED_FRAME, null)));
    }

    void onClosed(String connectionId) {
        registry.remove(connectionId, RemovalReason.CLOSED);
    }

    void onTransportError(String connectionId, Throwable cause) {
        if (registry.find(connectionId).isEmpty()) {
            return;
        }
        ObjectNode data = codec.mapper().createObjectNode();
        data.put("clientId", connectionId);
        data.put("error", String.valueOf(cause.getMessage()));
        events.emit(ConnectionEvents.CLIENT_ERROR, data, ConnectionEvents.SOURCE);
        registry.remove(connectionId, RemovalReason.TRANSPORT_ERROR);
    }

    private void send(Connection connection, Envelope envelope) {
        try {
            connection.send(codec.encodeToString(envelope));
        } catch (TransportException e) {
            LOGGER.debug("Could not send {} to {}: {}", envelope.type(), connection.id(), e.getMessage());
        }
    }

    private final class LifecycleEventEmitter implements ConnectionListener {

        @Override
        public void onConnected(Connection connection) {
            ObjectNode data = codec.mapper().createObjectNode();
            data.put("clientId", connection.id());
            data.set("metadata", codec.mapper().valueToTree(connection.metadata()));
            events.emit(ConnectionEvents.CLIENT_CONNECTED, data, ConnectionEvents.SOURCE);
        }

        @Override
        public void onDisconnected(Connection connection, RemovalReason reason) {
            LOGGER.info("클라이언트 연결 해제: {} ({})", connection.id(), reason);
            ObjectNode data = codec.mapper().createObjectNode();
            data.put("clientId", connection.id());
            data.put("reason", reason.name().toLowerCase(Locale.ROOT));
            events.emit(ConnectionEvents.CLIENT_DISCONNECTED, data, ConnectionEvents.SOURCE);
        }
    }
}
