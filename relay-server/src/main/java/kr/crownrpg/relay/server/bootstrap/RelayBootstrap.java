package kr.crownrpg.relay.server.bootstrap;

import kr.crownrpg.relay.api.chat.ChatStore;
import kr.crownrpg.relay.core.chat.ChatMessageHandlers;
import kr.crownrpg.relay.core.chat.EventLogRecorder;
import kr.crownrpg.relay.core.codec.EnvelopeCodec;
import kr.crownrpg.relay.core.connection.ConnectionRegistry;
import kr.crownrpg.relay.core.event.EventBridge;
import kr.crownrpg.relay.core.event.InMemoryEventBus;
import kr.crownrpg.relay.core.routing.HandlerTable;
import kr.crownrpg.relay.core.server.RealtimeServer;
import kr.crownrpg.relay.server.binder.DatabaseBinder;
import kr.crownrpg.relay.server.config.RelayConfig;
import kr.crownrpg.relay.server.lifecycle.CloseableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 설정을 읽어 이벤트 버스, (선택) 데이터베이스, 실시간 서버, 이벤트 브리지를 순서대로 띄운다.
 * 종료는 시작의 역순이다.
 */
public final class RelayBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayBootstrap.class);

    private final RelayConfig config;
    private final CloseableRegistry closeables = new CloseableRegistry();

    private InMemoryEventBus eventBus;
    private RealtimeServer server;
    private DatabaseBinder databaseBinder;
    private boolean started;

    public RelayBootstrap(RelayConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static RelayBootstrap fromDataDirectory(Path dataDirectory) {
        return new RelayBootstrap(RelayConfig.load(dataDirectory, RelayBootstrap.class.getClassLoader()));
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        try {
            EnvelopeCodec codec = new EnvelopeCodec();
            this.eventBus = new InMemoryEventBus(config.events().historySize());
            this.server = new RealtimeServer(config.server().toSettings(), eventBus, codec,
                    new ConnectionRegistry(), new HandlerTable());

            if (config.database().enabled()) {
                this.databaseBinder = closeables.register(new DatabaseBinder(config.database(), codec.mapper()));
                databaseBinder.start();
                ChatStore store = databaseBinder.getStore();
                EventLogRecorder recorder = closeables.register(new EventLogRecorder(eventBus, store));
                recorder.start();
                new ChatMessageHandlers(store, eventBus, codec).registerOn(server.handlers());
            } else {
                LOGGER.info("데이터베이스 비활성화: chat.message 저장과 이벤트 기록을 건너뜁니다");
            }

            EventBridge bridge = closeables.register(new EventBridge(eventBus, server.broadcaster(), codec.mapper(),
                    Set.copyOf(config.events().forwardTypes()), config.events().forwardConnectionEvents()));
            bridge.registerInbound(server.handlers());
            bridge.start();

            closeables.register(server);
            server.start();

            started = true;
            LOGGER.info("Relay bootstrap completed (handlers: {})", server.handlers().registeredTypes());
        } catch (RuntimeException e) {
            LOGGER.error("Failed to start relay server", e);
            closeables.closeAllQuietly();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        closeables.closeAllQuietly();
        started = false;
        LOGGER.info("Relay server stopped");
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public RelayConfig config() {
        return config;
    }

    public InMemoryEventBus eventBus() {
        return eventBus;
    }

    public RealtimeServer server() {
        return server;
    }

    public Optional<ChatStore> chatStore() {
        return databaseBinder == null ? Optional.empty() : Optional.ofNullable(databaseBinder.getStore());
    }
}
