package kr.crownrpg.relay.server.binder;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.crownrpg.relay.api.chat.ChatStore;
import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.core.chat.JdbcChatStore;
import kr.crownrpg.relay.core.database.JdbcDatabaseClient;
import kr.crownrpg.relay.server.config.DatabaseYamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 커넥션 풀과 채팅 저장소를 묶어 시작/종료한다. 시작 시 스키마를 동기로 확인한다.
 */
public final class DatabaseBinder implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseBinder.class);

    private final DatabaseYamlConfig config;
    private final ObjectMapper mapper;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private JdbcDatabaseClient client;
    private JdbcChatStore store;

    public DatabaseBinder(DatabaseYamlConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    public synchronized void start() {
        if (started.get()) {
            return;
        }
        try {
            this.client = JdbcDatabaseClient.create(config.toDatabaseConfig());
            this.store = new JdbcChatStore(client, mapper);
            store.initializeSchema().join();
            started.set(true);
            LOGGER.info("데이터베이스 연결이 성공적으로 완료되었습니다. ({})", config.toDatabaseConfig());
        } catch (CompletionException e) {
            closeClient();
            throw e.getCause() instanceof DatabaseException de ? de : new DatabaseException("Schema initialization failed", e.getCause());
        } catch (RuntimeException e) {
            closeClient();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!started.get()) {
            return;
        }
        try {
            closeClient();
        } finally {
            started.set(false);
        }
    }

    public ChatStore getStore() {
        return store;
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public void close() {
        stop();
    }

    private void closeClient() {
        if (client != null) {
            try {
                client.close();
            } catch (RuntimeException e) {
                LOGGER.error("데이터베이스 연결 종료 중 오류가 발생했습니다.", e);
            }
            client = null;
            store = null;
        }
    }
}
