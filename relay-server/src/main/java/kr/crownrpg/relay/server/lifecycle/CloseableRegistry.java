package kr.crownrpg.relay.server.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * 시작 순서의 역순으로 자원을 닫는 스택.
 */
public final class CloseableRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(CloseableRegistry.class);

    private final Deque<AutoCloseable> stack = new ArrayDeque<>();

    public synchronized <T extends AutoCloseable> T register(T closeable) {
        Objects.requireNonNull(closeable, "closeable");
        stack.push(closeable);
        return closeable;
    }

    public synchronized int size() {
        return stack.size();
    }

    public synchronized void closeAllQuietly() {
        while (!stack.isEmpty()) {
            AutoCloseable c = stack.pop();
            try {
                c.close();
            } catch (Exception e) {
                LOGGER.warn("자원 종료에 실패했습니다: {}", c.getClass().getName(), e);
            }
        }
    }
}
