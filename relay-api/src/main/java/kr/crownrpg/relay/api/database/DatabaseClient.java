package kr.crownrpg.relay.api.database;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

public interface DatabaseClient extends AutoCloseable {

    /**
     * 단일 쿼리 실행 (auto-commit, 커넥션 1회 사용)
     */
    <T> CompletableFuture<T> query(Function<QueryExecutor, T> action);

    /**
     * 트랜잭션 실행. action이 예외를 던지면 롤백된다.
     */
    <T> CompletableFuture<T> transaction(Function<Transaction, T> action);

    @Override
    void close();
}
