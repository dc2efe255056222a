package kr.crownrpg.relay.core.database;

import kr.crownrpg.relay.api.database.DatabaseConfig;
import kr.crownrpg.relay.api.database.DatabaseException;
import kr.crownrpg.relay.api.database.Row;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDatabaseClientTest {

    private JdbcDatabaseClient db;

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:client_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        db = JdbcDatabaseClient.create(new DatabaseConfig(url, "sa", "", 2, 0, 1000L));
        db.query(q -> q.executeUpdate(
                "CREATE TABLE notes (id INT PRIMARY KEY, body TEXT, created_at TIMESTAMP(3))")).join();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldReadRowsCaseInsensitively() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        db.query(q -> q.executeUpdate("INSERT INTO notes (id, body, created_at) VALUES (?, ?, ?)", 1, "hello", now))
                .join();

        Row row = db.query(q -> q.executeQueryOne("SELECT id, body, created_at FROM notes WHERE id = ?", 1))
                .join().orElseThrow();

        assertEquals(1, row.getInt("id"));
        assertEquals("hello", row.getString("BODY"));
        assertEquals(now, row.getInstant("created_at"));
    }

    @Test
    void shouldRollBackWhenActionThrows() {
        CompletionException e = assertThrows(CompletionException.class, () -> db.transaction(tx -> {
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 1, "lost");
            throw new IllegalStateException("abort");
        }).join());

        assertInstanceOf(DatabaseException.class, e.getCause());
        assertEquals(0, count());
    }

    @Test
    void shouldRollBackWhenMarkedRollbackOnly() {
        db.transaction(tx -> {
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 1, "lost");
            tx.rollback();
            return null;
        }).join();

        assertEquals(0, count());
    }

    @Test
    void shouldCommitSuccessfulTransaction() {
        db.transaction(tx -> {
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 1, "a");
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 2, "b");
            return null;
        }).join();

        assertEquals(2, count());
    }

    @Test
    void shouldKeepRunningStatementsAfterMarkedRollbackOnly() {
        Long seen = db.transaction(tx -> {
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 1, "lost");
            tx.rollback();
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 2, "lost");
            return tx.executeQueryOne("SELECT COUNT(*) AS total FROM notes").orElseThrow().getLong("total");
        }).join();

        assertEquals(2L, seen);
        assertEquals(0, count());
    }

    @Test
    void shouldRefuseStatementsAfterExplicitCommit() {
        CompletionException e = assertThrows(CompletionException.class, () -> db.transaction(tx -> {
            tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 1, "kept");
            tx.commit();
            return tx.executeUpdate("INSERT INTO notes (id, body) VALUES (?, ?)", 2, "refused");
        }).join());

        DatabaseException wrapped = assertInstanceOf(DatabaseException.class, e.getCause());
        assertInstanceOf(IllegalStateException.class, wrapped.getCause());
        assertEquals(1, count());
    }

    @Test
    void shouldWrapSqlErrors() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> db.query(q -> q.executeQuery("SELECT * FROM missing_table")).join());

        assertInstanceOf(DatabaseException.class, e.getCause());
    }

    @Test
    void shouldRefuseWorkAfterClose() {
        db.close();
        db.close();

        assertThrows(IllegalStateException.class, () -> db.query(q -> null));
    }

    private long count() {
        List<Row> rows = db.query(q -> q.executeQuery("SELECT COUNT(*) AS total FROM notes")).join();
        return rows.get(0).getLong("total");
    }
}
