package kr.crownrpg.relay.api.database;

/**
 * Unchecked wrapper for every storage failure surfaced through {@link DatabaseClient}.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseException(String message) {
        super(message);
    }
}
