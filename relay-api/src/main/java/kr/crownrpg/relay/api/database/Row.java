package kr.crownrpg.relay.api.database;

import java.time.Instant;
import java.util.Optional;

/**
 * Result row detached from JDBC. Column lookups ignore case.
 */
public interface Row {

    String getString(String column);

    int getInt(String column);

    long getLong(String column);

    boolean getBoolean(String column);

    /**
     * @return the column as an instant, or {@code null} when the column is SQL NULL
     */
    Instant getInstant(String column);

    Optional<Object> get(String column);
}
