package kr.crownrpg.relay.api.database;

import java.sql.Connection;
import java.sql.SQLException;

public interface ConnectionProvider extends AutoCloseable {

    Connection getConnection() throws SQLException;

    @Override
    void close();
}
