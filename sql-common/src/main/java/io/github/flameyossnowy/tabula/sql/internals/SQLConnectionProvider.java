package io.github.flameyossnowy.tabula.sql.internals;

import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Source of JDBC connections for one database.
 */
public interface SQLConnectionProvider extends AutoCloseable {
    @NotNull Connection getConnection() throws SQLException;

    default @NotNull PreparedStatement prepareStatement(@NotNull String sql, @NotNull Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    @Override
    void close();
}
