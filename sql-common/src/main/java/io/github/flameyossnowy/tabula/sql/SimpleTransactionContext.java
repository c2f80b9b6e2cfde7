package io.github.flameyossnowy.tabula.sql;

import io.github.flameyossnowy.tabula.api.connection.TransactionContext;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction over a single JDBC connection with auto-commit disabled. Closing the context
 * closes the connection.
 */
public class SimpleTransactionContext implements TransactionContext<Connection> {
    private final Connection connection;

    public SimpleTransactionContext(@NotNull Connection connection) throws SQLException {
        this.connection = connection;
        connection.setAutoCommit(false);
    }

    @Override
    public @NotNull Connection connection() {
        return connection;
    }

    @Override
    public void commit() throws SQLException {
        connection.commit();
    }

    @Override
    public void rollback() throws SQLException {
        connection.rollback();
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
