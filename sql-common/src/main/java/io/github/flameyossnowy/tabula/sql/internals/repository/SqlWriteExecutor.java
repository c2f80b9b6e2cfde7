package io.github.flameyossnowy.tabula.sql.internals.repository;

import io.github.flameyossnowy.tabula.api.exceptions.RepositoryException;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Runs inserts, updates, deletes and DDL on a caller-supplied connection. Transaction boundaries
 * belong to the caller.
 */
public final class SqlWriteExecutor {
    private final SQLConnectionProvider dataSource;

    public SqlWriteExecutor(SQLConnectionProvider dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return the number of affected rows
     */
    public int executeUpdate(@NotNull Connection connection, @NotNull String sql, @NotNull StatementSetter setter) {
        Logging.info(() -> "Executing update: " + sql);
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            setter.set(statement);
            int rows = statement.executeUpdate();
            Logging.deepInfo(() -> "Affected rows: " + rows);
            return rows;
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    public void executeRaw(@NotNull Connection connection, @NotNull String sql) {
        executeUpdate(connection, sql, StatementSetter.NONE);
    }
}
