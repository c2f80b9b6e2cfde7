package io.github.flameyossnowy.tabula.sql.internals.repository;

import io.github.flameyossnowy.tabula.api.exceptions.RepositoryException;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs selects on the connection of the current batch.
 */
public class SqlReadExecutor {
    private final SQLConnectionProvider dataSource;
    private final SqlResultMapper resultMapper;

    public SqlReadExecutor(SQLConnectionProvider dataSource, SqlResultMapper resultMapper) {
        this.dataSource = dataSource;
        this.resultMapper = resultMapper;
    }

    public @NotNull List<GraphRecord> search(@NotNull Connection connection, @NotNull String sql, @NotNull StatementSetter setter, @NotNull String type) {
        Logging.info(() -> "Executing query: " + sql);
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            setter.set(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultMapper.mapResults(resultSet, type);
            }
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    /**
     * The first matching row, or null.
     */
    public @Nullable Map<String, Object> findRow(@NotNull Connection connection, @NotNull String sql, @NotNull StatementSetter setter) {
        Logging.info(() -> "Executing query: " + sql);
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            setter.set(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultMapper.readRow(resultSet) : null;
            }
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    /**
     * Values of the first column as strings.
     */
    public @NotNull List<String> queryIds(@NotNull Connection connection, @NotNull String sql, @NotNull StatementSetter setter) {
        Logging.info(() -> "Executing query: " + sql);
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            setter.set(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultMapper.extractIds(resultSet);
            }
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    public boolean exists(@NotNull Connection connection, @NotNull String sql, @NotNull StatementSetter setter) {
        Logging.info(() -> "Executing query: " + sql);
        try (PreparedStatement statement = dataSource.prepareStatement(sql, connection)) {
            setter.set(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }
}
