package io.github.flameyossnowy.tabula.sql.internals.migration;

import io.github.flameyossnowy.tabula.api.exceptions.RepositoryException;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.tabula.sql.internals.mapping.ModelMapper;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import io.github.flameyossnowy.tabula.sql.internals.repository.SqlWriteExecutor;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the tables a schema needs. Existing tables are left alone, so running it again is a no-op.
 * Each table is created on its own connection; there is no transaction across tables.
 */
public final class SchemaMigrator {
    private final SQLConnectionProvider dataSource;
    private final ModelMapper mapper;
    private final QueryParseEngine engine;
    private final SqlWriteExecutor writeExecutor;

    public SchemaMigrator(SQLConnectionProvider dataSource, ModelMapper mapper, QueryParseEngine engine, SqlWriteExecutor writeExecutor) {
        this.dataSource = dataSource;
        this.mapper = mapper;
        this.engine = engine;
        this.writeExecutor = writeExecutor;
    }

    /**
     * Ensures every record table, then every join table.
     */
    public void migrate() {
        Map<String, RelationMapping.JoinTable> joinTables = new LinkedHashMap<>();
        for (TableMapping mapping : mapper.mapAll()) {
            ensureTable(mapping.type());
            for (RelationMapping relation : mapping.relations().values()) {
                if (relation instanceof RelationMapping.JoinTable joinTable) {
                    joinTables.putIfAbsent(joinTable.table(), joinTable);
                }
            }
        }

        for (RelationMapping.JoinTable joinTable : joinTables.values()) {
            ensureJoinTable(joinTable);
        }
    }

    /**
     * @return true if the table was created
     */
    public boolean ensureTable(@NotNull String type) {
        TableMapping mapping = mapper.mapping(type);
        return createIfMissing(mapping.table(), engine.parseRepository(mapping));
    }

    /**
     * @return true if the table was created
     */
    public boolean ensureJoinTable(@NotNull RelationMapping.JoinTable joinTable) {
        return createIfMissing(joinTable.table(), engine.parseJoinTable(joinTable));
    }

    private boolean createIfMissing(String table, String ddl) {
        try (Connection connection = dataSource.getConnection()) {
            if (tableExists(connection, table)) {
                Logging.deepInfo(() -> "Table " + table + " already exists");
                return false;
            }

            Logging.deepInfo(() -> "Creating table " + table + ": " + ddl);
            writeExecutor.executeRaw(connection, ddl);
            if (!connection.getAutoCommit()) connection.commit();
            return true;
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    private static boolean tableExists(Connection connection, String table) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        try (ResultSet tables = metaData.getTables(null, null, table, new String[] {"TABLE"})) {
            return tables.next();
        }
    }
}
