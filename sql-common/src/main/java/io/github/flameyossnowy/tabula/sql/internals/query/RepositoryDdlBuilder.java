package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.api.schema.AttributeDefinition;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@code CREATE TABLE} statements for record tables and join tables.
 */
public final class RepositoryDdlBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public RepositoryDdlBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Record table: {@code id} primary key, both timestamp columns, one column per declared
     * attribute and one nullable key column per owned single-valued relationship.
     */
    public @NotNull String parseRepository(@NotNull TableMapping mapping) {
        Logging.deepInfo(() -> "Starting repository parse: " + mapping.table());

        String ddlPrefix = "CREATE TABLE " + sqlType.quote(mapping.table());
        StringJoiner joiner = new StringJoiner(", ", ddlPrefix + " (", ")");
        Set<String> columns = new HashSet<>(TableMapping.reservedColumns());

        joiner.add(sqlType.quote(TableMapping.ID_COLUMN) + ' ' + sqlType.keyColumnType() + " NOT NULL");
        joiner.add(timestampColumn(TableMapping.CREATED_AT_COLUMN));
        joiner.add(timestampColumn(TableMapping.UPDATED_AT_COLUMN));

        for (AttributeDefinition attribute : mapping.model().attributes().values()) {
            String column = mapping.column(attribute.name());
            if (column == null || !columns.add(column)) {
                Logging.deepInfo(() -> "Skipping column for attribute: " + attribute.name());
                continue;
            }

            String columnSql = sqlType.quote(column) + ' ' + sqlType.columnType(attribute.type());
            Logging.deepInfo(() -> "Generated column SQL: " + columnSql);
            joiner.add(columnSql);
        }

        for (RelationMapping relation : mapping.relations().values()) {
            if (!(relation instanceof RelationMapping.OwnedForeignKey owned) || !columns.add(owned.column())) continue;

            String columnSql = sqlType.quote(owned.column()) + ' ' + sqlType.keyColumnType();
            Logging.deepInfo(() -> "Generated key column SQL: " + columnSql);
            joiner.add(columnSql);
        }

        joiner.add("PRIMARY KEY (" + sqlType.quote(TableMapping.ID_COLUMN) + ')');

        String finalQuery = joiner.toString();
        Logging.deepInfo(() -> "Final CREATE TABLE query:\n" + finalQuery);
        return finalQuery;
    }

    /**
     * Join table with the two key columns only; no primary key and no uniqueness constraint.
     */
    public @NotNull String parseJoinTable(@NotNull RelationMapping.JoinTable joinTable) {
        String ddlPrefix = "CREATE TABLE " + sqlType.quote(joinTable.table());

        String[] columns = { joinTable.ownerColumn(), joinTable.relatedColumn() };
        Arrays.sort(columns);

        StringJoiner joiner = new StringJoiner(", ", ddlPrefix + " (", ")");
        for (String column : columns) {
            joiner.add(sqlType.quote(column) + ' ' + sqlType.keyColumnType() + " NOT NULL");
        }

        String finalQuery = joiner.toString();
        Logging.deepInfo(() -> "Final CREATE TABLE query for join table:\n" + finalQuery);
        return finalQuery;
    }

    private String timestampColumn(String column) {
        return sqlType.quote(column) + ' ' + sqlType.timestampType() + " DEFAULT CURRENT_TIMESTAMP NOT NULL";
    }
}
