package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.StringJoiner;

public final class UpdateSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public UpdateSqlBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * {@code UPDATE ... SET} every column in {@code setColumns}, restricted by equality on
     * {@code whereColumns}. Parameters bind in that order. Columns listed in {@code nullColumns}
     * are set to {@code NULL} without a parameter.
     */
    public String parseUpdate(
        @NotNull String table,
        @NotNull Collection<String> setColumns,
        @NotNull Collection<String> nullColumns,
        @NotNull Collection<String> whereColumns
    ) {
        if (setColumns.isEmpty() && nullColumns.isEmpty()) {
            throw new IllegalArgumentException("Nothing to update in " + table);
        }

        StringJoiner setClause = new StringJoiner(", ");
        for (String column : setColumns) {
            setClause.add(sqlType.quote(column) + " = ?");
        }
        for (String column : nullColumns) {
            setClause.add(sqlType.quote(column) + " = NULL");
        }

        StringJoiner whereClause = new StringJoiner(" AND ");
        for (String column : whereColumns) {
            whereClause.add(sqlType.quote(column) + " = ?");
        }

        return whereColumns.isEmpty()
            ? "UPDATE " + sqlType.quote(table) + " SET " + setClause
            : "UPDATE " + sqlType.quote(table) + " SET " + setClause + " WHERE " + whereClause;
    }
}
