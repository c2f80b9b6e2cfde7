package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.StringJoiner;

public final class DeleteSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public DeleteSqlBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    public String parseDelete(@NotNull String table, @NotNull Collection<String> whereColumns) {
        if (whereColumns.isEmpty()) {
            return "DELETE FROM " + sqlType.quote(table);
        }

        StringJoiner whereClause = new StringJoiner(" AND ");
        for (String column : whereColumns) {
            whereClause.add(sqlType.quote(column) + " = ?");
        }
        return "DELETE FROM " + sqlType.quote(table) + " WHERE " + whereClause;
    }
}
