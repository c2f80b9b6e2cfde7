package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.StringJoiner;

public final class InsertSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public InsertSqlBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    public String parseInsert(@NotNull String table, @NotNull Collection<String> columns) {
        StringJoiner columnJoiner = new StringJoiner(", ");
        StringJoiner joiner = new StringJoiner(", ");
        for (String column : columns) {
            columnJoiner.add(sqlType.quote(column));
            joiner.add("?");
        }

        return "INSERT INTO " + sqlType.quote(table) + " (" + columnJoiner + ") VALUES (" + joiner + ')';
    }
}
