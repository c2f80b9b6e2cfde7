package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.api.options.PageOption;
import io.github.flameyossnowy.tabula.api.options.SortOption;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

public final class SelectSqlBuilder {
    private static final String TARGET_ALIAS = "t";
    private static final String JOIN_ALIAS = "j";

    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    public SelectSqlBuilder(
        QueryParseEngine.SQLType sqlType,
        SqlConditionBuilder conditionBuilder,
        SqlSortBuilder sortBuilder
    ) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;
    }

    public String parseSelectById(@NotNull TableMapping mapping) {
        return "SELECT * FROM " + sqlType.quote(mapping.table()) + " WHERE " + sqlType.quote(TableMapping.ID_COLUMN) + " = ?";
    }

    public String parseSelectByIds(@NotNull TableMapping mapping, int count) {
        return "SELECT * FROM " + sqlType.quote(mapping.table())
            + " WHERE " + sqlType.quote(TableMapping.ID_COLUMN)
            + " IN (" + String.join(", ", Collections.nCopies(count, "?")) + ')';
    }

    /**
     * Single column of the rows matching every {@code whereColumns} equality.
     */
    public String parseSelectColumn(@NotNull String table, @NotNull String column, @NotNull List<String> whereColumns) {
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(sqlType.quote(column))
            .append(" FROM ")
            .append(sqlType.quote(table));
        appendEqualities(sql, whereColumns);
        return sql.toString();
    }

    public String parseExists(@NotNull String table, @NotNull List<String> whereColumns) {
        StringBuilder sql = new StringBuilder("SELECT 1 FROM ").append(sqlType.quote(table));
        appendEqualities(sql, whereColumns);
        return sql.toString();
    }

    /**
     * Filtered, sorted and paged scan of one table.
     */
    public String parseSelect(
        @NotNull TableMapping mapping,
        @NotNull List<FilterOption> filters,
        @NotNull List<SortOption> sort,
        @Nullable PageOption page
    ) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(sqlType.quote(mapping.table()));

        if (!filters.isEmpty()) {
            sql.append(" WHERE ").append(conditionBuilder.buildConditions(mapping, filters, null));
        }

        appendSortingAndPage(mapping, sort, page, sql, null);
        return sql.toString();
    }

    /**
     * Members of a collection relationship stored as a key column on the target table. The first
     * parameter is the owner id, followed by the filter values.
     */
    public String parseSelectByOwner(
        @NotNull RelationMapping.TargetForeignKey relation,
        @NotNull TableMapping target,
        @NotNull List<FilterOption> filters,
        @NotNull List<SortOption> sort,
        @Nullable PageOption page
    ) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ")
            .append(sqlType.quote(target.table()))
            .append(" WHERE ")
            .append(sqlType.quote(relation.inverseColumn()))
            .append(" = ?");

        if (!filters.isEmpty()) {
            sql.append(" AND ").append(conditionBuilder.buildConditions(target, filters, null));
        }

        appendSortingAndPage(target, sort, page, sql, null);
        return sql.toString();
    }

    /**
     * Members of a collection relationship stored in a join table. The first parameter is the
     * owner id, followed by the filter values.
     */
    public String parseSelectThrough(
        @NotNull RelationMapping.JoinTable relation,
        @NotNull TableMapping target,
        @NotNull List<FilterOption> filters,
        @NotNull List<SortOption> sort,
        @Nullable PageOption page
    ) {
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(TARGET_ALIAS).append(".* FROM ")
            .append(sqlType.quote(target.table())).append(' ').append(TARGET_ALIAS)
            .append(" INNER JOIN ")
            .append(sqlType.quote(relation.table())).append(' ').append(JOIN_ALIAS)
            .append(" ON ")
            .append(sqlType.qualify(JOIN_ALIAS, relation.relatedColumn()))
            .append(" = ")
            .append(sqlType.qualify(TARGET_ALIAS, TableMapping.ID_COLUMN))
            .append(" WHERE ")
            .append(sqlType.qualify(JOIN_ALIAS, relation.ownerColumn()))
            .append(" = ?");

        if (!filters.isEmpty()) {
            sql.append(" AND ").append(conditionBuilder.buildConditions(target, filters, TARGET_ALIAS));
        }

        appendSortingAndPage(target, sort, page, sql, TARGET_ALIAS);
        return sql.toString();
    }

    private void appendEqualities(StringBuilder sql, List<String> whereColumns) {
        for (int i = 0; i < whereColumns.size(); i++) {
            sql.append(i == 0 ? " WHERE " : " AND ").append(sqlType.quote(whereColumns.get(i))).append(" = ?");
        }
    }

    private void appendSortingAndPage(TableMapping mapping, List<SortOption> sort, @Nullable PageOption page, StringBuilder sql, @Nullable String alias) {
        if (!sort.isEmpty()) {
            sql.append(" ORDER BY ").append(sortBuilder.buildSortOptions(mapping, sort, alias));
        }

        if (page != null) {
            sql.append(sqlType.parsePage(page));
        }
    }
}
