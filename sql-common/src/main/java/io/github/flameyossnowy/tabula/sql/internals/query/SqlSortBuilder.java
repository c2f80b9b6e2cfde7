package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.options.AttributeSort;
import io.github.flameyossnowy.tabula.api.options.SortOption;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.StringJoiner;

public final class SqlSortBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public SqlSortBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    public String buildSortOptions(@NotNull TableMapping mapping, @NotNull Iterable<SortOption> sortOptions, @Nullable String alias) {
        StringJoiner joiner = new StringJoiner(", ");
        for (SortOption sortOption : sortOptions) {
            if (!(sortOption instanceof AttributeSort sort)) {
                throw new QueryNotRecognizedException("Sort not supported", sortOption);
            }

            String column = mapping.column(sort.attribute());
            if (column == null) {
                throw new QueryNotRecognizedException("Unknown attribute in sort", sort.attribute());
            }
            joiner.add(sqlType.qualify(alias, column) + ' ' + sort.order().keyword());
        }
        return joiner.toString();
    }
}
