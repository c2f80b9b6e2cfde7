package io.github.flameyossnowy.tabula.sql.internals.query;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.options.AttributeFilter;
import io.github.flameyossnowy.tabula.api.options.FilterOperator;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.StringJoiner;

public final class SqlConditionBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public SqlConditionBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Conjunction of the filters, one {@code ?} per bound value in filter order.
     *
     * @param alias table alias to qualify columns with, or null
     */
    public String buildConditions(@NotNull TableMapping mapping, @NotNull Iterable<FilterOption> filters, @Nullable String alias) {
        StringJoiner joiner = new StringJoiner(" AND ");

        for (FilterOption filter : filters) {
            if (filter instanceof AttributeFilter attributeFilter) {
                joiner.add(buildColumnCondition(mapping, attributeFilter, alias));
                continue;
            }

            throw new QueryNotRecognizedException("Filter not supported", filter);
        }

        return joiner.toString();
    }

    /**
     * Whether the filter compiles to {@code IS NULL} and therefore binds no value.
     */
    public static boolean isNullCheck(@NotNull AttributeFilter filter) {
        return filter.value() == null && filter.operator() == FilterOperator.EQUAL;
    }

    private String buildColumnCondition(TableMapping mapping, AttributeFilter filter, @Nullable String alias) {
        String column = mapping.column(filter.attribute());
        if (column == null) {
            throw new QueryNotRecognizedException("Unknown attribute in filter", filter.attribute());
        }

        String qualified = sqlType.qualify(alias, column);
        if (isNullCheck(filter)) {
            return qualified + " IS NULL";
        }
        return qualified + ' ' + filter.operator().symbol() + " ?";
    }
}
