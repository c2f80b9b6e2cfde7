package io.github.flameyossnowy.tabula.sql.internals;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.api.options.OffsetLimitPage;
import io.github.flameyossnowy.tabula.api.options.PageOption;
import io.github.flameyossnowy.tabula.api.options.SortOption;
import io.github.flameyossnowy.tabula.api.schema.AttributeType;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import io.github.flameyossnowy.tabula.sql.internals.query.DeleteSqlBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.InsertSqlBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.QueryStringCache;
import io.github.flameyossnowy.tabula.sql.internals.query.RepositoryDdlBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.SelectSqlBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.SqlConditionBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.SqlSortBuilder;
import io.github.flameyossnowy.tabula.sql.internals.query.UpdateSqlBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Generates every statement the processor and the migrator run. Statements that only depend on a
 * mapping are cached; filtered selects are built per query.
 */
public class QueryParseEngine {
    private final QueryStringCache queryMap;
    private final SelectSqlBuilder selectSqlBuilder;
    private final InsertSqlBuilder insertSqlBuilder;
    private final UpdateSqlBuilder updateSqlBuilder;
    private final DeleteSqlBuilder deleteSqlBuilder;
    private final RepositoryDdlBuilder repositoryDdlBuilder;

    public QueryParseEngine(@NotNull SQLType sqlType) {
        this.queryMap = new QueryStringCache(16);
        this.selectSqlBuilder = new SelectSqlBuilder(sqlType, new SqlConditionBuilder(sqlType), new SqlSortBuilder(sqlType));
        this.insertSqlBuilder = new InsertSqlBuilder(sqlType);
        this.updateSqlBuilder = new UpdateSqlBuilder(sqlType);
        this.deleteSqlBuilder = new DeleteSqlBuilder(sqlType);
        this.repositoryDdlBuilder = new RepositoryDdlBuilder(sqlType);
    }

    /*
     * |---------|
     * | Selects |
     * |---------|
     */

    public @NotNull String parseSelectById(@NotNull TableMapping mapping) {
        return queryMap.computeIfAbsent("SELECT:ID:" + mapping.table(), k -> selectSqlBuilder.parseSelectById(mapping));
    }

    public @NotNull String parseSelectByIds(@NotNull TableMapping mapping, int count) {
        String queryString = selectSqlBuilder.parseSelectByIds(mapping, count);
        Logging.info(() -> "Parsed query for selecting by ids: " + queryString);
        return queryString;
    }

    public @NotNull String parseSelect(
        @NotNull TableMapping mapping,
        @NotNull List<FilterOption> filters,
        @NotNull List<SortOption> sort,
        @Nullable PageOption page
    ) {
        String queryString = selectSqlBuilder.parseSelect(mapping, filters, sort, page);
        Logging.info(() -> "Parsed query for selecting: " + queryString);
        return queryString;
    }

    /**
     * Members of a collection relationship of one owner; the owner id is the first parameter.
     */
    public @NotNull String parseSelectRelated(
        @NotNull RelationMapping relation,
        @NotNull TableMapping target,
        @NotNull List<FilterOption> filters,
        @NotNull List<SortOption> sort,
        @Nullable PageOption page
    ) {
        String queryString;
        if (relation instanceof RelationMapping.TargetForeignKey targetKey) {
            queryString = selectSqlBuilder.parseSelectByOwner(targetKey, target, filters, sort, page);
        } else if (relation instanceof RelationMapping.JoinTable joinTable) {
            queryString = selectSqlBuilder.parseSelectThrough(joinTable, target, filters, sort, page);
        } else {
            throw new IllegalArgumentException("Relationship to " + relation.targetType() + " is not a collection");
        }
        Logging.info(() -> "Parsed query for selecting related records: " + queryString);
        return queryString;
    }

    /**
     * Ids of the records currently linked through a collection relationship; the owner id is the
     * only parameter.
     */
    public @NotNull String parseLinkedIds(@NotNull RelationMapping relation) {
        if (relation instanceof RelationMapping.TargetForeignKey targetKey) {
            return queryMap.computeIfAbsent(
                "LINKS:" + targetKey.targetTable() + ':' + targetKey.inverseColumn(),
                k -> selectSqlBuilder.parseSelectColumn(targetKey.targetTable(), TableMapping.ID_COLUMN, List.of(targetKey.inverseColumn())));
        }
        if (relation instanceof RelationMapping.JoinTable joinTable) {
            return queryMap.computeIfAbsent(
                "LINKS:" + joinTable.table() + ':' + joinTable.ownerColumn(),
                k -> selectSqlBuilder.parseSelectColumn(joinTable.table(), joinTable.relatedColumn(), List.of(joinTable.ownerColumn())));
        }
        throw new IllegalArgumentException("Relationship to " + relation.targetType() + " is not a collection");
    }

    /**
     * Existence check for one join row; parameters are the owner id then the related id.
     */
    public @NotNull String parseLinkExists(@NotNull RelationMapping.JoinTable joinTable) {
        return queryMap.computeIfAbsent(
            "LINK:EXISTS:" + joinTable.table() + ':' + joinTable.ownerColumn(),
            k -> selectSqlBuilder.parseExists(joinTable.table(), List.of(joinTable.ownerColumn(), joinTable.relatedColumn())));
    }

    /*
     * |--------|
     * | Writes |
     * |--------|
     */

    public @NotNull String parseInsert(@NotNull String table, @NotNull List<String> columns) {
        String queryString = queryMap.computeIfAbsent("INSERT:" + table + ':' + columns, k -> insertSqlBuilder.parseInsert(table, columns));
        Logging.info(() -> "Parsed query for inserting: " + queryString);
        return queryString;
    }

    public @NotNull String parseUpdate(@NotNull String table, @NotNull List<String> setColumns, @NotNull List<String> nullColumns, @NotNull List<String> whereColumns) {
        String queryString = queryMap.computeIfAbsent(
            "UPDATE:" + table + ':' + setColumns + ':' + nullColumns + ':' + whereColumns,
            k -> updateSqlBuilder.parseUpdate(table, setColumns, nullColumns, whereColumns));
        Logging.info(() -> "Parsed query for updating: " + queryString);
        return queryString;
    }

    /**
     * Bumps {@code updated_at}; parameters are the timestamp then the id.
     */
    public @NotNull String parseTouch(@NotNull TableMapping mapping) {
        return parseUpdate(mapping.table(), List.of(TableMapping.UPDATED_AT_COLUMN), List.of(), List.of(TableMapping.ID_COLUMN));
    }

    public @NotNull String parseDelete(@NotNull String table, @NotNull List<String> whereColumns) {
        String queryString = queryMap.computeIfAbsent("DELETE:" + table + ':' + whereColumns, k -> deleteSqlBuilder.parseDelete(table, whereColumns));
        Logging.info(() -> "Parsed query for deleting: " + queryString);
        return queryString;
    }

    /*
     * |--------------|
     * | Repositories |
     * |--------------|
     */

    public @NotNull String parseRepository(@NotNull TableMapping mapping) {
        return repositoryDdlBuilder.parseRepository(mapping);
    }

    public @NotNull String parseJoinTable(@NotNull RelationMapping.JoinTable joinTable) {
        return repositoryDdlBuilder.parseJoinTable(joinTable);
    }

    public enum SQLType {
        MYSQL("MySQL", '`', "VARCHAR(255)", "DATETIME"),
        SQLITE("SQLite", '"', "TEXT", "DATETIME"),
        POSTGRESQL("PostgreSQL", '"', "VARCHAR(255)", "TIMESTAMP");

        private final String name;
        private final char quotesChar;
        private final String keyColumnType;
        private final String timestampType;

        SQLType(String name, char quotesChar, String keyColumnType, String timestampType) {
            this.name = name;
            this.quotesChar = quotesChar;
            this.keyColumnType = keyColumnType;
            this.timestampType = timestampType;
        }

        public String getName() {
            return name;
        }

        public String quote(String identifier) {
            return quotesChar + identifier + quotesChar;
        }

        public String qualify(@Nullable String alias, String column) {
            return alias == null ? quote(column) : alias + '.' + quote(column);
        }

        /**
         * Type of {@code id} and of every key column.
         */
        public String keyColumnType() {
            return keyColumnType;
        }

        public String timestampType() {
            return timestampType;
        }

        public String columnType(@NotNull AttributeType type) {
            return switch (type) {
                case STRING -> "VARCHAR(255)";
                case NUMBER -> this == POSTGRESQL ? "BIGINT" : "INTEGER";
                case BOOLEAN -> this == MYSQL ? "TINYINT(1)" : "BOOLEAN";
                case DATE -> "DATE";
                case DATETIME -> timestampType;
            };
        }

        /**
         * Whether instants and dates are stored as ISO-8601 text instead of JDBC temporal values.
         */
        public boolean bindsTemporalAsText() {
            return this == SQLITE;
        }

        /**
         * {@code LIMIT}/{@code OFFSET} clause with a leading space, or an empty string. SQLite and
         * MySQL cannot express an offset without a limit, so an unbounded one is substituted.
         */
        public String parsePage(@NotNull PageOption page) {
            if (!(page instanceof OffsetLimitPage offsetLimit)) {
                throw new QueryNotRecognizedException("Page not supported", page);
            }

            Integer offset = offsetLimit.offset();
            Integer limit = offsetLimit.limit();

            StringBuilder clause = new StringBuilder();
            if (limit != null) {
                clause.append(" LIMIT ").append(limit);
            } else if (offset != null) {
                switch (this) {
                    case SQLITE -> clause.append(" LIMIT -1");
                    case MYSQL -> clause.append(" LIMIT 18446744073709551615");
                    case POSTGRESQL -> { }
                }
            }

            if (offset != null) {
                clause.append(" OFFSET ").append(offset);
            }
            return clause.toString();
        }
    }
}
