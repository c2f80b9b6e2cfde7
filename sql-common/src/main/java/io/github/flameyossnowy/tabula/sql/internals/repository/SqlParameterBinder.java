package io.github.flameyossnowy.tabula.sql.internals.repository;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.options.AttributeFilter;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.query.SqlConditionBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;

/**
 * Binds record values to statement parameters, converting temporal values to what the dialect
 * stores: ISO-8601 text on SQLite, JDBC timestamps and dates elsewhere.
 *
 * <p>Instants are written as UTC text with nanosecond precision, so every stored instant has the
 * same width and text comparison orders them chronologically.</p>
 */
public final class SqlParameterBinder {
    private static final DateTimeFormatter INSTANT_TEXT = DateTimeFormatter
        .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
        .withZone(ZoneOffset.UTC);

    private final QueryParseEngine.SQLType sqlType;

    public SqlParameterBinder(@NotNull QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Binds the values of the filters, skipping those compiled to {@code IS NULL}.
     *
     * @return the next free parameter index
     */
    public int addFilterToPreparedStatement(@NotNull PreparedStatement statement, int index, @NotNull List<FilterOption> filters) throws SQLException {
        for (FilterOption filter : filters) {
            if (!(filter instanceof AttributeFilter attributeFilter)) {
                throw new QueryNotRecognizedException("Filter not supported", filter);
            }
            if (SqlConditionBuilder.isNullCheck(attributeFilter)) continue;
            bind(statement, index++, attributeFilter.value());
        }
        return index;
    }

    /**
     * @return the next free parameter index
     */
    public int bindAll(@NotNull PreparedStatement statement, int index, @NotNull Collection<?> values) throws SQLException {
        for (Object value : values) {
            bind(statement, index++, value);
        }
        return index;
    }

    public void bind(@NotNull PreparedStatement statement, int index, @Nullable Object value) throws SQLException {
        if (value == null) {
            statement.setObject(index, null);
        } else if (value instanceof String string) {
            statement.setString(index, string);
        } else if (value instanceof Boolean bool) {
            statement.setBoolean(index, bool);
        } else if (value instanceof Integer integer) {
            statement.setInt(index, integer);
        } else if (value instanceof Long longValue) {
            statement.setLong(index, longValue);
        } else if (value instanceof Double doubleValue) {
            statement.setDouble(index, doubleValue);
        } else if (value instanceof Float floatValue) {
            statement.setFloat(index, floatValue);
        } else if (value instanceof BigDecimal decimal) {
            statement.setBigDecimal(index, decimal);
        } else if (value instanceof Instant instant) {
            bindInstant(statement, index, instant);
        } else if (value instanceof OffsetDateTime dateTime) {
            bindInstant(statement, index, dateTime.toInstant());
        } else if (value instanceof LocalDateTime dateTime) {
            bindInstant(statement, index, dateTime.toInstant(ZoneOffset.UTC));
        } else if (value instanceof LocalDate date) {
            bindDate(statement, index, date);
        } else if (value instanceof java.util.Date date && !(value instanceof Date) && !(value instanceof Timestamp)) {
            bindInstant(statement, index, date.toInstant());
        } else {
            statement.setObject(index, value);
        }
    }

    private void bindInstant(PreparedStatement statement, int index, Instant instant) throws SQLException {
        if (sqlType.bindsTemporalAsText()) {
            statement.setString(index, formatInstant(instant));
        } else {
            statement.setTimestamp(index, Timestamp.from(instant));
        }
    }

    public static @NotNull String formatInstant(@NotNull Instant instant) {
        return INSTANT_TEXT.format(instant);
    }

    private void bindDate(PreparedStatement statement, int index, LocalDate date) throws SQLException {
        if (sqlType.bindsTemporalAsText()) {
            statement.setString(index, date.toString());
        } else {
            statement.setDate(index, Date.valueOf(date));
        }
    }
}
