package io.github.flameyossnowy.tabula.sql.internals.codec;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.api.record.RelationshipData;
import io.github.flameyossnowy.tabula.api.schema.AttributeDefinition;
import io.github.flameyossnowy.tabula.api.schema.AttributeType;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.mapping.ModelMapper;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link GraphRecord}s and table rows.
 *
 * <p>Writing keeps declared, non-reserved attributes and the keys of relationships; undeclared
 * keys are dropped. Reading restores declared attributes that are present and non-null, coerced
 * back to their declared type, and embeds single-valued relationships whose key column is set.
 * Collection relationships are never embedded in a read record.</p>
 */
public final class RecordCodec {
    // CURRENT_TIMESTAMP renders as "yyyy-MM-dd HH:mm:ss" in UTC on SQLite and MySQL.
    private static final DateTimeFormatter SQL_TIMESTAMP = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .toFormatter();

    private final ModelMapper mapper;

    public RecordCodec(@NotNull ModelMapper mapper) {
        this.mapper = mapper;
    }

    public @NotNull RowData toRow(@NotNull GraphRecord record) {
        TableMapping mapping = mapper.mapping(record.type());

        Map<String, Object> columns = new LinkedHashMap<>();
        if (record.attributes() != null) {
            record.attributes().forEach((attribute, value) -> {
                String column = mapping.column(attribute);
                if (column == null || TableMapping.isReserved(attribute)) {
                    Logging.deepInfo(() -> "Ignoring undeclared or reserved attribute " + record.type() + '.' + attribute);
                    return;
                }
                AttributeDefinition definition = mapping.model().attributes().get(attribute);
                columns.put(column, toStorageValue(record.type() + '.' + attribute, value, definition.type()));
            });
        }

        Map<String, List<String>> relationships = new LinkedHashMap<>();
        if (record.relationships() != null) {
            record.relationships().forEach((name, data) -> {
                RelationMapping relation = mapping.relation(name);
                if (relation == null) {
                    Logging.deepInfo(() -> "Ignoring undeclared relationship " + record.type() + '.' + name);
                    return;
                }

                if (relation instanceof RelationMapping.OwnedForeignKey owned) {
                    if (!(data instanceof RelationshipData.HasOne one)) {
                        throw new IllegalArgumentException("Relationship " + record.type() + '.' + name + " holds a single record, not a list");
                    }
                    columns.put(owned.column(), one.identity() == null ? null : one.identity().id());
                    return;
                }

                if (!(data instanceof RelationshipData.HasMany many)) {
                    throw new IllegalArgumentException("Relationship " + record.type() + '.' + name + " holds a list of records, not a single one");
                }
                List<String> keys = new ArrayList<>(many.identities().size());
                for (RecordIdentity identity : many.identities()) keys.add(identity.id());
                relationships.put(name, keys);
            });
        }

        return new RowData(record.id(), columns, relationships);
    }

    /**
     * Rebuilds a record from a row keyed by lower-case column label.
     */
    public @NotNull GraphRecord fromRow(@NotNull Map<String, Object> row, @NotNull String type) {
        TableMapping mapping = mapper.mapping(type);
        Object id = row.get(TableMapping.ID_COLUMN);

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (AttributeDefinition attribute : mapping.model().attributes().values()) {
            String column = mapping.column(attribute.name());
            Object value = column == null ? null : row.get(column);
            if (value != null) {
                attributes.put(attribute.name(), castAttributeValue(value, attribute.type()));
            }
        }

        Map<String, RelationshipData> relationships = new LinkedHashMap<>();
        mapping.relations().forEach((name, relation) -> {
            if (relation instanceof RelationMapping.OwnedForeignKey owned) {
                Object key = row.get(owned.column());
                if (key != null) {
                    relationships.put(name, RelationshipData.hasOne(new RecordIdentity(owned.targetType(), key.toString())));
                }
            }
        });

        return new GraphRecord(type, id == null ? null : id.toString(), attributes, relationships);
    }

    /**
     * Coerces a stored value back to the declared attribute type.
     */
    public static @Nullable Object castAttributeValue(@Nullable Object value, @NotNull AttributeType type) {
        if (value == null) return null;

        return switch (type) {
            case STRING -> value.toString();
            case NUMBER -> value instanceof String text ? parseNumber(text) : value;
            case BOOLEAN -> castBoolean(value);
            case DATE -> castDate(value);
            case DATETIME -> castInstant(value);
        };
    }

    private static Object castBoolean(Object value) {
        if (value instanceof Boolean) return value;
        if (value instanceof Number number) return number.intValue() == 1;
        String text = value.toString();
        return "1".equals(text) || "true".equalsIgnoreCase(text);
    }

    /**
     * Normalizes a value written to or compared against a column. Text and epoch milliseconds given
     * for {@code date} and {@code datetime} attributes become {@link LocalDate} and {@link Instant};
     * other types pass through unchanged.
     *
     * @throws IllegalArgumentException if the value cannot be read as the declared temporal type
     */
    public static @Nullable Object toStorageValue(@NotNull String attribute, @Nullable Object value, @NotNull AttributeType type) {
        if (value == null || (type != AttributeType.DATE && type != AttributeType.DATETIME)) return value;

        Object temporal = type == AttributeType.DATE ? toLocalDate(value) : toInstant(value);
        if (temporal == null) {
            throw new IllegalArgumentException("Attribute " + attribute + " expects a " + type.wireName() + " value, got: " + value);
        }
        return temporal;
    }

    private static Object castDate(Object value) {
        LocalDate date = toLocalDate(value);
        if (date != null) return date;

        Logging.warn("Stored date value could not be parsed: " + value);
        return value.toString();
    }

    private static Object castInstant(Object value) {
        Instant instant = toInstant(value);
        if (instant != null) return instant;

        Logging.warn("Stored datetime value could not be parsed: " + value);
        return value.toString();
    }

    private static @Nullable LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate date) return date;
        if (value instanceof java.sql.Date date) return date.toLocalDate();
        if (value instanceof java.sql.Timestamp timestamp) return timestamp.toLocalDateTime().toLocalDate();
        if (value instanceof LocalDateTime dateTime) return dateTime.toLocalDate();
        if (value instanceof OffsetDateTime dateTime) return dateTime.toLocalDate();
        if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        if (value instanceof Number number) return Instant.ofEpochMilli(number.longValue()).atOffset(ZoneOffset.UTC).toLocalDate();

        String text = value.toString();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static @Nullable Instant toInstant(Object value) {
        if (value instanceof Instant instant) return instant;
        if (value instanceof java.sql.Timestamp timestamp) return timestamp.toInstant();
        if (value instanceof java.sql.Date date) return date.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof Date date) return date.toInstant();
        if (value instanceof LocalDateTime dateTime) return dateTime.toInstant(ZoneOffset.UTC);
        if (value instanceof OffsetDateTime dateTime) return dateTime.toInstant();
        if (value instanceof LocalDate date) return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof Number number) return Instant.ofEpochMilli(number.longValue());

        String text = value.toString();
        DateTimeFormatter format = text.indexOf('T') > 0 ? DateTimeFormatter.ISO_DATE_TIME : SQL_TIMESTAMP;
        try {
            TemporalAccessor parsed = format.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime dateTime
                ? dateTime.toInstant()
                : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Object parseNumber(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException ignored) {
                return text;
            }
        }
    }
}
