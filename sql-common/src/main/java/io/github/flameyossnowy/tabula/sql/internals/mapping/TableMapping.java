package io.github.flameyossnowy.tabula.sql.internals.mapping;

import io.github.flameyossnowy.tabula.api.schema.ModelDefinition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Relational layout of one record type. Table and columns are fixed when the mapping is
 * created; relations are filled in by {@link ModelMapper} and may still be incomplete while
 * a cycle through this type is being resolved.
 */
public final class TableMapping {
    public static final String ID_COLUMN = "id";
    public static final String CREATED_AT_COLUMN = "created_at";
    public static final String UPDATED_AT_COLUMN = "updated_at";

    static final String CREATED_AT_ATTRIBUTE = "createdAt";
    static final String UPDATED_AT_ATTRIBUTE = "updatedAt";

    private final ModelDefinition model;
    private final String table;
    private final Map<String, String> columns;
    private final Map<String, RelationMapping> relations = new LinkedHashMap<>();

    TableMapping(ModelDefinition model, String table, Map<String, String> columns) {
        this.model = model;
        this.table = table;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public @NotNull String type() {
        return model.name();
    }

    public @NotNull ModelDefinition model() {
        return model;
    }

    public @NotNull String table() {
        return table;
    }

    /**
     * Attribute name to column name, in declaration order.
     */
    public @NotNull Map<String, String> columns() {
        return columns;
    }

    public @Nullable String column(String attribute) {
        return columns.get(attribute);
    }

    public @NotNull Map<String, RelationMapping> relations() {
        return Collections.unmodifiableMap(relations);
    }

    public @Nullable RelationMapping relation(String relationship) {
        return relations.get(relationship);
    }

    void addRelation(String relationship, RelationMapping mapping) {
        relations.put(relationship, mapping);
    }

    /**
     * Attributes backed by the server-maintained timestamp columns; never written from a payload.
     */
    public static boolean isReserved(String attribute) {
        return CREATED_AT_ATTRIBUTE.equals(attribute) || UPDATED_AT_ATTRIBUTE.equals(attribute);
    }

    public static Set<String> reservedColumns() {
        return Set.of(ID_COLUMN, CREATED_AT_COLUMN, UPDATED_AT_COLUMN);
    }

    @Override
    public String toString() {
        return "TableMapping{type=" + type() + ", table=" + table + ", columns=" + columns + ", relations=" + relations + '}';
    }
}
