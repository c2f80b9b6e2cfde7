package io.github.flameyossnowy.tabula.sql.internals.mapping;

import io.github.flameyossnowy.tabula.api.exceptions.SchemaException;
import io.github.flameyossnowy.tabula.api.schema.AttributeDefinition;
import io.github.flameyossnowy.tabula.api.schema.ModelDefinition;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.api.schema.RelationshipDefinition;
import io.github.flameyossnowy.tabula.api.schema.RelationshipKind;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles record types into {@link TableMapping}s.
 *
 * <p>Mappings are built on first use and memoized. A type reached again while it is still being
 * built resolves to its partial mapping, which is enough to terminate relationship cycles since
 * only its table name is needed. Access is serialized so concurrent first use of a type builds it
 * once.</p>
 */
public final class ModelMapper {
    private final RecordSchema schema;
    private final Map<String, TableMapping> mappings = new HashMap<>();
    private final Map<String, TableMapping> building = new HashMap<>();

    public ModelMapper(@NotNull RecordSchema schema) {
        this.schema = schema;
    }

    public synchronized @NotNull TableMapping mapping(@NotNull String type) {
        TableMapping mapping = mappings.get(type);
        if (mapping != null) return mapping;

        TableMapping partial = building.get(type);
        if (partial != null) {
            Logging.deepInfo(() -> "Cycle through " + type + ", using partial mapping");
            return partial;
        }

        return build(schema.getModel(type));
    }

    /**
     * Builds every declared type, so schema errors surface before any data is touched.
     */
    public synchronized @NotNull List<TableMapping> mapAll() {
        List<TableMapping> all = new ArrayList<>();
        for (ModelDefinition model : schema.models()) {
            all.add(mapping(model.name()));
        }
        return all;
    }

    private TableMapping build(ModelDefinition model) {
        String type = model.name();
        Logging.deepInfo(() -> "Building table mapping for type: " + type);

        Map<String, String> columns = new LinkedHashMap<>();
        for (AttributeDefinition attribute : model.attributes().values()) {
            columns.put(attribute.name(), columnFor(attribute.name()));
        }

        TableMapping mapping = new TableMapping(model, NamingUtil.tableize(type), columns);
        building.put(type, mapping);
        try {
            for (RelationshipDefinition relationship : model.relationships().values()) {
                RelationMapping relation = relationFor(type, relationship);
                Logging.deepInfo(() -> "  " + type + '.' + relationship.name() + " -> " + relation);
                mapping.addRelation(relationship.name(), relation);
            }
        } finally {
            building.remove(type);
        }

        mappings.put(type, mapping);
        Logging.deepInfo(() -> "Mapped " + mapping);
        return mapping;
    }

    private RelationMapping relationFor(String type, RelationshipDefinition relationship) {
        String name = type + '.' + relationship.name();

        if (relationship.isPolymorphic()) {
            throw new SchemaException("Relationship " + name + " targets more than one type " + relationship.targetTypes() + ", which is not supported");
        }

        String targetType = relationship.targetType();
        String inverse = relationship.inverse();
        if (targetType == null || inverse == null) {
            throw new SchemaException("Relationship " + name + " must declare both a target type and an inverse");
        }

        if (!schema.hasModel(targetType)) {
            throw new SchemaException("Relationship " + name + " targets unknown type: " + targetType);
        }

        RelationshipDefinition inverseDefinition = schema.getRelationship(targetType, inverse);
        if (inverseDefinition == null) {
            throw new SchemaException("Inverse " + targetType + '.' + inverse + " of relationship " + name + " does not exist");
        }

        String targetTable = mapping(targetType).table();

        if (relationship.kind() == RelationshipKind.HAS_ONE) {
            return new RelationMapping.OwnedForeignKey(NamingUtil.foreignKey(relationship.name()), targetType, targetTable);
        }

        if (inverseDefinition.kind() == RelationshipKind.HAS_ONE) {
            return new RelationMapping.TargetForeignKey(targetType, targetTable, NamingUtil.foreignKey(inverse));
        }

        String ownerColumn = NamingUtil.foreignKey(relationship.name());
        String relatedColumn = NamingUtil.foreignKey(inverse);
        if (ownerColumn.equals(relatedColumn)) {
            throw new SchemaException("Relationship " + name + " is its own inverse; its join table would need two " + ownerColumn + " columns");
        }

        return new RelationMapping.JoinTable(
            NamingUtil.joinTable(relationship.name(), inverse),
            ownerColumn,
            relatedColumn,
            targetType,
            targetTable
        );
    }

    private static String columnFor(String attribute) {
        if (TableMapping.CREATED_AT_ATTRIBUTE.equals(attribute)) return TableMapping.CREATED_AT_COLUMN;
        if (TableMapping.UPDATED_AT_ATTRIBUTE.equals(attribute)) return TableMapping.UPDATED_AT_COLUMN;
        return NamingUtil.underscore(attribute);
    }
}
