package io.github.flameyossnowy.tabula.api.schema;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared attributes and relationships of one record type, in declaration order.
 */
public record ModelDefinition(
    @NotNull String name,
    @NotNull Map<String, AttributeDefinition> attributes,
    @NotNull Map<String, RelationshipDefinition> relationships
) {
    public ModelDefinition {
        Objects.requireNonNull(name, "name");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    public @Nullable AttributeDefinition attribute(String name) {
        return attributes.get(name);
    }

    public @Nullable RelationshipDefinition relationship(String name) {
        return relationships.get(name);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();
        private final Map<String, RelationshipDefinition> relationships = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder attribute(String name, AttributeType type) {
            attributes.put(name, new AttributeDefinition(name, type));
            return this;
        }

        public Builder hasOne(String name, String targetType, String inverse) {
            relationships.put(name, RelationshipDefinition.hasOne(name, targetType, inverse));
            return this;
        }

        public Builder hasMany(String name, String targetType, String inverse) {
            relationships.put(name, RelationshipDefinition.hasMany(name, targetType, inverse));
            return this;
        }

        public Builder relationship(RelationshipDefinition relationship) {
            relationships.put(relationship.name(), relationship);
            return this;
        }

        public ModelDefinition build() {
            return new ModelDefinition(name, attributes, relationships);
        }
    }
}
