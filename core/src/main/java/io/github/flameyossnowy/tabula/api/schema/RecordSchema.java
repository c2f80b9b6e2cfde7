package io.github.flameyossnowy.tabula.api.schema;

import io.github.flameyossnowy.tabula.api.exceptions.SchemaException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Immutable registry of record types.
 *
 * <p>The registry only stores declarations. Structural checks on relationships (targets,
 * inverses, polymorphism) happen when the relational mapping is compiled, so a malformed
 * registry can be loaded and reported in one place.</p>
 */
public final class RecordSchema {
    private final Map<String, ModelDefinition> models;
    private final Supplier<String> idGenerator;

    private RecordSchema(Map<String, ModelDefinition> models, Supplier<String> idGenerator) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.idGenerator = idGenerator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull Collection<ModelDefinition> models() {
        return models.values();
    }

    public boolean hasModel(String type) {
        return models.containsKey(type);
    }

    public @NotNull ModelDefinition getModel(String type) {
        ModelDefinition model = models.get(type);
        if (model == null) {
            throw new SchemaException("Unknown record type: " + type);
        }
        return model;
    }

    public @Nullable AttributeDefinition getAttribute(String type, String attribute) {
        return getModel(type).attribute(attribute);
    }

    public @Nullable RelationshipDefinition getRelationship(String type, String relationship) {
        return getModel(type).relationship(relationship);
    }

    public boolean hasRelationship(String type, String relationship) {
        return hasModel(type) && getModel(type).relationship(relationship) != null;
    }

    public @NotNull String generateId() {
        return idGenerator.get();
    }

    public static final class Builder {
        private final Map<String, ModelDefinition> models = new LinkedHashMap<>();
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

        private Builder() {
        }

        public Builder model(ModelDefinition model) {
            models.put(model.name(), model);
            return this;
        }

        public Builder model(ModelDefinition.Builder model) {
            return model(model.build());
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(models, idGenerator);
        }
    }
}
