package io.github.flameyossnowy.tabula.api.record;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An abstract record: a type, an identity, typed attributes and named relationships.
 *
 * <p>Empty attribute or relationship maps are normalised to {@code null}, so a record never
 * carries null-filled fields for data it does not have.</p>
 */
public record GraphRecord(
    @NotNull String type,
    @Nullable String id,
    @Nullable Map<String, Object> attributes,
    @Nullable Map<String, RelationshipData> relationships
) {
    public GraphRecord {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null || attributes.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        relationships = relationships == null || relationships.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    @Contract(pure = true)
    public static @NotNull GraphRecord of(String type, String id) {
        return new GraphRecord(type, id, null, null);
    }

    public static @NotNull Builder builder(String type) {
        return new Builder(type, null);
    }

    public static @NotNull Builder builder(String type, String id) {
        return new Builder(type, id);
    }

    public @NotNull RecordIdentity identity() {
        if (id == null) {
            throw new IllegalStateException("Record of type " + type + " has no id yet");
        }
        return new RecordIdentity(type, id);
    }

    public @Nullable Object attribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }

    public @Nullable RelationshipData relationship(String name) {
        return relationships == null ? null : relationships.get(name);
    }

    public @NotNull GraphRecord withId(@NotNull String newId) {
        return new GraphRecord(type, newId, attributes, relationships);
    }

    public static final class Builder {
        private final String type;
        private final String id;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, RelationshipData> relationships = new LinkedHashMap<>();

        private Builder(String type, String id) {
            this.type = type;
            this.id = id;
        }

        public Builder attribute(String name, @Nullable Object value) {
            attributes.put(name, value);
            return this;
        }

        public Builder hasOne(String name, @Nullable RecordIdentity related) {
            relationships.put(name, RelationshipData.hasOne(related));
            return this;
        }

        public Builder hasOne(String name, String relatedType, String relatedId) {
            return hasOne(name, new RecordIdentity(relatedType, relatedId));
        }

        public Builder hasMany(String name, List<RecordIdentity> related) {
            relationships.put(name, RelationshipData.hasMany(related));
            return this;
        }

        public Builder hasMany(String name, RecordIdentity... related) {
            List<RecordIdentity> list = new ArrayList<>(related.length);
            Collections.addAll(list, related);
            return hasMany(name, list);
        }

        public GraphRecord build() {
            return new GraphRecord(type, id, attributes, relationships);
        }
    }
}
