package io.github.flameyossnowy.tabula.api.schema;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A declared relationship. {@code targetTypes} is a list so that a declaration naming several
 * target types can still be loaded; such declarations are rejected when mappings are compiled.
 */
public record RelationshipDefinition(
    @NotNull String name,
    @NotNull RelationshipKind kind,
    @NotNull List<String> targetTypes,
    @Nullable String inverse
) {
    public RelationshipDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        targetTypes = targetTypes == null ? List.of() : List.copyOf(targetTypes);
    }

    public RelationshipDefinition(@NotNull String name, @NotNull RelationshipKind kind, @Nullable String targetType, @Nullable String inverse) {
        this(name, kind, targetType == null ? List.of() : List.of(targetType), inverse);
    }

    public static RelationshipDefinition hasOne(String name, String targetType, String inverse) {
        return new RelationshipDefinition(name, RelationshipKind.HAS_ONE, targetType, inverse);
    }

    public static RelationshipDefinition hasMany(String name, String targetType, String inverse) {
        return new RelationshipDefinition(name, RelationshipKind.HAS_MANY, targetType, inverse);
    }

    public boolean isPolymorphic() {
        return targetTypes.size() > 1;
    }

    /**
     * The single target type, or null when none or several are declared.
     */
    public @Nullable String targetType() {
        return targetTypes.size() == 1 ? targetTypes.get(0) : null;
    }
}
