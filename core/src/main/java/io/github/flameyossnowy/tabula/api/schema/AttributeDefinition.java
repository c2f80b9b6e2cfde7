package io.github.flameyossnowy.tabula.api.schema;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record AttributeDefinition(@NotNull String name, @NotNull AttributeType type) {
    public AttributeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
