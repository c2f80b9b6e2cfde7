package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public record AttributeFilter(@NotNull String attribute, @NotNull FilterOperator operator, @Nullable Object value) implements FilterOption {
    public AttributeFilter {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
    }

    @Override
    public @NotNull String kind() {
        return "attribute";
    }

    @Override
    public String toString() {
        return attribute + ' ' + operator.wireName() + ' ' + value;
    }
}
