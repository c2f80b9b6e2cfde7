package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record AttributeSort(@NotNull String attribute, @NotNull SortOrder order) implements SortOption {
    public AttributeSort {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(order, "order");
    }

    /**
     * Parses the shorthand form: a leading {@code -} means descending.
     */
    public static @NotNull AttributeSort parse(@NotNull String shorthand) {
        if (shorthand.startsWith("-")) {
            return new AttributeSort(shorthand.substring(1), SortOrder.DESCENDING);
        }
        return new AttributeSort(shorthand, SortOrder.ASCENDING);
    }

    @Override
    public @NotNull String kind() {
        return "attribute";
    }

    @Override
    public String toString() {
        return attribute + ' ' + order.keyword();
    }
}
