package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * All records of one type, narrowed by {@code filters}, ordered by {@code sort} and windowed by {@code page}.
 */
public record FindRecords(
    @NotNull String type,
    @NotNull List<FilterOption> filters,
    @NotNull List<SortOption> sort,
    @Nullable PageOption page
) implements QueryExpression {
    public FindRecords {
        Objects.requireNonNull(type, "type");
        filters = filters == null ? List.of() : List.copyOf(filters);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    public FindRecords(@NotNull String type) {
        this(type, List.of(), List.of(), null);
    }

    @Override
    public @NotNull String op() {
        return "findRecords";
    }

    @Override
    public boolean isCollection() {
        return true;
    }

    public static final class Builder extends CollectionQueryBuilder<FindRecords, Builder> {
        private final String type;

        Builder(@NotNull String type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public FindRecords build() {
            return new FindRecords(type, filters, sort, page);
        }
    }
}
