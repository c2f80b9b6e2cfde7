package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

public record FindRelatedRecords(
    @NotNull RecordIdentity record,
    @NotNull String relationship,
    @NotNull List<FilterOption> filters,
    @NotNull List<SortOption> sort,
    @Nullable PageOption page
) implements QueryExpression {
    public FindRelatedRecords {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(relationship, "relationship");
        filters = filters == null ? List.of() : List.copyOf(filters);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    public FindRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship) {
        this(record, relationship, List.of(), List.of(), null);
    }

    @Override
    public @NotNull String op() {
        return "findRelatedRecords";
    }

    @Override
    public boolean isCollection() {
        return true;
    }

    public static final class Builder extends CollectionQueryBuilder<FindRelatedRecords, Builder> {
        private final RecordIdentity record;
        private final String relationship;

        Builder(@NotNull RecordIdentity record, @NotNull String relationship) {
            this.record = Objects.requireNonNull(record, "record");
            this.relationship = Objects.requireNonNull(relationship, "relationship");
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public FindRelatedRecords build() {
            return new FindRelatedRecords(record, relationship, filters, sort, page);
        }
    }
}
