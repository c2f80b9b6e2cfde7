package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared filter/sort/page state of the collection query builders.
 *
 * <pre>{@code
 * Query.findRecords("planet")
 *     .where("sequence").gt(2)
 *     .sort("-name", "sequence")
 *     .page(1, 2)
 *     .build();
 * }</pre>
 *
 * @param <Q> the expression produced by {@link #build()}
 * @param <B> the concrete builder type
 */
public abstract class CollectionQueryBuilder<Q extends QueryExpression, B extends CollectionQueryBuilder<Q, B>> implements Filterable {
    protected final List<FilterOption> filters = new ArrayList<>();
    protected final List<SortOption> sort = new ArrayList<>();
    protected @Nullable PageOption page;

    protected abstract B self();

    public abstract Q build();

    /**
     * Begins a comparison on the given attribute.
     */
    public QueryField<B> where(@NotNull String attribute) {
        return new QueryField<>(self(), attribute);
    }

    public B where(@NotNull FilterOption filter) {
        filters.add(filter);
        return self();
    }

    public B where(@NotNull List<? extends FilterOption> filters) {
        this.filters.addAll(filters);
        return self();
    }

    /**
     * Adds sort keys in shorthand form: {@code "name"} sorts ascending, {@code "-name"} descending.
     */
    public B sort(@NotNull String... attributes) {
        for (String attribute : attributes) {
            sort.add(AttributeSort.parse(attribute));
        }
        return self();
    }

    public B sort(@NotNull SortOption option) {
        sort.add(option);
        return self();
    }

    public B sort(@NotNull String attribute, @NotNull SortOrder order) {
        sort.add(new AttributeSort(attribute, order));
        return self();
    }

    public B page(int offset, int limit) {
        this.page = new OffsetLimitPage(offset, limit);
        return self();
    }

    public B page(@Nullable PageOption page) {
        this.page = page;
        return self();
    }

    public B limit(int limit) {
        this.page = new OffsetLimitPage(currentPage().offset(), limit);
        return self();
    }

    public B offset(int offset) {
        this.page = new OffsetLimitPage(offset, currentPage().limit());
        return self();
    }

    private OffsetLimitPage currentPage() {
        return page instanceof OffsetLimitPage offsetLimit ? offsetLimit : new OffsetLimitPage(null, null);
    }

    @Override
    public void addFilter(@NotNull FilterOption filter) {
        filters.add(filter);
    }
}
