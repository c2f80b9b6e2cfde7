package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.Contract;

/**
 * Attribute-scoped comparison builder.
 *
 * <p>Ensures comparators are attached to a concrete attribute and prevents
 * malformed filter construction.</p>
 */
public class QueryField<B extends Filterable> {
    private final B builder;
    private final String attribute;

    @Contract(pure = true)
    QueryField(B builder, String attribute) {
        this.builder = builder;
        this.attribute = attribute;
    }

    private B add(FilterOperator operator, Object value) {
        builder.addFilter(new AttributeFilter(attribute, operator, value));
        return builder;
    }

    public B eq(Object value) { return add(FilterOperator.EQUAL, value); }
    public B gt(Object value) { return add(FilterOperator.GT, value); }
    public B gte(Object value) { return add(FilterOperator.GTE, value); }
    public B lt(Object value) { return add(FilterOperator.LT, value); }
    public B lte(Object value) { return add(FilterOperator.LTE, value); }

    public String getAttribute() {
        return attribute;
    }
}
