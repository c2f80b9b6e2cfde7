package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import org.jetbrains.annotations.NotNull;

public enum FilterOperator {
    EQUAL("equal", "="),
    GT("gt", ">"),
    LT("lt", "<"),
    GTE("gte", ">="),
    LTE("lte", "<=");

    private final String wireName;
    private final String symbol;

    FilterOperator(String wireName, String symbol) {
        this.wireName = wireName;
        this.symbol = symbol;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The SQL comparison symbol.
     */
    public String symbol() {
        return symbol;
    }

    public static @NotNull FilterOperator fromWireName(String name) {
        for (FilterOperator operator : values()) {
            if (operator.wireName.equals(name)) return operator;
        }
        throw new QueryNotRecognizedException("Filter comparator not recognized", name);
    }
}
