package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import org.jetbrains.annotations.NotNull;

public enum SortOrder {
    ASCENDING("ascending", "ASC"),
    DESCENDING("descending", "DESC");

    private final String wireName;
    private final String keyword;

    SortOrder(String wireName, String keyword) {
        this.wireName = wireName;
        this.keyword = keyword;
    }

    public String wireName() {
        return wireName;
    }

    public String keyword() {
        return keyword;
    }

    public static @NotNull SortOrder fromWireName(String name) {
        for (SortOrder order : values()) {
            if (order.wireName.equals(name)) return order;
        }
        throw new QueryNotRecognizedException("Sort order not recognized", name);
    }
}
