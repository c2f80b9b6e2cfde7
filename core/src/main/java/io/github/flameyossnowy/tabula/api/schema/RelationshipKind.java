package io.github.flameyossnowy.tabula.api.schema;

import org.jetbrains.annotations.NotNull;

public enum RelationshipKind {
    /** Single-valued. */
    HAS_ONE("hasOne"),
    /** Collection-valued. */
    HAS_MANY("hasMany");

    private final String wireName;

    RelationshipKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCollection() {
        return this == HAS_MANY;
    }

    public static @NotNull RelationshipKind fromWireName(String name) {
        for (RelationshipKind kind : values()) {
            if (kind.wireName.equals(name)) return kind;
        }
        throw new IllegalArgumentException("Unknown relationship kind: " + name);
    }
}
