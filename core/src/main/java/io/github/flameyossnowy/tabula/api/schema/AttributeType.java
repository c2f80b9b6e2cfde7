package io.github.flameyossnowy.tabula.api.schema;

import org.jetbrains.annotations.NotNull;

/**
 * Primitive attribute types a schema can declare.
 */
public enum AttributeType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime");

    private final String wireName;

    AttributeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static @NotNull AttributeType fromWireName(String name) {
        for (AttributeType type : values()) {
            if (type.wireName.equals(name)) return type;
        }
        throw new IllegalArgumentException("Unknown attribute type: " + name);
    }
}
