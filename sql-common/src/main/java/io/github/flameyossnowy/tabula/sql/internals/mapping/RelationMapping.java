package io.github.flameyossnowy.tabula.sql.internals.mapping;

import org.jetbrains.annotations.NotNull;

/**
 * How one relationship is stored.
 */
public sealed interface RelationMapping permits RelationMapping.OwnedForeignKey, RelationMapping.TargetForeignKey, RelationMapping.JoinTable {

    @NotNull String targetType();

    @NotNull String targetTable();

    /**
     * Whether the relationship holds a list of records.
     */
    boolean isCollection();

    /**
     * Single-valued relationship stored as a key column on the owner's own table.
     */
    record OwnedForeignKey(@NotNull String column, @NotNull String targetType, @NotNull String targetTable) implements RelationMapping {
        @Override
        public boolean isCollection() {
            return false;
        }
    }

    /**
     * Collection whose inverse is single-valued: the target table carries {@code inverseColumn}
     * pointing back at the owner.
     */
    record TargetForeignKey(@NotNull String targetType, @NotNull String targetTable, @NotNull String inverseColumn) implements RelationMapping {
        @Override
        public boolean isCollection() {
            return true;
        }
    }

    /**
     * Collection on both sides. {@code ownerColumn} holds the id of the record that owns this
     * relationship, {@code relatedColumn} the id of the record on the other side.
     */
    record JoinTable(
        @NotNull String table,
        @NotNull String ownerColumn,
        @NotNull String relatedColumn,
        @NotNull String targetType,
        @NotNull String targetTable
    ) implements RelationMapping {
        @Override
        public boolean isCollection() {
            return true;
        }
    }
}
