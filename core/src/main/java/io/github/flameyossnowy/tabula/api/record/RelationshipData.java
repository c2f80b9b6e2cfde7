package io.github.flameyossnowy.tabula.api.record;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Relationship payload of a record.
 */
public sealed interface RelationshipData permits RelationshipData.HasOne, RelationshipData.HasMany {

    static HasOne hasOne(@Nullable RecordIdentity identity) {
        return new HasOne(identity);
    }

    static HasMany hasMany(@NotNull List<RecordIdentity> identities) {
        return new HasMany(identities);
    }

    /**
     * A single related record, or {@code null} to express "no related record".
     */
    record HasOne(@Nullable RecordIdentity identity) implements RelationshipData {
    }

    record HasMany(@NotNull List<RecordIdentity> identities) implements RelationshipData {
        public HasMany {
            identities = List.copyOf(identities);
        }
    }
}
