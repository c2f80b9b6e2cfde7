package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Points a single-valued relationship at {@code relatedRecord}, or clears it when that is null.
 */
public record ReplaceRelatedRecord(@NotNull RecordIdentity record, @NotNull String relationship, @Nullable RecordIdentity relatedRecord) implements RecordOperation {
    public ReplaceRelatedRecord {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(relationship, "relationship");
    }

    @Override
    public @NotNull String op() {
        return "replaceRelatedRecord";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
