package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record RemoveFromRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship, @NotNull RecordIdentity relatedRecord) implements RecordOperation {
    public RemoveFromRelatedRecords {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(relationship, "relationship");
        Objects.requireNonNull(relatedRecord, "relatedRecord");
    }

    @Override
    public @NotNull String op() {
        return "removeFromRelatedRecords";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
