package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

public record ReplaceRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship, @NotNull List<RecordIdentity> relatedRecords) implements RecordOperation {
    public ReplaceRelatedRecords {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(relationship, "relationship");
        relatedRecords = List.copyOf(relatedRecords);
    }

    @Override
    public @NotNull String op() {
        return "replaceRelatedRecords";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
