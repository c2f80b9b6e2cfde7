package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Merges attributes into an existing record. Relationships present in the payload replace the
 * stored set; relationships and attributes left out are not touched.
 */
public record UpdateRecord(@NotNull GraphRecord record) implements RecordOperation {
    public UpdateRecord {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(record.id(), "An updated record needs an id");
    }

    @Override
    public @NotNull String op() {
        return "updateRecord";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
