package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Inserts a new record and links every relationship present in its payload.
 * A record without an id is given one from the schema's id generator.
 */
public record AddRecord(@NotNull GraphRecord record) implements RecordOperation {
    public AddRecord {
        Objects.requireNonNull(record, "record");
    }

    @Override
    public @NotNull String op() {
        return "addRecord";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
