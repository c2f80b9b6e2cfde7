package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record RemoveRecord(@NotNull RecordIdentity record) implements RecordOperation {
    public RemoveRecord {
        Objects.requireNonNull(record, "record");
    }

    @Override
    public @NotNull String op() {
        return "removeRecord";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
