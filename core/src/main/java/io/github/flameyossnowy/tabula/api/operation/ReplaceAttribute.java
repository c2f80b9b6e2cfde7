package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public record ReplaceAttribute(@NotNull RecordIdentity record, @NotNull String attribute, @Nullable Object value) implements RecordOperation {
    public ReplaceAttribute {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public @NotNull String op() {
        return "replaceAttribute";
    }

    @Override
    public @NotNull String type() {
        return record.type();
    }
}
