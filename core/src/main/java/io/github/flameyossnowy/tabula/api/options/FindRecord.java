package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record FindRecord(@NotNull RecordIdentity record) implements QueryExpression {
    public FindRecord {
        Objects.requireNonNull(record, "record");
    }

    @Override
    public @NotNull String op() {
        return "findRecord";
    }

    @Override
    public boolean isCollection() {
        return false;
    }
}
