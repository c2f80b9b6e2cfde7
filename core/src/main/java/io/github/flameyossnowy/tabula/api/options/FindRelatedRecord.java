package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record FindRelatedRecord(@NotNull RecordIdentity record, @NotNull String relationship) implements QueryExpression {
    public FindRelatedRecord {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(relationship, "relationship");
    }

    @Override
    public @NotNull String op() {
        return "findRelatedRecord";
    }

    @Override
    public boolean isCollection() {
        return false;
    }
}
