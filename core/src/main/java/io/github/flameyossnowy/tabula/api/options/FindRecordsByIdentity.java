package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Looks up several records at once. Identities that do not resolve are dropped from the result
 * instead of failing the query; the remaining records keep the input order.
 */
public record FindRecordsByIdentity(@NotNull List<RecordIdentity> records) implements QueryExpression {
    public FindRecordsByIdentity {
        records = List.copyOf(records);
    }

    @Override
    public @NotNull String op() {
        return "findRecords";
    }

    @Override
    public boolean isCollection() {
        return true;
    }
}
