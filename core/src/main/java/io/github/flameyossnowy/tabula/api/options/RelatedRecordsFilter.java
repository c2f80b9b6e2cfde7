package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Matches records by the contents of one of their relationships. Decoded from the wire but not
 * executed by the relational backends, which reject it.
 */
public record RelatedRecordsFilter(@NotNull String relation, @NotNull List<RecordIdentity> records, @NotNull String op) implements FilterOption {
    public RelatedRecordsFilter {
        records = List.copyOf(records);
    }

    @Override
    public @NotNull String kind() {
        return "relatedRecords";
    }

    @Override
    public String toString() {
        return "relatedRecords(" + relation + ' ' + op + ' ' + records + ')';
    }
}
