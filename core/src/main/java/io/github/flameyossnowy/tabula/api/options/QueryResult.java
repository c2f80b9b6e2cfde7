package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one {@link QueryExpression}: a single record (possibly absent) or a list of records.
 */
public sealed interface QueryResult permits QueryResult.Single, QueryResult.Many {

    static Single single(@Nullable GraphRecord record) {
        return new Single(record);
    }

    static Many many(@NotNull List<GraphRecord> records) {
        return new Many(records);
    }

    boolean isCollection();

    /**
     * The single record; fails for collection results.
     */
    @Nullable GraphRecord record();

    /**
     * The records of a collection result, or the single record wrapped in a list (empty when absent).
     */
    @NotNull List<GraphRecord> records();

    record Single(@Nullable GraphRecord record) implements QueryResult {
        @Override
        public boolean isCollection() {
            return false;
        }

        @Override
        public @NotNull List<GraphRecord> records() {
            return record == null ? List.of() : List.of(record);
        }
    }

    record Many(@NotNull List<GraphRecord> records) implements QueryResult {
        public Many {
            records = List.copyOf(records);
        }

        @Override
        public boolean isCollection() {
            return true;
        }

        @Override
        public @Nullable GraphRecord record() {
            throw new IllegalStateException("Collection result has no single record");
        }
    }
}
