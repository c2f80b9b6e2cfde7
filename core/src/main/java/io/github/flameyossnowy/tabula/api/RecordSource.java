package io.github.flameyossnowy.tabula.api;

import io.github.flameyossnowy.tabula.api.operation.RecordOperation;
import io.github.flameyossnowy.tabula.api.options.FindRecord;
import io.github.flameyossnowy.tabula.api.options.QueryExpression;
import io.github.flameyossnowy.tabula.api.options.QueryResult;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Entry point of a storage backend.
 *
 * <p>A batch of operations runs in exactly one transaction: either every operation is applied, or
 * the first failure rolls the batch back and is rethrown. Query batches are read-only.</p>
 */
public interface RecordSource extends AutoCloseable {

    @NotNull RecordSchema getSchema();

    /**
     * Applies the operations in order. The result holds one record per operation: the stored
     * record after the change, or for removals the record as it was before.
     */
    @NotNull List<GraphRecord> update(@NotNull List<RecordOperation> operations);

    default @NotNull GraphRecord update(@NotNull RecordOperation operation) {
        return update(List.of(operation)).get(0);
    }

    @NotNull List<QueryResult> query(@NotNull List<QueryExpression> expressions);

    default @NotNull QueryResult query(@NotNull QueryExpression expression) {
        return query(List.of(expression)).get(0);
    }

    /**
     * Fetches one record.
     *
     * @throws io.github.flameyossnowy.tabula.api.exceptions.RecordNotFoundException if it does not exist
     */
    default @NotNull GraphRecord findRecord(@NotNull String type, @NotNull String id) {
        GraphRecord record = query(new FindRecord(new RecordIdentity(type, id))).record();
        if (record == null) throw new IllegalStateException("Find record returned no record for " + type + ':' + id);
        return record;
    }

    @Override
    void close();
}
