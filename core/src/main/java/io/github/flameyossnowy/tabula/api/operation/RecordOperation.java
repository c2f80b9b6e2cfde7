package io.github.flameyossnowy.tabula.api.operation;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A write operation addressed to one record.
 *
 * <p>Operations are submitted in batches; a batch is applied in order inside a single
 * transaction and is rolled back as a whole on the first failure.</p>
 */
public sealed interface RecordOperation permits AddRecord, UpdateRecord, RemoveRecord, ReplaceAttribute,
    ReplaceRelatedRecord, ReplaceRelatedRecords, AddToRelatedRecords, RemoveFromRelatedRecords {

    /**
     * Wire tag of this operation, e.g. {@code addRecord}.
     */
    @NotNull String op();

    /**
     * Type of the record this operation addresses.
     */
    @NotNull String type();

    static AddRecord addRecord(@NotNull GraphRecord record) {
        return new AddRecord(record);
    }

    static UpdateRecord updateRecord(@NotNull GraphRecord record) {
        return new UpdateRecord(record);
    }

    static RemoveRecord removeRecord(@NotNull RecordIdentity record) {
        return new RemoveRecord(record);
    }

    static ReplaceAttribute replaceAttribute(@NotNull RecordIdentity record, @NotNull String attribute, @Nullable Object value) {
        return new ReplaceAttribute(record, attribute, value);
    }

    static ReplaceRelatedRecord replaceRelatedRecord(@NotNull RecordIdentity record, @NotNull String relationship, @Nullable RecordIdentity relatedRecord) {
        return new ReplaceRelatedRecord(record, relationship, relatedRecord);
    }

    static ReplaceRelatedRecords replaceRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship, @NotNull List<RecordIdentity> relatedRecords) {
        return new ReplaceRelatedRecords(record, relationship, relatedRecords);
    }

    static AddToRelatedRecords addToRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship, @NotNull RecordIdentity relatedRecord) {
        return new AddToRelatedRecords(record, relationship, relatedRecord);
    }

    static RemoveFromRelatedRecords removeFromRelatedRecords(@NotNull RecordIdentity record, @NotNull String relationship, @NotNull RecordIdentity relatedRecord) {
        return new RemoveFromRelatedRecords(record, relationship, relatedRecord);
    }
}
