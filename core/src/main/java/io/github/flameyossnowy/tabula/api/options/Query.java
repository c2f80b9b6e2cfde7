package io.github.flameyossnowy.tabula.api.options;

import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Factory for the query expressions, with convenient static methods.
 */
public final class Query {
    private Query() {}

    public static FindRecord findRecord(@NotNull String type, @NotNull String id) {
        return new FindRecord(new RecordIdentity(type, id));
    }

    public static FindRecord findRecord(@NotNull RecordIdentity identity) {
        return new FindRecord(identity);
    }

    /**
     * Start building a query over every record of {@code type}.
     */
    public static FindRecords.Builder findRecords(@NotNull String type) {
        return new FindRecords.Builder(type);
    }

    public static FindRecordsByIdentity findRecords(@NotNull List<RecordIdentity> identities) {
        return new FindRecordsByIdentity(identities);
    }

    public static FindRelatedRecord findRelatedRecord(@NotNull RecordIdentity identity, @NotNull String relationship) {
        return new FindRelatedRecord(identity, relationship);
    }

    /**
     * Start building a query over the members of a collection relationship.
     */
    public static FindRelatedRecords.Builder findRelatedRecords(@NotNull RecordIdentity identity, @NotNull String relationship) {
        return new FindRelatedRecords.Builder(identity, relationship);
    }

    public static AttributeFilter eq(@NotNull String attribute, Object value) {
        return new AttributeFilter(attribute, FilterOperator.EQUAL, value);
    }

    public static AttributeFilter gt(@NotNull String attribute, Object value) {
        return new AttributeFilter(attribute, FilterOperator.GT, value);
    }

    public static AttributeFilter gte(@NotNull String attribute, Object value) {
        return new AttributeFilter(attribute, FilterOperator.GTE, value);
    }

    public static AttributeFilter lt(@NotNull String attribute, Object value) {
        return new AttributeFilter(attribute, FilterOperator.LT, value);
    }

    public static AttributeFilter lte(@NotNull String attribute, Object value) {
        return new AttributeFilter(attribute, FilterOperator.LTE, value);
    }
}
