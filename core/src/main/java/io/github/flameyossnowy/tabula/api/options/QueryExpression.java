package io.github.flameyossnowy.tabula.api.options;

import org.jetbrains.annotations.NotNull;

/**
 * A read request. Expressions are built through {@link Query} or decoded from their JSON wire shape.
 */
public sealed interface QueryExpression permits FindRecord, FindRecords, FindRecordsByIdentity, FindRelatedRecord, FindRelatedRecords {

    /**
     * Wire tag of this expression, e.g. {@code findRecords}.
     */
    @NotNull String op();

    /**
     * Whether this expression resolves to a list of records rather than a single one.
     */
    boolean isCollection();
}
