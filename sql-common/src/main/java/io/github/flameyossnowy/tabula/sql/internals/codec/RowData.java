package io.github.flameyossnowy.tabula.sql.internals.codec;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A record flattened for storage.
 *
 * @param id            the record id, if it has one yet
 * @param columns       column values for declared attributes and owned key columns; a null value clears the column
 * @param relationships key lists of the collection relationships present in the payload
 */
public record RowData(
    @Nullable String id,
    @NotNull Map<String, Object> columns,
    @NotNull Map<String, List<String>> relationships
) {
    public RowData {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }
}
