package io.github.flameyossnowy.tabula.sql.internals.repository;

import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.sql.internals.codec.RecordCodec;
import org.jetbrains.annotations.NotNull;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class SqlResultMapper {
    private final RecordCodec codec;

    public SqlResultMapper(@NotNull RecordCodec codec) {
        this.codec = codec;
    }

    public @NotNull List<GraphRecord> mapResults(@NotNull ResultSet resultSet, @NotNull String type) throws SQLException {
        List<GraphRecord> results = new ArrayList<>();
        while (resultSet.next()) {
            results.add(codec.fromRow(readRow(resultSet), type));
        }
        return results;
    }

    /**
     * The current row keyed by lower-case column label.
     */
    public @NotNull Map<String, Object> readRow(@NotNull ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            row.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), resultSet.getObject(i));
        }
        return row;
    }

    public @NotNull List<String> extractIds(@NotNull ResultSet resultSet) throws SQLException {
        List<String> ids = new ArrayList<>();
        while (resultSet.next()) {
            Object id = resultSet.getObject(1);
            if (id != null) ids.add(id.toString());
        }
        return ids;
    }
}
