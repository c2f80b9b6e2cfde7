package io.github.flameyossnowy.tabula.sqlite;

import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.sql.AbstractRelationalRecordSource;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;

public class SQLiteRecordSource extends AbstractRelationalRecordSource {
    SQLiteRecordSource(@NotNull SQLConnectionProvider dataSource, @NotNull RecordSchema schema, boolean autoMigrate, @NotNull Clock clock) {
        super(dataSource, schema, QueryParseEngine.SQLType.SQLITE, autoMigrate, clock);
    }

    public static @NotNull SQLiteRecordSourceBuilder builder(@NotNull RecordSchema schema) {
        return new SQLiteRecordSourceBuilder(schema);
    }
}
