package io.github.flameyossnowy.tabula.sqlite;

import io.github.flameyossnowy.tabula.api.Optimizations;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.tabula.sqlite.connections.SQLiteSimpleConnectionProvider;
import io.github.flameyossnowy.tabula.sqlite.credentials.SQLiteCredentials;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.function.BiFunction;

@SuppressWarnings("unused")
public class SQLiteRecordSourceBuilder {
    private SQLiteCredentials credentials;
    private BiFunction<SQLiteCredentials, EnumSet<Optimizations>, SQLConnectionProvider> connectionProvider;
    private final EnumSet<Optimizations> optimizations = EnumSet.noneOf(Optimizations.class);
    private final RecordSchema schema;

    private boolean autoMigrate = true;
    private Clock clock = Clock.systemUTC();

    public SQLiteRecordSourceBuilder(RecordSchema schema) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
    }

    public SQLiteRecordSourceBuilder withConnectionProvider(BiFunction<SQLiteCredentials, EnumSet<Optimizations>, SQLConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    public SQLiteRecordSourceBuilder withCredentials(SQLiteCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public SQLiteRecordSourceBuilder withOptimizations(Optimizations... optimizations) {
        Collections.addAll(this.optimizations, optimizations);
        return this;
    }

    public SQLiteRecordSourceBuilder withOptimizations(Collection<Optimizations> optimizations) {
        this.optimizations.addAll(optimizations);
        return this;
    }

    /**
     * Whether missing tables are created when the source is built. Defaults to true.
     */
    public SQLiteRecordSourceBuilder withAutoMigrate(boolean autoMigrate) {
        this.autoMigrate = autoMigrate;
        return this;
    }

    /**
     * Clock for {@code created_at}/{@code updated_at}. Defaults to the UTC system clock.
     */
    public SQLiteRecordSourceBuilder withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        return this;
    }

    public SQLiteRecordSource build() {
        if (this.credentials == null) throw new IllegalArgumentException("Credentials cannot be null");

        return new SQLiteRecordSource(
            this.connectionProvider != null ? this.connectionProvider.apply(credentials, this.optimizations) : new SQLiteSimpleConnectionProvider(this.credentials, this.optimizations),
            this.schema,
            this.autoMigrate,
            this.clock
        );
    }
}
