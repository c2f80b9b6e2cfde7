package io.github.flameyossnowy.tabula.sqlite.connections;

import io.github.flameyossnowy.tabula.api.Optimizations;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.tabula.sqlite.credentials.SQLiteCredentials;
import org.jetbrains.annotations.NotNull;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Properties;

/**
 * Opens a fresh connection to the database file per call. An in-memory url would give every
 * connection its own empty database, so use a file.
 */
public class SQLiteSimpleConnectionProvider implements SQLConnectionProvider {
    static final int BUSY_TIMEOUT_MILLIS = 5000;

    private final String url;
    private final Properties properties;

    public SQLiteSimpleConnectionProvider(@NotNull SQLiteCredentials credentials, @NotNull EnumSet<Optimizations> optimizations) {
        this.url = credentials.jdbcUrl();
        this.properties = configure(optimizations).toProperties();
        Logging.info(() -> "Created SQLite connection provider for " + url + " with " + optimizations);
    }

    static @NotNull SQLiteConfig configure(@NotNull EnumSet<Optimizations> optimizations) {
        SQLiteConfig config = new SQLiteConfig();
        if (optimizations.contains(Optimizations.WRITE_AHEAD_LOGGING)) {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        if (optimizations.contains(Optimizations.RELAXED_SYNCHRONOUS)) {
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        }
        if (optimizations.contains(Optimizations.MEMORY_TEMP_STORE)) {
            config.setTempStore(SQLiteConfig.TempStore.MEMORY);
        }
        if (optimizations.contains(Optimizations.BUSY_TIMEOUT)) {
            config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        }
        return config;
    }

    @Override
    public @NotNull Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    @Override
    public void close() {
        Logging.deepInfo(() -> "Closed SQLite connection provider for " + url);
    }
}
