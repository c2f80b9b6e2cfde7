package io.github.flameyossnowy.tabula.sqlite.credentials;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of a SQLite database file.
 */
public record SQLiteCredentials(@NotNull String path) {
    public SQLiteCredentials {
        Objects.requireNonNull(path, "path");
    }

    public SQLiteCredentials(@NotNull Path path) {
        this(path.toAbsolutePath().toString());
    }

    public @NotNull String jdbcUrl() {
        return "jdbc:sqlite:" + path;
    }
}
