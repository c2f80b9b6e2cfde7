package io.github.flameyossnowy.tabula.api.record;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Identity of a record: its type and a caller-assigned, opaque id.
 */
public record RecordIdentity(@NotNull String type, @NotNull String id) {
    public RecordIdentity {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return type + ':' + id;
    }
}
