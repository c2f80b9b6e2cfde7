package io.github.flameyossnowy.tabula.sql.internals;

import io.github.flameyossnowy.tabula.api.connection.TransactionContext;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.time.Instant;

/**
 * State shared by the operations of one batch.
 *
 * @param transaction the batch transaction
 * @param timestamp   the instant written to {@code created_at}/{@code updated_at} by this batch
 */
public record OperationContext(@NotNull TransactionContext<Connection> transaction, @NotNull Instant timestamp) {
    public @NotNull Connection connection() {
        return transaction.connection();
    }
}
