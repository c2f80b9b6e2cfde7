package io.github.flameyossnowy.tabula.api.connection;

import org.jetbrains.annotations.NotNull;

/**
 * A unit of work bound to one backend connection.
 *
 * @param <C> the connection type
 */
public interface TransactionContext<C> extends AutoCloseable {
    @NotNull C connection();

    void commit() throws Exception;

    void rollback() throws Exception;

    @Override
    void close() throws Exception;
}
