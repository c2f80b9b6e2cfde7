package io.github.flameyossnowy.tabula.sql;

import io.github.flameyossnowy.tabula.api.RecordSource;
import io.github.flameyossnowy.tabula.api.connection.TransactionContext;
import io.github.flameyossnowy.tabula.api.exceptions.RepositoryException;
import io.github.flameyossnowy.tabula.api.operation.RecordOperation;
import io.github.flameyossnowy.tabula.api.options.QueryExpression;
import io.github.flameyossnowy.tabula.api.options.QueryResult;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.OperationContext;
import io.github.flameyossnowy.tabula.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.tabula.sql.internals.RecordProcessor;
import io.github.flameyossnowy.tabula.sql.internals.SQLConnectionProvider;
import io.github.flameyossnowy.tabula.sql.internals.migration.SchemaMigrator;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Record source over a JDBC database. Dialect specifics live in {@link QueryParseEngine.SQLType};
 * subclasses only choose the dialect and how connections are made.
 */
public abstract class AbstractRelationalRecordSource implements RecordSource {
    private final SQLConnectionProvider dataSource;
    private final RecordSchema schema;
    private final RecordProcessor processor;
    private final SchemaMigrator migrator;
    private final Clock clock;

    protected AbstractRelationalRecordSource(
        @NotNull SQLConnectionProvider dataSource,
        @NotNull RecordSchema schema,
        @NotNull QueryParseEngine.SQLType sqlType,
        boolean autoMigrate,
        @NotNull Clock clock
    ) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.clock = clock;

        Logging.info(() -> "Initializing " + sqlType.getName() + " record source with " + schema.models().size() + " record types");
        this.processor = new RecordProcessor(schema, dataSource, sqlType);
        this.migrator = new SchemaMigrator(dataSource, processor.getModelMapper(), processor.getEngine(), processor.getWriteExecutor());

        if (autoMigrate) migrate();
    }

    @Override
    public @NotNull RecordSchema getSchema() {
        return schema;
    }

    public @NotNull SQLConnectionProvider getDataSource() {
        return dataSource;
    }

    /**
     * Creates every missing table. Safe to call repeatedly.
     */
    public void migrate() {
        migrator.migrate();
    }

    public @NotNull TransactionContext<Connection> beginTransaction() {
        try {
            return new SimpleTransactionContext(dataSource.getConnection());
        } catch (SQLException e) {
            throw new RepositoryException(e);
        }
    }

    @Override
    public @NotNull List<GraphRecord> update(@NotNull List<RecordOperation> operations) {
        if (operations.isEmpty()) return List.of();

        return inTransaction(context -> {
            List<GraphRecord> results = new ArrayList<>(operations.size());
            for (RecordOperation operation : operations) {
                results.add(processor.process(context, operation));
            }
            return results;
        });
    }

    @Override
    public @NotNull List<QueryResult> query(@NotNull List<QueryExpression> expressions) {
        if (expressions.isEmpty()) return List.of();

        return inTransaction(context -> {
            List<QueryResult> results = new ArrayList<>(expressions.size());
            for (QueryExpression expression : expressions) {
                results.add(processor.query(context, expression));
            }
            return results;
        });
    }

    private <R> R inTransaction(Function<OperationContext, R> work) {
        try (TransactionContext<Connection> transaction = beginTransaction()) {
            OperationContext context = new OperationContext(transaction, clock.instant());
            try {
                R result = work.apply(context);
                transaction.commit();
                return result;
            } catch (Exception e) {
                rollback(transaction, e);
                throw e;
            }
        } catch (RuntimeException e) {
            Logging.info(() -> "Batch rolled back: " + e.getMessage());
            throw e;
        } catch (Exception e) {
            throw new RepositoryException(e);
        }
    }

    private static void rollback(TransactionContext<Connection> transaction, Exception cause) {
        try {
            transaction.rollback();
        } catch (Exception rollbackFailure) {
            Logging.error("Failed to roll back transaction", rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
