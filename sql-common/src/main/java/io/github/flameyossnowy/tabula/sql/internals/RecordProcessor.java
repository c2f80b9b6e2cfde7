package io.github.flameyossnowy.tabula.sql.internals;

import io.github.flameyossnowy.tabula.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.tabula.api.operation.AddRecord;
import io.github.flameyossnowy.tabula.api.operation.AddToRelatedRecords;
import io.github.flameyossnowy.tabula.api.operation.RecordOperation;
import io.github.flameyossnowy.tabula.api.operation.RemoveFromRelatedRecords;
import io.github.flameyossnowy.tabula.api.operation.RemoveRecord;
import io.github.flameyossnowy.tabula.api.operation.ReplaceAttribute;
import io.github.flameyossnowy.tabula.api.operation.ReplaceRelatedRecord;
import io.github.flameyossnowy.tabula.api.operation.ReplaceRelatedRecords;
import io.github.flameyossnowy.tabula.api.operation.UpdateRecord;
import io.github.flameyossnowy.tabula.api.options.AttributeFilter;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.api.options.FindRecord;
import io.github.flameyossnowy.tabula.api.options.FindRecords;
import io.github.flameyossnowy.tabula.api.options.FindRecordsByIdentity;
import io.github.flameyossnowy.tabula.api.options.FindRelatedRecord;
import io.github.flameyossnowy.tabula.api.options.FindRelatedRecords;
import io.github.flameyossnowy.tabula.api.options.QueryExpression;
import io.github.flameyossnowy.tabula.api.options.QueryResult;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.api.record.RelationshipData;
import io.github.flameyossnowy.tabula.api.schema.AttributeDefinition;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import io.github.flameyossnowy.tabula.sql.internals.codec.RecordCodec;
import io.github.flameyossnowy.tabula.sql.internals.codec.RowData;
import io.github.flameyossnowy.tabula.sql.internals.mapping.ModelMapper;
import io.github.flameyossnowy.tabula.sql.internals.mapping.RelationMapping;
import io.github.flameyossnowy.tabula.sql.internals.mapping.TableMapping;
import io.github.flameyossnowy.tabula.sql.internals.repository.SqlParameterBinder;
import io.github.flameyossnowy.tabula.sql.internals.repository.SqlReadExecutor;
import io.github.flameyossnowy.tabula.sql.internals.repository.SqlResultMapper;
import io.github.flameyossnowy.tabula.sql.internals.repository.SqlWriteExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Executes record operations and query expressions inside the transaction of an
 * {@link OperationContext}.
 */
public class RecordProcessor {
    // Stays below SQLITE_MAX_VARIABLE_NUMBER of older SQLite builds (999).
    private static final int MAX_IDS_PER_STATEMENT = 500;

    private final RecordSchema schema;
    private final ModelMapper mapper;
    private final QueryParseEngine engine;
    private final RecordCodec codec;
    private final SqlParameterBinder parameterBinder;
    private final SqlReadExecutor readExecutor;
    private final SqlWriteExecutor writeExecutor;

    public RecordProcessor(@NotNull RecordSchema schema, @NotNull SQLConnectionProvider dataSource, @NotNull QueryParseEngine.SQLType sqlType) {
        this.schema = schema;
        this.mapper = new ModelMapper(schema);
        this.mapper.mapAll();

        this.engine = new QueryParseEngine(sqlType);
        this.codec = new RecordCodec(mapper);
        this.parameterBinder = new SqlParameterBinder(sqlType);
        this.readExecutor = new SqlReadExecutor(dataSource, new SqlResultMapper(codec));
        this.writeExecutor = new SqlWriteExecutor(dataSource);
    }

    public @NotNull ModelMapper getModelMapper() {
        return mapper;
    }

    public @NotNull QueryParseEngine getEngine() {
        return engine;
    }

    public @NotNull SqlWriteExecutor getWriteExecutor() {
        return writeExecutor;
    }

    /*
     * |------------|
     * | Operations |
     * |------------|
     */

    public @NotNull GraphRecord process(@NotNull OperationContext context, @NotNull RecordOperation operation) {
        Logging.deepInfo(() -> "Processing " + operation.op() + " on " + operation.type());

        if (operation instanceof AddRecord add) return addRecord(context, add.record());
        if (operation instanceof UpdateRecord update) return updateRecord(context, update.record());
        if (operation instanceof RemoveRecord remove) return removeRecord(context, remove.record());
        if (operation instanceof ReplaceAttribute replace) return replaceAttribute(context, replace);
        if (operation instanceof ReplaceRelatedRecord replace) return replaceRelatedRecord(context, replace);
        if (operation instanceof ReplaceRelatedRecords replace) return replaceRelatedRecords(context, replace);
        if (operation instanceof AddToRelatedRecords add) return addToRelatedRecords(context, add);
        if (operation instanceof RemoveFromRelatedRecords remove) return removeFromRelatedRecords(context, remove);

        throw new IllegalArgumentException("Unknown operation: " + operation.op());
    }

    private GraphRecord addRecord(OperationContext context, GraphRecord record) {
        GraphRecord stored = record.id() == null ? record.withId(schema.generateId()) : record;
        TableMapping mapping = mapper.mapping(stored.type());
        RowData row = codec.toRow(stored);
        verifyOwnedTargets(context, mapping, stored);

        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        columns.add(TableMapping.ID_COLUMN);
        values.add(stored.id());
        columns.add(TableMapping.CREATED_AT_COLUMN);
        values.add(context.timestamp());
        columns.add(TableMapping.UPDATED_AT_COLUMN);
        values.add(context.timestamp());
        row.columns().forEach((column, value) -> {
            columns.add(column);
            values.add(value);
        });

        writeExecutor.executeUpdate(context.connection(), engine.parseInsert(mapping.table(), columns),
            statement -> parameterBinder.bindAll(statement, 1, values));

        String id = stored.id();
        row.relationships().forEach((name, keys) -> {
            RelationMapping relation = mapping.relation(name);
            for (String key : keys) addLink(context, relation, id, key);
        });

        return requireRecord(context, stored.identity());
    }

    private GraphRecord updateRecord(OperationContext context, GraphRecord record) {
        RecordIdentity identity = record.identity();
        TableMapping mapping = mapper.mapping(identity.type());
        requireRow(context, identity);

        RowData row = codec.toRow(record);
        verifyOwnedTargets(context, mapping, record);

        List<String> setColumns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        List<String> nullColumns = new ArrayList<>();
        setColumns.add(TableMapping.UPDATED_AT_COLUMN);
        values.add(context.timestamp());
        row.columns().forEach((column, value) -> {
            if (value == null) {
                nullColumns.add(column);
            } else {
                setColumns.add(column);
                values.add(value);
            }
        });
        values.add(identity.id());

        writeExecutor.executeUpdate(context.connection(),
            engine.parseUpdate(mapping.table(), setColumns, nullColumns, List.of(TableMapping.ID_COLUMN)),
            statement -> parameterBinder.bindAll(statement, 1, values));

        row.relationships().forEach((name, keys) -> replaceLinks(context, mapping.relation(name), identity.id(), keys));

        return requireRecord(context, identity);
    }

    private GraphRecord removeRecord(OperationContext context, RecordIdentity identity) {
        TableMapping mapping = mapper.mapping(identity.type());
        GraphRecord existing = requireRecord(context, identity);

        writeExecutor.executeUpdate(context.connection(),
            engine.parseDelete(mapping.table(), List.of(TableMapping.ID_COLUMN)),
            statement -> parameterBinder.bind(statement, 1, identity.id()));
        return existing;
    }

    private GraphRecord replaceAttribute(OperationContext context, ReplaceAttribute operation) {
        RecordIdentity identity = operation.record();
        TableMapping mapping = mapper.mapping(identity.type());
        String column = mapping.column(operation.attribute());
        if (column == null || TableMapping.isReserved(operation.attribute())) {
            throw new IllegalArgumentException("Unknown attribute: " + identity.type() + '.' + operation.attribute());
        }
        requireRow(context, identity);

        AttributeDefinition definition = mapping.model().attributes().get(operation.attribute());
        Object value = RecordCodec.toStorageValue(identity.type() + '.' + operation.attribute(), operation.value(), definition.type());
        List<String> setColumns = value == null
            ? List.of(TableMapping.UPDATED_AT_COLUMN)
            : List.of(column, TableMapping.UPDATED_AT_COLUMN);
        List<String> nullColumns = value == null ? List.of(column) : List.of();

        writeExecutor.executeUpdate(context.connection(),
            engine.parseUpdate(mapping.table(), setColumns, nullColumns, List.of(TableMapping.ID_COLUMN)),
            statement -> {
                int index = 1;
                if (value != null) parameterBinder.bind(statement, index++, value);
                parameterBinder.bind(statement, index++, context.timestamp());
                parameterBinder.bind(statement, index, identity.id());
            });

        return requireRecord(context, identity);
    }

    private GraphRecord replaceRelatedRecord(OperationContext context, ReplaceRelatedRecord operation) {
        RecordIdentity identity = operation.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireRelation(mapping, operation.relationship());
        if (!(relation instanceof RelationMapping.OwnedForeignKey owned)) {
            throw new IllegalArgumentException("Relationship " + identity.type() + '.' + operation.relationship()
                + " holds a list of records, use replaceRelatedRecords");
        }
        requireRow(context, identity);

        RecordIdentity related = operation.relatedRecord();
        if (related != null) {
            checkTargetType(identity.type(), operation.relationship(), relation, related);
            requireRow(context, related);
        }

        List<String> setColumns = related == null
            ? List.of(TableMapping.UPDATED_AT_COLUMN)
            : List.of(owned.column(), TableMapping.UPDATED_AT_COLUMN);
        List<String> nullColumns = related == null ? List.of(owned.column()) : List.of();

        writeExecutor.executeUpdate(context.connection(),
            engine.parseUpdate(mapping.table(), setColumns, nullColumns, List.of(TableMapping.ID_COLUMN)),
            statement -> {
                int index = 1;
                if (related != null) parameterBinder.bind(statement, index++, related.id());
                parameterBinder.bind(statement, index++, context.timestamp());
                parameterBinder.bind(statement, index, identity.id());
            });

        return requireRecord(context, identity);
    }

    private GraphRecord replaceRelatedRecords(OperationContext context, ReplaceRelatedRecords operation) {
        RecordIdentity identity = operation.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireCollection(mapping, operation.relationship());
        requireRow(context, identity);

        List<String> keys = new ArrayList<>(operation.relatedRecords().size());
        for (RecordIdentity related : operation.relatedRecords()) {
            checkTargetType(identity.type(), operation.relationship(), relation, related);
            keys.add(related.id());
        }

        replaceLinks(context, relation, identity.id(), keys);
        touch(context, mapping, identity.id());
        return requireRecord(context, identity);
    }

    private GraphRecord addToRelatedRecords(OperationContext context, AddToRelatedRecords operation) {
        RecordIdentity identity = operation.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireCollection(mapping, operation.relationship());
        requireRow(context, identity);
        checkTargetType(identity.type(), operation.relationship(), relation, operation.relatedRecord());

        addLink(context, relation, identity.id(), operation.relatedRecord().id());
        touch(context, mapping, identity.id());
        return requireRecord(context, identity);
    }

    private GraphRecord removeFromRelatedRecords(OperationContext context, RemoveFromRelatedRecords operation) {
        RecordIdentity identity = operation.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireCollection(mapping, operation.relationship());
        requireRow(context, identity);
        checkTargetType(identity.type(), operation.relationship(), relation, operation.relatedRecord());

        removeLink(context, relation, identity.id(), operation.relatedRecord().id());
        touch(context, mapping, identity.id());
        return requireRecord(context, identity);
    }

    /*
     * |-------|
     * | Links |
     * |-------|
     */

    private void addLink(OperationContext context, RelationMapping relation, String ownerId, String relatedId) {
        if (relation instanceof RelationMapping.TargetForeignKey targetKey) {
            String sql = engine.parseUpdate(targetKey.targetTable(), List.of(targetKey.inverseColumn()), List.of(), List.of(TableMapping.ID_COLUMN));
            int rows = writeExecutor.executeUpdate(context.connection(), sql, statement -> {
                parameterBinder.bind(statement, 1, ownerId);
                parameterBinder.bind(statement, 2, relatedId);
            });
            if (rows == 0) throw new RecordNotFoundException(targetKey.targetType(), relatedId);
            return;
        }

        RelationMapping.JoinTable joinTable = (RelationMapping.JoinTable) relation;
        requireRow(context, new RecordIdentity(joinTable.targetType(), relatedId));

        boolean linked = readExecutor.exists(context.connection(), engine.parseLinkExists(joinTable), statement -> {
            parameterBinder.bind(statement, 1, ownerId);
            parameterBinder.bind(statement, 2, relatedId);
        });
        if (linked) {
            Logging.deepInfo(() -> "Link " + ownerId + " -> " + relatedId + " already present in " + joinTable.table());
            return;
        }

        writeExecutor.executeUpdate(context.connection(),
            engine.parseInsert(joinTable.table(), List.of(joinTable.ownerColumn(), joinTable.relatedColumn())),
            statement -> {
                parameterBinder.bind(statement, 1, ownerId);
                parameterBinder.bind(statement, 2, relatedId);
            });
    }

    private void removeLink(OperationContext context, RelationMapping relation, String ownerId, String relatedId) {
        if (relation instanceof RelationMapping.TargetForeignKey targetKey) {
            // Only detach the target if it still points at this owner.
            String sql = engine.parseUpdate(targetKey.targetTable(), List.of(), List.of(targetKey.inverseColumn()),
                List.of(TableMapping.ID_COLUMN, targetKey.inverseColumn()));
            writeExecutor.executeUpdate(context.connection(), sql, statement -> {
                parameterBinder.bind(statement, 1, relatedId);
                parameterBinder.bind(statement, 2, ownerId);
            });
            return;
        }

        RelationMapping.JoinTable joinTable = (RelationMapping.JoinTable) relation;
        writeExecutor.executeUpdate(context.connection(),
            engine.parseDelete(joinTable.table(), List.of(joinTable.ownerColumn(), joinTable.relatedColumn())),
            statement -> {
                parameterBinder.bind(statement, 1, ownerId);
                parameterBinder.bind(statement, 2, relatedId);
            });
    }

    private void replaceLinks(OperationContext context, RelationMapping relation, String ownerId, List<String> keys) {
        Set<String> current = new LinkedHashSet<>(readExecutor.queryIds(context.connection(), engine.parseLinkedIds(relation),
            statement -> parameterBinder.bind(statement, 1, ownerId)));
        Set<String> wanted = new LinkedHashSet<>(keys);

        for (String key : current) {
            if (!wanted.contains(key)) removeLink(context, relation, ownerId, key);
        }
        for (String key : wanted) {
            if (!current.contains(key)) addLink(context, relation, ownerId, key);
        }
    }

    private void touch(OperationContext context, TableMapping mapping, String id) {
        writeExecutor.executeUpdate(context.connection(), engine.parseTouch(mapping), statement -> {
            parameterBinder.bind(statement, 1, context.timestamp());
            parameterBinder.bind(statement, 2, id);
        });
    }

    private void verifyOwnedTargets(OperationContext context, TableMapping mapping, GraphRecord record) {
        if (record.relationships() == null) return;

        record.relationships().forEach((name, data) -> {
            RelationMapping relation = mapping.relation(name);
            if (relation == null) return;

            if (data instanceof RelationshipData.HasOne one && one.identity() != null) {
                checkTargetType(record.type(), name, relation, one.identity());
                requireRow(context, one.identity());
            } else if (data instanceof RelationshipData.HasMany many) {
                for (RecordIdentity related : many.identities()) {
                    checkTargetType(record.type(), name, relation, related);
                }
            }
        });
    }

    /*
     * |---------|
     * | Queries |
     * |---------|
     */

    public @NotNull QueryResult query(@NotNull OperationContext context, @NotNull QueryExpression expression) {
        Logging.deepInfo(() -> "Running query " + expression.op());

        if (expression instanceof FindRecord find) {
            return QueryResult.single(requireRecord(context, find.record()));
        }
        if (expression instanceof FindRecords find) {
            return QueryResult.many(findRecords(context, find));
        }
        if (expression instanceof FindRecordsByIdentity find) {
            return QueryResult.many(findRecordsByIdentity(context, find.records()));
        }
        if (expression instanceof FindRelatedRecord find) {
            return QueryResult.single(findRelatedRecord(context, find));
        }
        if (expression instanceof FindRelatedRecords find) {
            return QueryResult.many(findRelatedRecords(context, find));
        }

        throw new IllegalArgumentException("Unknown query: " + expression.op());
    }

    private List<GraphRecord> findRecords(OperationContext context, FindRecords find) {
        TableMapping mapping = mapper.mapping(find.type());
        String sql = engine.parseSelect(mapping, find.filters(), find.sort(), find.page());
        List<FilterOption> filters = normalizeFilters(mapping, find.filters());
        return readExecutor.search(context.connection(), sql,
            statement -> parameterBinder.addFilterToPreparedStatement(statement, 1, filters), find.type());
    }

    private List<GraphRecord> findRecordsByIdentity(OperationContext context, List<RecordIdentity> identities) {
        Map<String, Set<String>> idsByType = new LinkedHashMap<>();
        for (RecordIdentity identity : identities) {
            idsByType.computeIfAbsent(identity.type(), type -> new LinkedHashSet<>()).add(identity.id());
        }

        Map<RecordIdentity, GraphRecord> found = new HashMap<>();
        idsByType.forEach((type, ids) -> {
            TableMapping mapping = mapper.mapping(type);
            List<String> keys = new ArrayList<>(ids);
            for (int from = 0; from < keys.size(); from += MAX_IDS_PER_STATEMENT) {
                List<String> chunk = keys.subList(from, Math.min(from + MAX_IDS_PER_STATEMENT, keys.size()));
                List<GraphRecord> records = readExecutor.search(context.connection(), engine.parseSelectByIds(mapping, chunk.size()),
                    statement -> parameterBinder.bindAll(statement, 1, chunk), type);
                for (GraphRecord record : records) found.put(record.identity(), record);
            }
        });

        List<GraphRecord> results = new ArrayList<>(identities.size());
        for (RecordIdentity identity : identities) {
            GraphRecord record = found.get(identity);
            if (record != null) results.add(record);
        }
        return results;
    }

    private @Nullable GraphRecord findRelatedRecord(OperationContext context, FindRelatedRecord find) {
        RecordIdentity identity = find.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireRelation(mapping, find.relationship());
        if (!(relation instanceof RelationMapping.OwnedForeignKey owned)) {
            throw new IllegalArgumentException("Relationship " + identity.type() + '.' + find.relationship()
                + " holds a list of records, use findRelatedRecords");
        }

        Object key = requireRow(context, identity).get(owned.column());
        if (key == null) return null;

        TableMapping target = mapper.mapping(owned.targetType());
        Map<String, Object> row = readExecutor.findRow(context.connection(), engine.parseSelectById(target),
            statement -> parameterBinder.bind(statement, 1, key.toString()));
        return row == null ? null : codec.fromRow(row, owned.targetType());
    }

    private List<GraphRecord> findRelatedRecords(OperationContext context, FindRelatedRecords find) {
        RecordIdentity identity = find.record();
        TableMapping mapping = mapper.mapping(identity.type());
        RelationMapping relation = requireCollection(mapping, find.relationship());
        TableMapping target = mapper.mapping(relation.targetType());

        String sql = engine.parseSelectRelated(relation, target, find.filters(), find.sort(), find.page());
        List<FilterOption> filters = normalizeFilters(target, find.filters());
        requireRow(context, identity);

        return readExecutor.search(context.connection(), sql, statement -> {
            parameterBinder.bind(statement, 1, identity.id());
            parameterBinder.addFilterToPreparedStatement(statement, 2, filters);
        }, relation.targetType());
    }

    /*
     * |---------|
     * | Helpers |
     * |---------|
     */

    /**
     * Brings filter values to the stored form of their attribute, so temporal comparisons match.
     */
    private static List<FilterOption> normalizeFilters(TableMapping mapping, List<FilterOption> filters) {
        List<FilterOption> normalized = new ArrayList<>(filters.size());
        for (FilterOption filter : filters) {
            if (filter instanceof AttributeFilter attributeFilter) {
                AttributeDefinition definition = mapping.model().attributes().get(attributeFilter.attribute());
                if (definition != null) {
                    Object value = RecordCodec.toStorageValue(mapping.type() + '.' + definition.name(), attributeFilter.value(), definition.type());
                    normalized.add(new AttributeFilter(attributeFilter.attribute(), attributeFilter.operator(), value));
                    continue;
                }
            }
            normalized.add(filter);
        }
        return normalized;
    }

    private Map<String, Object> requireRow(OperationContext context, RecordIdentity identity) {
        TableMapping mapping = mapper.mapping(identity.type());
        Map<String, Object> row = readExecutor.findRow(context.connection(), engine.parseSelectById(mapping),
            statement -> parameterBinder.bind(statement, 1, identity.id()));
        if (row == null) throw new RecordNotFoundException(identity);
        return row;
    }

    private GraphRecord requireRecord(OperationContext context, RecordIdentity identity) {
        return codec.fromRow(requireRow(context, identity), identity.type());
    }

    private static RelationMapping requireRelation(TableMapping mapping, String relationship) {
        RelationMapping relation = mapping.relation(relationship);
        if (relation == null) {
            throw new IllegalArgumentException("Unknown relationship: " + mapping.type() + '.' + relationship);
        }
        return relation;
    }

    private static RelationMapping requireCollection(TableMapping mapping, String relationship) {
        RelationMapping relation = requireRelation(mapping, relationship);
        if (!relation.isCollection()) {
            throw new IllegalArgumentException("Relationship " + mapping.type() + '.' + relationship
                + " holds a single record, use replaceRelatedRecord");
        }
        return relation;
    }

    private static void checkTargetType(String type, String relationship, RelationMapping relation, RecordIdentity related) {
        if (!relation.targetType().equals(related.type())) {
            throw new IllegalArgumentException("Relationship " + type + '.' + relationship + " expects "
                + relation.targetType() + " records, got " + related.type());
        }
    }
}
