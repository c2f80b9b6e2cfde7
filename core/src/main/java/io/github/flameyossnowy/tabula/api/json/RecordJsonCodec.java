package io.github.flameyossnowy.tabula.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.tabula.api.exceptions.QueryNotRecognizedException;
import io.github.flameyossnowy.tabula.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.tabula.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.tabula.api.exceptions.json.JsonProcessException;
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
import io.github.flameyossnowy.tabula.api.options.AttributeSort;
import io.github.flameyossnowy.tabula.api.options.FilterOperator;
import io.github.flameyossnowy.tabula.api.options.FilterOption;
import io.github.flameyossnowy.tabula.api.options.FindRecord;
import io.github.flameyossnowy.tabula.api.options.FindRecords;
import io.github.flameyossnowy.tabula.api.options.FindRecordsByIdentity;
import io.github.flameyossnowy.tabula.api.options.FindRelatedRecord;
import io.github.flameyossnowy.tabula.api.options.FindRelatedRecords;
import io.github.flameyossnowy.tabula.api.options.OffsetLimitPage;
import io.github.flameyossnowy.tabula.api.options.PageOption;
import io.github.flameyossnowy.tabula.api.options.QueryExpression;
import io.github.flameyossnowy.tabula.api.options.QueryResult;
import io.github.flameyossnowy.tabula.api.options.RelatedRecordsFilter;
import io.github.flameyossnowy.tabula.api.options.SortOption;
import io.github.flameyossnowy.tabula.api.options.SortOrder;
import io.github.flameyossnowy.tabula.api.record.GraphRecord;
import io.github.flameyossnowy.tabula.api.record.RecordIdentity;
import io.github.flameyossnowy.tabula.api.record.RelationshipData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads operations, query expressions and records from their JSON wire shape and writes records
 * and query results back.
 *
 * <pre>{@code
 * {"op": "addRecord", "record": {"type": "planet", "id": "p1", "attributes": {"name": "Jupiter"},
 *   "relationships": {"moons": {"data": [{"type": "moon", "id": "m1"}]}}}}
 *
 * {"op": "findRecords", "type": "planet",
 *   "filter": [{"kind": "attribute", "attribute": "sequence", "op": "gt", "value": 2}],
 *   "sort": ["-name"], "page": {"kind": "offsetLimit", "offset": 1, "limit": 2}}
 * }</pre>
 */
public class RecordJsonCodec {
    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes;

    public RecordJsonCodec() {
        this(new ObjectMapper());
    }

    public RecordJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.nodes = mapper.getNodeFactory();
    }

    // ==================== Operations ====================

    public @NotNull RecordOperation readOperation(@NotNull String json) {
        return readOperation(parse(json));
    }

    /**
     * Reads a single operation object or an array of them.
     */
    public @NotNull List<RecordOperation> readOperations(@NotNull String json) {
        JsonNode root = parse(json);
        List<RecordOperation> operations = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) operations.add(readOperation(node));
        } else {
            operations.add(readOperation(root));
        }
        return operations;
    }

    public @NotNull RecordOperation readOperation(@NotNull JsonNode node) {
        String op = requireText(node, "op");
        return switch (op) {
            case "addRecord" -> new AddRecord(readRecord(require(node, "record")));
            case "updateRecord" -> new UpdateRecord(readRecord(require(node, "record")));
            case "removeRecord" -> new RemoveRecord(readIdentity(require(node, "record")));
            case "replaceAttribute" -> new ReplaceAttribute(
                readIdentity(require(node, "record")),
                requireText(node, "attribute"),
                readValue(node.get("value")));
            case "replaceRelatedRecord" -> {
                JsonNode related = node.get("relatedRecord");
                yield new ReplaceRelatedRecord(
                    readIdentity(require(node, "record")),
                    requireText(node, "relationship"),
                    related == null || related.isNull() ? null : readIdentity(related));
            }
            case "replaceRelatedRecords" -> new ReplaceRelatedRecords(
                readIdentity(require(node, "record")),
                requireText(node, "relationship"),
                readIdentities(require(node, "relatedRecords")));
            case "addToRelatedRecords" -> new AddToRelatedRecords(
                readIdentity(require(node, "record")),
                requireText(node, "relationship"),
                readIdentity(require(node, "relatedRecord")));
            case "removeFromRelatedRecords" -> new RemoveFromRelatedRecords(
                readIdentity(require(node, "record")),
                requireText(node, "relationship"),
                readIdentity(require(node, "relatedRecord")));
            default -> throw new IllegalArgumentException("Unknown operation: " + op);
        };
    }

    // ==================== Query expressions ====================

    public @NotNull QueryExpression readQuery(@NotNull String json) {
        return readQuery(parse(json));
    }

    public @NotNull List<QueryExpression> readQueries(@NotNull String json) {
        JsonNode root = parse(json);
        List<QueryExpression> expressions = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) expressions.add(readQuery(node));
        } else {
            expressions.add(readQuery(root));
        }
        return expressions;
    }

    public @NotNull QueryExpression readQuery(@NotNull JsonNode node) {
        String op = requireText(node, "op");
        return switch (op) {
            case "findRecord" -> new FindRecord(readIdentity(require(node, "record")));
            case "findRecords" -> {
                JsonNode records = node.get("records");
                if (records != null && !records.isNull()) {
                    yield new FindRecordsByIdentity(readIdentities(records));
                }
                yield new FindRecords(requireText(node, "type"), readFilters(node.get("filter")), readSort(node.get("sort")), readPage(node.get("page")));
            }
            case "findRelatedRecord" -> new FindRelatedRecord(readIdentity(require(node, "record")), requireText(node, "relationship"));
            case "findRelatedRecords" -> new FindRelatedRecords(
                readIdentity(require(node, "record")),
                requireText(node, "relationship"),
                readFilters(node.get("filter")),
                readSort(node.get("sort")),
                readPage(node.get("page")));
            default -> throw new IllegalArgumentException("Unknown query expression: " + op);
        };
    }

    private List<FilterOption> readFilters(@Nullable JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        List<FilterOption> filters = new ArrayList<>(node.size());
        for (JsonNode filter : node) {
            String kind = requireText(filter, "kind");
            switch (kind) {
                case "attribute" -> filters.add(new AttributeFilter(
                    requireText(filter, "attribute"),
                    filter.hasNonNull("op") ? FilterOperator.fromWireName(filter.get("op").asText()) : FilterOperator.EQUAL,
                    readValue(filter.get("value"))));
                case "relatedRecords" -> filters.add(new RelatedRecordsFilter(
                    requireText(filter, "relation"),
                    readIdentities(require(filter, "records")),
                    filter.hasNonNull("op") ? filter.get("op").asText() : "equal"));
                default -> throw new QueryNotRecognizedException("Filter kind not recognized", kind);
            }
        }
        return filters;
    }

    private List<SortOption> readSort(@Nullable JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        List<SortOption> sort = new ArrayList<>(node.size());
        for (JsonNode option : node) {
            if (option.isTextual()) {
                sort.add(AttributeSort.parse(option.asText()));
                continue;
            }

            String kind = requireText(option, "kind");
            if (!"attribute".equals(kind)) {
                throw new QueryNotRecognizedException("Sort kind not recognized", kind);
            }
            sort.add(new AttributeSort(
                requireText(option, "attribute"),
                option.hasNonNull("order") ? SortOrder.fromWireName(option.get("order").asText()) : SortOrder.ASCENDING));
        }
        return sort;
    }

    private @Nullable PageOption readPage(@Nullable JsonNode node) {
        if (node == null || node.isNull()) return null;
        String kind = node.hasNonNull("kind") ? node.get("kind").asText() : "offsetLimit";
        if (!"offsetLimit".equals(kind)) {
            throw new QueryNotRecognizedException("Page kind not recognized", kind);
        }
        return new OffsetLimitPage(
            node.hasNonNull("offset") ? node.get("offset").asInt() : null,
            node.hasNonNull("limit") ? node.get("limit").asInt() : null);
    }

    // ==================== Records ====================

    public @NotNull GraphRecord readRecord(@NotNull String json) {
        return readRecord(parse(json));
    }

    public @NotNull GraphRecord readRecord(@NotNull JsonNode node) {
        String type = requireText(node, "type");
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;

        Map<String, Object> attributes = null;
        JsonNode attributeNode = node.get("attributes");
        if (attributeNode != null && attributeNode.isObject()) {
            attributes = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = attributeNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                attributes.put(entry.getKey(), readValue(entry.getValue()));
            }
        }

        Map<String, RelationshipData> relationships = null;
        JsonNode relationshipNode = node.get("relationships");
        if (relationshipNode != null && relationshipNode.isObject()) {
            relationships = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = relationshipNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode data = entry.getValue().get("data");
                if (data != null && data.isArray()) {
                    relationships.put(entry.getKey(), RelationshipData.hasMany(readIdentities(data)));
                } else {
                    relationships.put(entry.getKey(), RelationshipData.hasOne(data == null || data.isNull() ? null : readIdentity(data)));
                }
            }
        }
        return new GraphRecord(type, id, attributes, relationships);
    }

    public @NotNull String writeRecord(@Nullable GraphRecord record) {
        return write(recordNode(record));
    }

    public @NotNull String writeRecords(@NotNull List<GraphRecord> records) {
        ArrayNode array = nodes.arrayNode(records.size());
        for (GraphRecord record : records) array.add(recordNode(record));
        return write(array);
    }

    public @NotNull String writeResult(@NotNull QueryResult result) {
        return result.isCollection() ? writeRecords(result.records()) : writeRecord(result.record());
    }

    public @NotNull JsonNode recordNode(@Nullable GraphRecord record) {
        if (record == null) return nodes.nullNode();

        ObjectNode node = nodes.objectNode();
        node.put("type", record.type());
        if (record.id() != null) node.put("id", record.id());

        if (record.attributes() != null) {
            ObjectNode attributes = node.putObject("attributes");
            record.attributes().forEach((name, value) -> attributes.set(name, valueNode(value)));
        }

        if (record.relationships() != null) {
            ObjectNode relationships = node.putObject("relationships");
            record.relationships().forEach((name, data) -> {
                ObjectNode relationship = relationships.putObject(name);
                if (data instanceof RelationshipData.HasMany many) {
                    ArrayNode array = relationship.putArray("data");
                    for (RecordIdentity identity : many.identities()) array.add(identityNode(identity));
                } else if (data instanceof RelationshipData.HasOne one) {
                    relationship.set("data", one.identity() == null ? nodes.nullNode() : identityNode(one.identity()));
                }
            });
        }
        return node;
    }

    // ==================== Helpers ====================

    private ObjectNode identityNode(RecordIdentity identity) {
        ObjectNode node = nodes.objectNode();
        node.put("type", identity.type());
        node.put("id", identity.id());
        return node;
    }

    private JsonNode valueNode(@Nullable Object value) {
        if (value instanceof TemporalAccessor) {
            return nodes.textNode(value.toString());
        }
        return mapper.valueToTree(value);
    }

    private RecordIdentity readIdentity(JsonNode node) {
        return new RecordIdentity(requireText(node, "type"), requireText(node, "id"));
    }

    private List<RecordIdentity> readIdentities(JsonNode node) {
        if (!node.isArray()) {
            throw new JsonProcessException("Expected an array of record identities", JsonLocation.UNKNOWN);
        }
        List<RecordIdentity> identities = new ArrayList<>(node.size());
        for (JsonNode identity : node) identities.add(readIdentity(identity));
        return identities;
    }

    private static @Nullable Object readValue(@Nullable JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isInt()) return node.intValue();
        if (node.isLong()) return node.longValue();
        if (node.isBigInteger()) {
            BigInteger value = node.bigIntegerValue();
            return value.bitLength() < 64 ? value.longValue() : value;
        }
        if (node.isBigDecimal()) {
            BigDecimal value = node.decimalValue();
            return value.doubleValue();
        }
        if (node.isNumber()) return node.doubleValue();
        return node.toString();
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new JsonProcessException("Missing field \"" + field + '"', JsonLocation.UNKNOWN);
        }
        return value;
    }

    private static String requireText(JsonNode node, String field) {
        return require(node, field).asText();
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }
}
