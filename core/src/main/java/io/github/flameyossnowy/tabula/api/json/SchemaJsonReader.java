package io.github.flameyossnowy.tabula.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.tabula.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.tabula.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.tabula.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.tabula.api.schema.AttributeType;
import io.github.flameyossnowy.tabula.api.schema.ModelDefinition;
import io.github.flameyossnowy.tabula.api.schema.RecordSchema;
import io.github.flameyossnowy.tabula.api.schema.RelationshipDefinition;
import io.github.flameyossnowy.tabula.api.schema.RelationshipKind;
import io.github.flameyossnowy.tabula.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a schema declaration of the form
 *
 * <pre>{@code
 * {
 *   "models": {
 *     "planet": {
 *       "attributes": { "name": { "type": "string" } },
 *       "relationships": { "moons": { "kind": "hasMany", "type": "moon", "inverse": "planet" } }
 *     }
 *   }
 * }
 * }</pre>
 *
 * A relationship {@code type} may also be an array of type names; such declarations load but are
 * rejected once mappings are compiled.
 */
public class SchemaJsonReader {
    private final ObjectMapper mapper;

    public SchemaJsonReader() {
        this(new ObjectMapper());
    }

    public SchemaJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public @NotNull RecordSchema read(@NotNull String json) {
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }

    public @NotNull RecordSchema read(@NotNull InputStream stream) {
        try {
            return read(mapper.readTree(stream));
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        } catch (IOException e) {
            throw new JsonProcessException(e.getMessage(), e, JsonLocation.UNKNOWN);
        }
    }

    public @NotNull RecordSchema read(@NotNull Path path) {
        try (InputStream stream = Files.newInputStream(path)) {
            return read(stream);
        } catch (IOException e) {
            throw new JsonProcessException("Cannot read schema from " + path + ": " + e.getMessage(), e, JsonLocation.UNKNOWN);
        }
    }

    private RecordSchema read(JsonNode root) {
        JsonNode models = root == null ? null : root.get("models");
        if (models == null || !models.isObject()) {
            throw new JsonProcessException("Schema declaration needs a \"models\" object", JsonLocation.UNKNOWN);
        }

        RecordSchema.Builder schema = RecordSchema.builder();
        for (Iterator<Map.Entry<String, JsonNode>> it = models.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> model = it.next();
            schema.model(readModel(model.getKey(), model.getValue()));
        }

        RecordSchema result = schema.build();
        Logging.deepInfo(() -> "Read schema with " + result.models().size() + " models");
        return result;
    }

    private static ModelDefinition readModel(String name, JsonNode node) {
        ModelDefinition.Builder model = ModelDefinition.builder(name);

        JsonNode attributes = node.get("attributes");
        if (attributes != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = attributes.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> attribute = it.next();
                JsonNode type = attribute.getValue().get("type");
                if (type == null) {
                    throw new JsonProcessException("Attribute " + name + '.' + attribute.getKey() + " has no type", JsonLocation.UNKNOWN);
                }
                model.attribute(attribute.getKey(), AttributeType.fromWireName(type.asText()));
            }
        }

        JsonNode relationships = node.get("relationships");
        if (relationships != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = relationships.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> relationship = it.next();
                model.relationship(readRelationship(name, relationship.getKey(), relationship.getValue()));
            }
        }
        return model.build();
    }

    private static RelationshipDefinition readRelationship(String model, String name, JsonNode node) {
        JsonNode kind = node.get("kind");
        if (kind == null) {
            throw new JsonProcessException("Relationship " + model + '.' + name + " has no kind", JsonLocation.UNKNOWN);
        }

        List<String> targets = new ArrayList<>(1);
        JsonNode type = node.get("type");
        if (type != null && type.isArray()) {
            for (JsonNode target : type) targets.add(target.asText());
        } else if (type != null && !type.isNull()) {
            targets.add(type.asText());
        }

        JsonNode inverse = node.get("inverse");
        return new RelationshipDefinition(
            name,
            RelationshipKind.fromWireName(kind.asText()),
            targets,
            inverse == null || inverse.isNull() ? null : inverse.asText()
        );
    }
}
