package io.defcheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.defcheck.core.error.SchemaLoadException;
import io.defcheck.core.model.Definition;
import io.defcheck.core.model.PrimitiveType;
import io.defcheck.core.model.PropertySpec;
import io.defcheck.core.model.Schema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the {@code definitions} block of an already-parsed Swagger 2 document into
 * the immutable {@link Schema} model.
 *
 * <p>
 * Only the keywords the structural validator uses are read: {@code properties},
 * {@code enum}, {@code type}, {@code $ref} and {@code items}. Everything else
 * (descriptions, formats, patterns, composition keywords) is ignored.
 *
 * <p>
 * Performs no I/O: reading and downloading the document is the caller's job.
 * Thread-safe, stateless.
 */
public final class SwaggerSchemaParser {

    private static final Logger LOG = LoggerFactory.getLogger(SwaggerSchemaParser.class);

    private SwaggerSchemaParser() {
        // utility class
    }

    /**
     * Parses a Swagger document tree.
     *
     * @param root   the whole Swagger document
     * @param source where the document came from, for error messages
     * @return the schema, with definitions in document order
     * @throws SchemaLoadException if there is no object-valued {@code definitions} member
     */
    public static Schema parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaLoadException("Swagger document must be a JSON object", source);
        }
        JsonNode definitionsNode = root.get("definitions");
        if (definitionsNode == null || !definitionsNode.isObject()) {
            throw new SchemaLoadException("Swagger document has no 'definitions' object", source);
        }

        Map<String, Definition> definitions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : definitionsNode.properties()) {
            definitions.put(entry.getKey(), parseDefinition(entry.getKey(), entry.getValue()));
        }

        LOG.debug("Parsed {} definitions from {}", definitions.size(), source);
        return new Schema(source, definitions);
    }

    private static Definition parseDefinition(String name, JsonNode node) {
        Map<String, PropertySpec> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = node.path("properties");
        if (propertiesNode.isObject()) {
            for (Map.Entry<String, JsonNode> property : propertiesNode.properties()) {
                properties.put(property.getKey(), parseProperty(property.getValue()));
            }
        }
        return new Definition(name, properties, enumValues(node));
    }

    /**
     * Maps a property (or {@code items}) declaration to its variant. Precedence:
     * {@code $ref}, inline {@code enum}, {@code type: array}, other primitive type.
     */
    static PropertySpec parseProperty(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new PropertySpec.Untyped();
        }

        JsonNode ref = node.get("$ref");
        if (ref != null && ref.isTextual()) {
            return new PropertySpec.Reference(ref.asText());
        }

        PrimitiveType type = PrimitiveType.fromKeyword(node.path("type").asText(null))
                .orElse(null);

        JsonNode enumNode = node.get("enum");
        if (enumNode != null && enumNode.isArray()) {
            return new PropertySpec.Enumerated(type, enumValues(node));
        }

        if (type == PrimitiveType.ARRAY) {
            return new PropertySpec.ArrayOf(parseProperty(node.get("items")));
        }
        return type == null ? new PropertySpec.Untyped() : new PropertySpec.Primitive(type);
    }

    private static List<JsonNode> enumValues(JsonNode node) {
        JsonNode enumNode = node.get("enum");
        if (enumNode == null || !enumNode.isArray()) {
            return List.of();
        }
        List<JsonNode> values = new ArrayList<>(enumNode.size());
        enumNode.forEach(values::add);
        return values;
    }
}
