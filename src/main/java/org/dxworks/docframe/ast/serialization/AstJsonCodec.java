package org.dxworks.docframe.ast.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.exception.ParsingException;

import java.util.LinkedHashMap;

/**
 * Reads and writes the JSON interchange form of a tree.
 * <p>
 * Payload shape:
 * <pre>
 * {
 *   "schema_version" : 1,
 *   "root" : { "node_type" : "Document", "children" : [ ... ], "metadata" : { } }
 * }
 * </pre>
 * Every node object carries a {@code node_type} discriminator. Payloads declaring any other
 * schema version are rejected before the tree is looked at.
 */
public final class AstJsonCodec {

    public static final int SCHEMA_VERSION = 1;
    public static final String SCHEMA_VERSION_FIELD = "schema_version";
    public static final String ROOT_FIELD = "root";

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private AstJsonCodec() {
    }

    public static String toJson(Node node) {
        return write(MAPPER, node);
    }

    public static String toPrettyJson(Node node) {
        return write(PRETTY_MAPPER, node);
    }

    public static ObjectNode toTree(Node node) {
        ObjectNode envelope = MAPPER.createObjectNode();
        envelope.put(SCHEMA_VERSION_FIELD, SCHEMA_VERSION);
        envelope.set(ROOT_FIELD, node.accept(new NodeJsonWriter(MAPPER)));
        return envelope;
    }

    /**
     * Decodes a payload whose root must be a {@link Document}.
     *
     * @throws ParsingException naming the offending field when the payload is malformed,
     *                          declares an unsupported schema version, or has a non-Document root
     */
    public static Document fromJson(String json) {
        return fromTree(readTree(json));
    }

    public static Document fromTree(JsonNode envelope) {
        JsonNode root = rootOf(envelope);
        JsonNode type = root.get(NodeJsonReader.NODE_TYPE);
        if (type != null && type.isTextual() && NodeJsonReader.isKnownType(type.asText())
                && !"Document".equals(type.asText())) {
            throw new ParsingException(ROOT_FIELD + "." + NodeJsonReader.NODE_TYPE,
                    "Root node must be a Document, got " + type.asText());
        }
        Node node = new NodeJsonReader().read(root, ROOT_FIELD);
        if (!(node instanceof Document document)) {
            throw new ParsingException(ROOT_FIELD + "." + NodeJsonReader.NODE_TYPE,
                    "Root node must be a Document, got " + node.nodeType());
        }
        return document;
    }

    /**
     * Decodes a payload whose root may be any node, e.g. a serialized fragment.
     */
    public static Node nodeFromJson(String json) {
        return new NodeJsonReader().read(rootOf(readTree(json)), ROOT_FIELD);
    }

    private static String write(ObjectMapper mapper, Node node) {
        try {
            return mapper.writeValueAsString(toTree(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + node.nodeType(), e);
        }
    }

    private static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParsingException(null, "Malformed AST JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode rootOf(JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            throw new ParsingException(null, "AST payload must be a JSON object");
        }
        JsonNode version = envelope.get(SCHEMA_VERSION_FIELD);
        if (version == null || version.isNull()) {
            throw new ParsingException(SCHEMA_VERSION_FIELD, "Missing required field '" + SCHEMA_VERSION_FIELD + "'");
        }
        if (!version.isIntegralNumber()) {
            throw new ParsingException(SCHEMA_VERSION_FIELD,
                    "Field '" + SCHEMA_VERSION_FIELD + "' must be an integer, got " + version);
        }
        if (!version.canConvertToInt() || version.intValue() != SCHEMA_VERSION) {
            throw new ParsingException(SCHEMA_VERSION_FIELD,
                    "Unsupported schema_version " + version.asText() + " (supported: " + SCHEMA_VERSION + ")");
        }
        JsonNode root = envelope.get(ROOT_FIELD);
        if (root == null || !root.isObject()) {
            throw new ParsingException(ROOT_FIELD, "Missing required object field '" + ROOT_FIELD + "'");
        }
        return root;
    }
}
