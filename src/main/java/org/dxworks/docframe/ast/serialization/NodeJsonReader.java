package org.dxworks.docframe.ast.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.docframe.ast.*;
import org.dxworks.docframe.exception.ParsingException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decodes node objects. Every error names the path of the offending field,
 * e.g. {@code root.children[1].content[0].node_type}.
 */
class NodeJsonReader {

    static final String NODE_TYPE = "node_type";

    private static final Set<String> KNOWN_TYPES = Set.of(
            "Document", "Heading", "Paragraph", "CodeBlock", "BlockQuote", "List", "ListItem",
            "Table", "TableRow", "TableCell", "ThematicBreak", "HtmlBlock", "MathBlock",
            "DefinitionList", "DefinitionTerm", "DefinitionDescription",
            "Text", "Strong", "Emphasis", "Code", "Link", "Image", "LineBreak", "HtmlInline", "MathInline",
            "Strikethrough", "Underline", "Superscript", "Subscript");

    static boolean isKnownType(String type) {
        return KNOWN_TYPES.contains(type);
    }

    Node read(JsonNode json, String path) {
        if (json == null || !json.isObject()) {
            throw new ParsingException(path, "Expected a node object at '" + path + "'");
        }
        String type = requireText(json, NODE_TYPE, path);
        Node node = switch (type) {
            case "Document" -> new Document(nodes(json, "children", path));
            case "Heading" -> readHeading(json, path);
            case "Paragraph" -> new Paragraph(nodes(json, "content", path));
            case "CodeBlock" -> readCodeBlock(json, path);
            case "BlockQuote" -> new BlockQuote(nodes(json, "children", path));
            case "List" -> readList(json, path);
            case "ListItem" -> readListItem(json, path);
            case "Table" -> readTable(json, path);
            case "TableRow" -> readTableRow(json, path);
            case "TableCell" -> readTableCell(json, path);
            case "ThematicBreak" -> new ThematicBreak();
            case "HtmlBlock" -> new HtmlBlock(requireText(json, "content", path));
            case "MathBlock" -> readMathBlock(json, path);
            case "DefinitionList" -> readDefinitionList(json, path);
            case "DefinitionTerm" -> new DefinitionTerm(nodes(json, "content", path));
            case "DefinitionDescription" -> new DefinitionDescription(nodes(json, "content", path));
            case "Text" -> new Text(requireText(json, "content", path));
            case "Strong" -> new Strong(nodes(json, "content", path));
            case "Emphasis" -> new Emphasis(nodes(json, "content", path));
            case "Code" -> new Code(requireText(json, "content", path));
            case "Link" -> readLink(json, path);
            case "Image" -> readImage(json, path);
            case "LineBreak" -> new LineBreak(optionalBoolean(json, "soft", false, path));
            case "HtmlInline" -> new HtmlInline(requireText(json, "content", path));
            case "MathInline" -> readMathInline(json, path);
            case "Strikethrough" -> new Strikethrough(nodes(json, "content", path));
            case "Underline" -> new Underline(nodes(json, "content", path));
            case "Superscript" -> new Superscript(nodes(json, "content", path));
            case "Subscript" -> new Subscript(nodes(json, "content", path));
            default -> throw new ParsingException(path + "." + NODE_TYPE, "Unknown node_type '" + type + "' at '" + path + "'");
        };
        node.metadata = metadata(json.get("metadata"), path + ".metadata");
        node.sourceLocation = readLocation(json.get("source_location"), path + ".source_location");
        return node;
    }

    private Heading readHeading(JsonNode json, String path) {
        int level = requireInt(json, "level", path);
        if (level < Heading.MIN_LEVEL || level > Heading.MAX_LEVEL) {
            throw new ParsingException(path + ".level", "Heading level must be between 1 and 6, got " + level);
        }
        return new Heading(level, nodes(json, "content", path));
    }

    private CodeBlock readCodeBlock(JsonNode json, String path) {
        CodeBlock codeBlock = new CodeBlock(requireText(json, "content", path), optionalText(json, "language", path));
        String fenceChar = optionalText(json, "fence_char", path);
        if (fenceChar != null) {
            if (fenceChar.length() != 1) {
                throw new ParsingException(path + ".fence_char", "Field 'fence_char' must be a single character");
            }
            codeBlock.fenceChar = fenceChar.charAt(0);
        }
        codeBlock.fenceLength = optionalInt(json, "fence_length", 3, path);
        return codeBlock;
    }

    private ListBlock readList(JsonNode json, String path) {
        boolean ordered = requireBoolean(json, "ordered", path);
        ListBlock list = new ListBlock(ordered, typedNodes(json, "items", ListItem.class, path));
        list.start = optionalInt(json, "start", 1, path);
        list.tight = optionalBoolean(json, "tight", true, path);
        return list;
    }

    private ListItem readListItem(JsonNode json, String path) {
        ListItem item = new ListItem(nodes(json, "children", path));
        String status = optionalText(json, "task_status", path);
        if (status != null) {
            try {
                item.taskStatus = ListItem.TaskStatus.valueOf(status.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ParsingException(path + ".task_status", "Unknown task_status '" + status + "'", e);
            }
        }
        return item;
    }

    private Table readTable(JsonNode json, String path) {
        JsonNode headerJson = json.get("header");
        TableRow header = null;
        if (headerJson != null && !headerJson.isNull()) {
            header = expect(read(headerJson, path + ".header"), TableRow.class, path + ".header");
        }
        Table table = new Table(header, typedNodes(json, "rows", TableRow.class, path));
        JsonNode alignments = json.get("alignments");
        if (alignments != null && !alignments.isNull()) {
            if (!alignments.isArray()) {
                throw new ParsingException(path + ".alignments", "Field 'alignments' must be an array");
            }
            for (int i = 0; i < alignments.size(); i++) {
                JsonNode value = alignments.get(i);
                table.alignments.add(value.isNull() ? null : alignment(value, path + ".alignments[" + i + "]"));
            }
        }
        table.caption = optionalText(json, "caption", path);
        return table;
    }

    private TableRow readTableRow(JsonNode json, String path) {
        TableRow row = new TableRow(typedNodes(json, "cells", TableCell.class, path));
        row.header = optionalBoolean(json, "is_header", false, path);
        return row;
    }

    private TableCell readTableCell(JsonNode json, String path) {
        TableCell cell = new TableCell(nodes(json, "content", path));
        cell.colspan = optionalInt(json, "colspan", 1, path);
        cell.rowspan = optionalInt(json, "rowspan", 1, path);
        JsonNode alignment = json.get("alignment");
        if (alignment != null && !alignment.isNull()) {
            cell.alignment = alignment(alignment, path + ".alignment");
        }
        return cell;
    }

    private MathBlock readMathBlock(JsonNode json, String path) {
        MathBlock math = new MathBlock(optionalText(json, "content", path));
        math.notation = textOr(optionalText(json, "notation", path), MathBlock.DEFAULT_NOTATION);
        math.representations = representations(json, path);
        return math;
    }

    private MathInline readMathInline(JsonNode json, String path) {
        MathInline math = new MathInline(optionalText(json, "content", path));
        math.notation = textOr(optionalText(json, "notation", path), MathInline.DEFAULT_NOTATION);
        math.representations = representations(json, path);
        return math;
    }

    private DefinitionList readDefinitionList(JsonNode json, String path) {
        List<DefinitionList.Item> items = new ArrayList<>();
        JsonNode array = json.get("items");
        if (array != null && !array.isNull()) {
            if (!array.isArray()) {
                throw new ParsingException(path + ".items", "Field 'items' must be an array");
            }
            for (int i = 0; i < array.size(); i++) {
                String itemPath = path + ".items[" + i + "]";
                JsonNode item = array.get(i);
                JsonNode termJson = item.get("term");
                if (termJson == null) {
                    throw new ParsingException(itemPath + ".term", "Missing required field 'term' at '" + itemPath + "'");
                }
                DefinitionTerm term = expect(read(termJson, itemPath + ".term"), DefinitionTerm.class, itemPath + ".term");
                items.add(new DefinitionList.Item(term,
                        typedNodes(item, "descriptions", DefinitionDescription.class, itemPath)));
            }
        }
        return new DefinitionList(items);
    }

    private Link readLink(JsonNode json, String path) {
        Link link = new Link(requireText(json, "url", path), nodes(json, "content", path));
        link.title = optionalText(json, "title", path);
        return link;
    }

    private Image readImage(JsonNode json, String path) {
        Image image = new Image(requireText(json, "url", path), optionalText(json, "alt_text", path));
        image.title = optionalText(json, "title", path);
        image.width = optionalInteger(json, "width", path);
        image.height = optionalInteger(json, "height", path);
        return image;
    }

    private SourceLocation readLocation(JsonNode json, String path) {
        if (json == null || json.isNull()) {
            return null;
        }
        if (!json.isObject()) {
            throw new ParsingException(path, "Field '" + path + "' must be an object");
        }
        SourceLocation location = new SourceLocation(requireText(json, "format", path));
        location.page = optionalInteger(json, "page", path);
        location.line = optionalInteger(json, "line", path);
        location.column = optionalInteger(json, "column", path);
        location.elementId = optionalText(json, "element_id", path);
        location.metadata = metadata(json.get("metadata"), path + ".metadata");
        return location;
    }

    private List<Node> nodes(JsonNode json, String field, String path) {
        JsonNode array = json.get(field);
        List<Node> result = new ArrayList<>();
        if (array == null || array.isNull()) {
            return result;
        }
        if (!array.isArray()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' must be an array");
        }
        for (int i = 0; i < array.size(); i++) {
            result.add(read(array.get(i), path + "." + field + "[" + i + "]"));
        }
        return result;
    }

    private <T extends Node> List<T> typedNodes(JsonNode json, String field, Class<T> type, String path) {
        List<Node> nodes = nodes(json, field, path);
        List<T> result = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            result.add(expect(nodes.get(i), type, path + "." + field + "[" + i + "]"));
        }
        return result;
    }

    private <T extends Node> T expect(Node node, Class<T> type, String path) {
        if (!type.isInstance(node)) {
            String expected = type == ListBlock.class ? "List" : type.getSimpleName();
            throw new ParsingException(path + "." + NODE_TYPE,
                    "Expected " + expected + " at '" + path + "', got " + node.nodeType());
        }
        return type.cast(node);
    }

    private Map<String, Object> metadata(JsonNode json, String path) {
        if (json == null || json.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!json.isObject()) {
            throw new ParsingException(path, "Field '" + path + "' must be an object");
        }
        return AstJsonCodec.MAPPER.convertValue(json, AstJsonCodec.MAP_TYPE);
    }

    private Map<String, String> representations(JsonNode json, String path) {
        Map<String, String> result = new LinkedHashMap<>();
        JsonNode value = json.get("representations");
        if (value == null || value.isNull()) {
            return result;
        }
        if (!value.isObject()) {
            throw new ParsingException(path + ".representations", "Field 'representations' must be an object");
        }
        value.fields().forEachRemaining(entry -> result.put(entry.getKey(), entry.getValue().asText()));
        return result;
    }

    private Alignment alignment(JsonNode value, String path) {
        try {
            return Alignment.fromExternalName(value.asText());
        } catch (IllegalArgumentException e) {
            throw new ParsingException(path, "Unknown alignment '" + value.asText() + "' at '" + path + "'", e);
        }
    }

    private static String requireText(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new ParsingException(path + "." + field, "Missing required field '" + field + "' at '" + path + "'");
        }
        if (!value.isTextual()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' must be a string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' must be a string");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode json, String field, String path) {
        Integer value = optionalInteger(json, field, path);
        if (value == null) {
            throw new ParsingException(path + "." + field, "Missing required field '" + field + "' at '" + path + "'");
        }
        return value;
    }

    private static int optionalInt(JsonNode json, String field, int defaultValue, String path) {
        Integer value = optionalInteger(json, field, path);
        return value == null ? defaultValue : value;
    }

    private static Integer optionalInteger(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' must be an integer");
        }
        if (!value.canConvertToInt()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' is out of range: " + value.asText());
        }
        return value.intValue();
    }

    private static boolean requireBoolean(JsonNode json, String field, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new ParsingException(path + "." + field, "Missing required field '" + field + "' at '" + path + "'");
        }
        return booleanValue(value, field, path);
    }

    private static boolean optionalBoolean(JsonNode json, String field, boolean defaultValue, String path) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return booleanValue(value, field, path);
    }

    private static boolean booleanValue(JsonNode value, String field, String path) {
        if (!value.isBoolean()) {
            throw new ParsingException(path + "." + field, "Field '" + field + "' at '" + path + "' must be a boolean");
        }
        return value.asBoolean();
    }

    private static String textOr(String value, String defaultValue) {
        return value == null ? defaultValue : value;
    }
}
