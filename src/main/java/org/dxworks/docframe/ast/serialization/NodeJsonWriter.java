package org.dxworks.docframe.ast.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.docframe.ast.*;

import java.util.List;
import java.util.Locale;

class NodeJsonWriter implements NodeVisitor<ObjectNode> {

    private final ObjectMapper mapper;

    NodeJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    private ObjectNode start(Node node) {
        ObjectNode json = mapper.createObjectNode();
        json.put(NodeJsonReader.NODE_TYPE, node.nodeType());
        return json;
    }

    private ObjectNode finish(ObjectNode json, Node node) {
        json.set("metadata", mapper.valueToTree(node.metadata));
        if (node.sourceLocation != null) {
            json.set("source_location", writeLocation(node.sourceLocation));
        }
        return json;
    }

    private ObjectNode writeLocation(SourceLocation location) {
        ObjectNode json = mapper.createObjectNode();
        json.put("format", location.format);
        if (location.page != null) json.put("page", location.page);
        if (location.line != null) json.put("line", location.line);
        if (location.column != null) json.put("column", location.column);
        if (location.elementId != null) json.put("element_id", location.elementId);
        if (!location.metadata.isEmpty()) json.set("metadata", mapper.valueToTree(location.metadata));
        return json;
    }

    private ArrayNode writeAll(List<? extends Node> nodes) {
        ArrayNode array = mapper.createArrayNode();
        for (Node node : nodes) {
            array.add(node.accept(this));
        }
        return array;
    }

    private ObjectNode withContent(Node node, List<Node> content) {
        ObjectNode json = start(node);
        json.set("content", writeAll(content));
        return finish(json, node);
    }

    private ObjectNode withLiteral(Node node, String content) {
        ObjectNode json = start(node);
        json.put("content", content);
        return finish(json, node);
    }

    @Override
    public ObjectNode visit(Document document) {
        ObjectNode json = start(document);
        json.set("children", writeAll(document.children));
        return finish(json, document);
    }

    @Override
    public ObjectNode visit(Heading heading) {
        ObjectNode json = start(heading);
        json.put("level", heading.level);
        json.set("content", writeAll(heading.content));
        return finish(json, heading);
    }

    @Override
    public ObjectNode visit(Paragraph paragraph) {
        return withContent(paragraph, paragraph.content);
    }

    @Override
    public ObjectNode visit(CodeBlock codeBlock) {
        ObjectNode json = start(codeBlock);
        json.put("content", codeBlock.content);
        if (codeBlock.language != null) {
            json.put("language", codeBlock.language);
        }
        json.put("fence_char", String.valueOf(codeBlock.fenceChar));
        json.put("fence_length", codeBlock.fenceLength);
        return finish(json, codeBlock);
    }

    @Override
    public ObjectNode visit(BlockQuote blockQuote) {
        ObjectNode json = start(blockQuote);
        json.set("children", writeAll(blockQuote.children));
        return finish(json, blockQuote);
    }

    @Override
    public ObjectNode visit(ListBlock list) {
        ObjectNode json = start(list);
        json.put("ordered", list.ordered);
        json.put("start", list.start);
        json.put("tight", list.tight);
        json.set("items", writeAll(list.items));
        return finish(json, list);
    }

    @Override
    public ObjectNode visit(ListItem listItem) {
        ObjectNode json = start(listItem);
        json.set("children", writeAll(listItem.children));
        if (listItem.taskStatus != null) {
            json.put("task_status", listItem.taskStatus.name().toLowerCase(Locale.ROOT));
        }
        return finish(json, listItem);
    }

    @Override
    public ObjectNode visit(Table table) {
        ObjectNode json = start(table);
        if (table.header != null) {
            json.set("header", table.header.accept(this));
        }
        json.set("rows", writeAll(table.rows));
        if (!table.alignments.isEmpty()) {
            ArrayNode alignments = json.putArray("alignments");
            for (Alignment alignment : table.alignments) {
                if (alignment == null) {
                    alignments.addNull();
                } else {
                    alignments.add(alignment.externalName());
                }
            }
        }
        if (table.caption != null) {
            json.put("caption", table.caption);
        }
        return finish(json, table);
    }

    @Override
    public ObjectNode visit(TableRow tableRow) {
        ObjectNode json = start(tableRow);
        json.set("cells", writeAll(tableRow.cells));
        json.put("is_header", tableRow.header);
        return finish(json, tableRow);
    }

    @Override
    public ObjectNode visit(TableCell tableCell) {
        ObjectNode json = start(tableCell);
        json.set("content", writeAll(tableCell.content));
        json.put("colspan", tableCell.colspan);
        json.put("rowspan", tableCell.rowspan);
        if (tableCell.alignment != null) {
            json.put("alignment", tableCell.alignment.externalName());
        }
        return finish(json, tableCell);
    }

    @Override
    public ObjectNode visit(ThematicBreak thematicBreak) {
        return finish(start(thematicBreak), thematicBreak);
    }

    @Override
    public ObjectNode visit(HtmlBlock htmlBlock) {
        return withLiteral(htmlBlock, htmlBlock.content);
    }

    @Override
    public ObjectNode visit(MathBlock mathBlock) {
        ObjectNode json = withLiteral(mathBlock, mathBlock.content);
        json.put("notation", mathBlock.notation);
        if (!mathBlock.representations.isEmpty()) {
            json.set("representations", mapper.valueToTree(mathBlock.representations));
        }
        return json;
    }

    @Override
    public ObjectNode visit(DefinitionList definitionList) {
        ObjectNode json = start(definitionList);
        ArrayNode items = json.putArray("items");
        for (DefinitionList.Item item : definitionList.items) {
            ObjectNode entry = items.addObject();
            entry.set("term", item.term.accept(this));
            entry.set("descriptions", writeAll(item.descriptions));
        }
        return finish(json, definitionList);
    }

    @Override
    public ObjectNode visit(DefinitionTerm definitionTerm) {
        return withContent(definitionTerm, definitionTerm.content);
    }

    @Override
    public ObjectNode visit(DefinitionDescription definitionDescription) {
        return withContent(definitionDescription, definitionDescription.content);
    }

    @Override
    public ObjectNode visit(Text text) {
        return withLiteral(text, text.content);
    }

    @Override
    public ObjectNode visit(Strong strong) {
        return withContent(strong, strong.content);
    }

    @Override
    public ObjectNode visit(Emphasis emphasis) {
        return withContent(emphasis, emphasis.content);
    }

    @Override
    public ObjectNode visit(Code code) {
        return withLiteral(code, code.content);
    }

    @Override
    public ObjectNode visit(Link link) {
        ObjectNode json = start(link);
        json.put("url", link.url);
        json.set("content", writeAll(link.content));
        if (link.title != null) {
            json.put("title", link.title);
        }
        return finish(json, link);
    }

    @Override
    public ObjectNode visit(Image image) {
        ObjectNode json = start(image);
        json.put("url", image.url);
        json.put("alt_text", image.altText);
        if (image.title != null) json.put("title", image.title);
        if (image.width != null) json.put("width", image.width);
        if (image.height != null) json.put("height", image.height);
        return finish(json, image);
    }

    @Override
    public ObjectNode visit(LineBreak lineBreak) {
        ObjectNode json = start(lineBreak);
        json.put("soft", lineBreak.soft);
        return finish(json, lineBreak);
    }

    @Override
    public ObjectNode visit(HtmlInline htmlInline) {
        return withLiteral(htmlInline, htmlInline.content);
    }

    @Override
    public ObjectNode visit(MathInline mathInline) {
        ObjectNode json = withLiteral(mathInline, mathInline.content);
        json.put("notation", mathInline.notation);
        if (!mathInline.representations.isEmpty()) {
            json.set("representations", mapper.valueToTree(mathInline.representations));
        }
        return json;
    }

    @Override
    public ObjectNode visit(Strikethrough strikethrough) {
        return withContent(strikethrough, strikethrough.content);
    }

    @Override
    public ObjectNode visit(Underline underline) {
        return withContent(underline, underline.content);
    }

    @Override
    public ObjectNode visit(Superscript superscript) {
        return withContent(superscript, superscript.content);
    }

    @Override
    public ObjectNode visit(Subscript subscript) {
        return withContent(subscript, subscript.content);
    }
}
