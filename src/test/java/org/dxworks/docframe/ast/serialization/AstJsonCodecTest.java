package org.dxworks.docframe.ast.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.docframe.ast.*;
import org.dxworks.docframe.exception.ParsingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstJsonCodecTest {

    private static Document richDocument() {
        Heading heading = Heading.of(2, "Intro");
        heading.sourceLocation = SourceLocation.atLine("markdown", 1);

        ListItem done = ListItem.of(Paragraph.of(new Text("done")));
        done.taskStatus = ListItem.TaskStatus.CHECKED;
        ListBlock list = ListBlock.numbered(done, ListItem.of(Paragraph.of(new Text("next"))));
        list.start = 3;

        Table table = new Table(TableRow.of("Name", "Value"), List.of(TableRow.of("a", "1")));
        table.alignments = new ArrayList<>(List.of(Alignment.LEFT, Alignment.RIGHT));
        table.caption = "Values";

        Image image = new Image("pic.png", "A picture");
        image.width = 640;

        MathBlock math = new MathBlock("e = mc^2");
        math.representations.put("mathml", "<math/>");

        CodeBlock code = new CodeBlock("print(1)", "python");
        code.fenceChar = '~';

        Document document = Document.of(
                heading,
                Paragraph.of(new Text("Some "), Strong.of(new Text("bold")), new LineBreak(true),
                        Link.of("https://example.org", "link"), new MathInline("x^2"),
                        Strikethrough.of(new Text("old")), Subscript.of(new Text("2"))),
                list,
                table,
                Paragraph.of(image),
                code,
                math,
                new DefinitionList(List.of(new DefinitionList.Item(DefinitionTerm.of(new Text("term")),
                        List.of(DefinitionDescription.of(new Text("meaning")))))),
                BlockQuote.of(Paragraph.of(new Text("quoted"))),
                new ThematicBreak(),
                new HtmlBlock("<div></div>"));

        Map<String, Object> custom = new LinkedHashMap<>();
        custom.put("pages", 3);
        document.metadata.put(DocumentMetadata.TITLE, "Report");
        document.metadata.put(DocumentMetadata.KEYWORDS, List.of("json", "ast"));
        document.metadata.put(DocumentMetadata.CUSTOM, custom);
        return document;
    }

    @Test
    void roundTripKeepsNodeTypesMetadataAndText() {
        Document original = richDocument();

        Document decoded = AstJsonCodec.fromJson(AstJsonCodec.toJson(original));

        assertEquals(NodeCollector.nodeTypes(original), NodeCollector.nodeTypes(decoded));
        assertEquals(original.metadata, decoded.metadata);
        assertEquals(NodeText.of(original), NodeText.of(decoded));
    }

    @Test
    void roundTripKeepsVariantFields() {
        Document decoded = AstJsonCodec.fromJson(AstJsonCodec.toPrettyJson(richDocument()));

        Heading heading = (Heading) decoded.children.get(0);
        assertEquals(2, heading.level);
        assertEquals(SourceLocation.atLine("markdown", 1), heading.sourceLocation);

        ListBlock list = (ListBlock) decoded.children.get(2);
        assertTrue(list.ordered);
        assertEquals(3, list.start);
        assertEquals(ListItem.TaskStatus.CHECKED, list.items.get(0).taskStatus);

        Table table = (Table) decoded.children.get(3);
        assertEquals(List.of(Alignment.LEFT, Alignment.RIGHT), table.alignments);
        assertEquals("Values", table.caption);

        Image image = (Image) ((Paragraph) decoded.children.get(4)).content.get(0);
        assertEquals(640, image.width);
        assertEquals("A picture", image.altText);

        CodeBlock code = (CodeBlock) decoded.children.get(5);
        assertEquals('~', code.fenceChar);
        assertEquals("python", code.language);

        MathBlock math = (MathBlock) decoded.children.get(6);
        assertEquals(Map.of("mathml", "<math/>"), math.representations);
    }

    @Test
    void envelopeCarriesSchemaVersionAndDiscriminators() {
        JsonNode tree = AstJsonCodec.toTree(Document.of(Heading.of(1, "x")));

        assertEquals(AstJsonCodec.SCHEMA_VERSION, tree.get("schema_version").asInt());
        assertEquals("Document", tree.get("root").get("node_type").asText());
        assertEquals("Heading", tree.get("root").get("children").get(0).get("node_type").asText());
    }

    @Test
    void listsUseTheListDiscriminator() {
        JsonNode tree = AstJsonCodec.toTree(Document.of(ListBlock.bullets(ListItem.of())));

        assertEquals("List", tree.get("root").get("children").get(0).get("node_type").asText());
    }

    @Test
    void nonDocumentRootIsRejected() {
        String json = AstJsonCodec.toJson(Paragraph.of(new Text("fragment")));

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.node_type", e.getField());
    }

    @Test
    void nodeFromJsonAcceptsFragments() {
        String json = AstJsonCodec.toJson(Paragraph.of(new Text("fragment")));

        Node node = AstJsonCodec.nodeFromJson(json);

        assertInstanceOf(Paragraph.class, node);
        assertEquals("fragment", NodeText.of(node));
    }

    @Test
    void unsupportedSchemaVersionIsRejected() {
        String json = "{\"schema_version\": 2, \"root\": {\"node_type\": \"Document\", \"children\": []}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("schema_version", e.getField());
        assertTrue(e.getMessage().contains("Unsupported schema_version 2"));
    }

    @Test
    void schemaVersionBeyondIntRangeIsRejected() {
        String json = "{\"schema_version\": 4294967297, \"root\": {\"node_type\": \"Document\", \"children\": []}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("schema_version", e.getField());
        assertTrue(e.getMessage().contains("4294967297"));
    }

    @Test
    void missingSchemaVersionIsRejected() {
        ParsingException e = assertThrows(ParsingException.class,
                () -> AstJsonCodec.fromJson("{\"root\": {\"node_type\": \"Document\"}}"));
        assertEquals("schema_version", e.getField());
    }

    @Test
    void unknownDiscriminatorNamesItsPath() {
        String json = "{\"schema_version\": 1, \"root\": {\"node_type\": \"Document\", \"children\": ["
                + "{\"node_type\": \"Paragraph\", \"content\": [{\"node_type\": \"Sparkle\"}]}]}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.children[0].content[0].node_type", e.getField());
    }

    @Test
    void missingRequiredFieldNamesItsPath() {
        String json = "{\"schema_version\": 1, \"root\": {\"node_type\": \"Document\", \"children\": ["
                + "{\"node_type\": \"Heading\", \"content\": []}]}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.children[0].level", e.getField());
    }

    @Test
    void outOfRangeHeadingLevelIsRejected() {
        String json = "{\"schema_version\": 1, \"root\": {\"node_type\": \"Document\", \"children\": ["
                + "{\"node_type\": \"Heading\", \"level\": 7, \"content\": []}]}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.children[0].level", e.getField());
    }

    @Test
    void headingLevelBeyondIntRangeIsRejected() {
        String json = "{\"schema_version\": 1, \"root\": {\"node_type\": \"Document\", \"children\": ["
                + "{\"node_type\": \"Heading\", \"level\": 4294967298, \"content\": []}]}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.children[0].level", e.getField());
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    void wrongChildVariantIsRejected() {
        String json = "{\"schema_version\": 1, \"root\": {\"node_type\": \"Document\", \"children\": ["
                + "{\"node_type\": \"List\", \"ordered\": false, \"items\": [{\"node_type\": \"Text\", \"content\": \"x\"}]}]}}";

        ParsingException e = assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson(json));
        assertEquals("root.children[0].items[0].node_type", e.getField());
    }

    @Test
    void malformedJsonIsAParsingError() {
        assertThrows(ParsingException.class, () -> AstJsonCodec.fromJson("{not json"));
    }
}
