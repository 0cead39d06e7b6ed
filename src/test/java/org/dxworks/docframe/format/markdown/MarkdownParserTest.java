package org.dxworks.docframe.format.markdown;

import org.dxworks.docframe.TestUtils;
import org.dxworks.docframe.ast.Alignment;
import org.dxworks.docframe.ast.CodeBlock;
import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.DocumentMetadata;
import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.Image;
import org.dxworks.docframe.ast.LineBreak;
import org.dxworks.docframe.ast.Link;
import org.dxworks.docframe.ast.ListBlock;
import org.dxworks.docframe.ast.ListItem;
import org.dxworks.docframe.ast.NodeCollector;
import org.dxworks.docframe.ast.NodeText;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.Strikethrough;
import org.dxworks.docframe.ast.Table;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownParserTest {

    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void readsFrontMatterIntoMetadata() throws IOException {
        MarkdownParser parser = new MarkdownParser();
        Document document = parser.parse(TestUtils.sample("markdown/Basic.md"));

        DocumentMetadata metadata = parser.extractMetadata(document);
        assertEquals("Sample Notes", metadata.title);
        assertEquals("Jane Doe", metadata.author);
        assertEquals("Sample Notes", NodeText.of(document.children.get(0)));
    }

    @Test
    void headingsKeepLevelsAndSourceLines() throws IOException {
        Document document = parser.parse(TestUtils.sample("markdown/Basic.md"));

        List<Heading> headings = NodeCollector.collect(document, Heading.class);
        assertEquals(List.of(1, 2, 2, 2), headings.stream().map(h -> h.level).collect(Collectors.toList()));
        assertEquals(6, headings.get(0).sourceLocation.line);
        assertEquals("markdown", headings.get(0).sourceLocation.format);
    }

    @Test
    void recognisesTaskItems() throws IOException {
        Document document = parser.parse(TestUtils.sample("markdown/Basic.md"));

        ListBlock bullets = NodeCollector.collect(document, ListBlock.class).get(0);
        assertFalse(bullets.ordered);
        assertTrue(bullets.tight);
        assertNull(bullets.items.get(0).taskStatus);
        assertEquals(ListItem.TaskStatus.CHECKED, bullets.items.get(2).taskStatus);
        assertEquals(ListItem.TaskStatus.UNCHECKED, bullets.items.get(3).taskStatus);
        assertEquals("done task", NodeText.of(bullets.items.get(2)));
    }

    @Test
    void orderedListsKeepTheirStart() {
        Document document = parser.parse("3. three\n4. four\n");

        ListBlock list = assertInstanceOf(ListBlock.class, document.children.get(0));
        assertTrue(list.ordered);
        assertEquals(3, list.start);
        assertEquals(2, list.items.size());
    }

    @Test
    void readsTablesWithAlignment() throws IOException {
        Document document = parser.parse(TestUtils.sample("markdown/Basic.md"));

        Table table = NodeCollector.collect(document, Table.class).get(0);
        assertEquals("Name", NodeText.of(table.header.cells.get(0)));
        assertTrue(table.header.header);
        assertEquals(List.of(Alignment.LEFT, Alignment.RIGHT), table.alignments);
        assertEquals(2, table.rows.size());
        assertEquals("10", NodeText.of(table.rows.get(1).cells.get(1)));
    }

    @Test
    void readsInlineMarkup() throws IOException {
        Document document = parser.parse(TestUtils.sample("markdown/Basic.md"));

        Link link = NodeCollector.collect(document, Link.class).get(0);
        assertEquals("https://example.com", link.url);
        assertEquals("Example", link.title);
        assertEquals("old", NodeText.of(NodeCollector.collect(document, Strikethrough.class).get(0)));
        assertTrue(((Paragraph) document.children.get(1)).content.stream().anyMatch(node -> node instanceof LineBreak lb && lb.soft));
    }

    @Test
    void codeBlocksKeepLanguageWithoutTrailingNewline() {
        Document document = parser.parse("~~~~python extra\nprint(1)\n~~~~\n");

        CodeBlock block = assertInstanceOf(CodeBlock.class, document.children.get(0));
        assertEquals("python", block.language);
        assertEquals("print(1)", block.content);
        assertEquals('~', block.fenceChar);
        assertEquals(4, block.fenceLength);
    }

    @Test
    void imagesKeepAltText() {
        Document document = parser.parse("![a *nice* chart](chart.png \"Chart\")\n");

        Image image = NodeCollector.collect(document, Image.class).get(0);
        assertEquals("a nice chart", image.altText);
        assertEquals("chart.png", image.url);
        assertEquals("Chart", image.title);
    }

    @Test
    void stripsByteOrderMark() {
        Document document = parser.parse("\uFEFF# Title\n");

        assertEquals("Title", NodeText.of(assertInstanceOf(Heading.class, document.children.get(0))));
    }

    @Test
    void emptyInputGivesAnEmptyDocument() {
        Document document = parser.parse("");

        assertTrue(document.children.isEmpty());
        assertTrue(document.metadata.isEmpty());
    }
}
