package org.dxworks.docframe.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AbstractNodeVisitorTest {

    private static Document sampleDocument() {
        ListBlock list = ListBlock.bullets(
                ListItem.of(Paragraph.of(new Text("one"))),
                ListItem.of(Paragraph.of(new Text("two"), Emphasis.of(new Text("!")))));
        Table table = new Table(TableRow.of("a", "b"), List.of(TableRow.of("1", "2")));
        return Document.of(
                Heading.of(1, "Title"),
                Paragraph.of(new Text("Hello "), Strong.of(new Text("world"))),
                list,
                table);
    }

    @Test
    void walksDepthFirstInPreOrder() {
        List<String> visited = new ArrayList<>();
        new AbstractNodeVisitor() {
            @Override
            public Void visit(Text text) {
                visited.add(text.content);
                return null;
            }
        }.walk(sampleDocument());

        assertEquals(List.of("Title", "Hello ", "world", "one", "two", "!", "a", "b", "1", "2"), visited);
    }

    @Test
    void overriddenVisitCanStopDescending() {
        List<String> visited = new ArrayList<>();
        new AbstractNodeVisitor() {
            @Override
            public Void visit(ListBlock list) {
                return null;
            }

            @Override
            public Void visit(Text text) {
                visited.add(text.content);
                return null;
            }
        }.walk(sampleDocument());

        assertEquals(List.of("Title", "Hello ", "world", "a", "b", "1", "2"), visited);
    }

    @Test
    void nodeTypesListsTheTreeInPreOrder() {
        Document document = Document.of(Heading.of(2, "x"), Paragraph.of(new Text("y")));

        assertEquals(List.of("Document", "Heading", "Text", "Paragraph", "Text"), NodeCollector.nodeTypes(document));
    }

    @Test
    void collectsNodesByType() {
        List<Text> texts = NodeCollector.collect(sampleDocument(), Text.class);

        assertEquals(10, texts.size());
        assertEquals("Title", texts.get(0).content);
    }

    @Test
    void nodeTextJoinsSoftBreaksWithSpaces() {
        Paragraph paragraph = Paragraph.of(new Text("first"), new LineBreak(true), new Text("second"),
                new LineBreak(false), new Code("x = 1"), new Image("a.png", "alt"));

        assertEquals("first second\nx = 1alt", NodeText.of(paragraph));
    }
}
