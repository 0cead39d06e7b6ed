package org.dxworks.docframe.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeTransformerTest {

    @Test
    void identityTransformCopiesTheTree() {
        Heading heading = Heading.of(1, "Title");
        heading.metadata.put("id", "title");
        heading.sourceLocation = SourceLocation.atLine("markdown", 3);
        Document document = Document.of(heading, Paragraph.of(new Text("body")));
        document.metadata.put(DocumentMetadata.TITLE, "Doc");

        Document copy = new NodeTransformer() {
        }.transformDocument(document);

        assertNotSame(document, copy);
        assertNotSame(heading, copy.children.get(0));
        assertEquals(NodeCollector.nodeTypes(document), NodeCollector.nodeTypes(copy));
        assertEquals("Doc", copy.metadata.get(DocumentMetadata.TITLE));
        Heading copiedHeading = (Heading) copy.children.get(0);
        assertEquals("title", copiedHeading.metadata.get("id"));
        assertEquals(SourceLocation.atLine("markdown", 3), copiedHeading.sourceLocation);
    }

    @Test
    void returningNullRemovesTheNode() {
        Document document = Document.of(
                Paragraph.of(new Text("keep"), new Image("x.png", "x")),
                ListBlock.bullets(ListItem.of(Paragraph.of(new Image("y.png", "y")))));

        Document result = new NodeTransformer() {
            @Override
            public Node visit(Image image) {
                return null;
            }
        }.transformDocument(document);

        assertTrue(NodeCollector.collect(result, Image.class).isEmpty());
        assertEquals(2, NodeCollector.collect(document, Image.class).size());
    }

    @Test
    void removingTheDocumentIsRejected() {
        NodeTransformer dropAll = new NodeTransformer() {
            @Override
            public Node visit(Document document) {
                return null;
            }
        };

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> dropAll.transformDocument(new Document()));
        assertTrue(e.getMessage().contains("must return a Document"));
    }

    @Test
    void replacingAListItemWithAnotherVariantIsRejected() {
        NodeTransformer broken = new NodeTransformer() {
            @Override
            public Node visit(ListItem listItem) {
                return new Text("not an item");
            }
        };
        Document document = Document.of(ListBlock.bullets(ListItem.of(Paragraph.of(new Text("a")))));

        assertThrows(IllegalStateException.class, () -> broken.transformDocument(document));
    }

    @Test
    void droppingATermDropsItsDescriptions() {
        DefinitionList definitions = new DefinitionList(List.of(
                new DefinitionList.Item(DefinitionTerm.of(new Text("drop")),
                        List.of(DefinitionDescription.of(new Text("gone")))),
                new DefinitionList.Item(DefinitionTerm.of(new Text("keep")),
                        List.of(DefinitionDescription.of(new Text("stays"))))));

        Document result = new NodeTransformer() {
            @Override
            public Node visit(DefinitionTerm term) {
                return NodeText.of(term).equals("drop") ? null : super.visit(term);
            }
        }.transformDocument(Document.of(definitions));

        DefinitionList transformed = (DefinitionList) result.children.get(0);
        assertEquals(1, transformed.items.size());
        assertEquals("stays", NodeText.of(transformed.items.get(0).descriptions.get(0)));
    }
}
