package org.dxworks.docframe.format.text;

import org.dxworks.docframe.TestUtils;
import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.LineBreak;
import org.dxworks.docframe.ast.NodeText;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.Text;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlainTextParserTest {

    private final PlainTextParser parser = new PlainTextParser();

    @Test
    void blankLinesSeparateParagraphs() throws IOException {
        Document document = parser.parse(TestUtils.sample("text/Plain.txt"));

        assertEquals(2, document.children.size());
        Paragraph first = assertInstanceOf(Paragraph.class, document.children.get(0));
        assertEquals(3, first.content.size());
        assertTrue(assertInstanceOf(LineBreak.class, first.content.get(1)).soft);
        assertEquals("Second paragraph.", NodeText.of(document.children.get(1)));
    }

    @Test
    void paragraphsRememberTheirStartLine() throws IOException {
        Document document = parser.parse(TestUtils.sample("text/Plain.txt"));

        assertEquals(1, document.children.get(0).sourceLocation.line);
        assertEquals(4, document.children.get(1).sourceLocation.line);
        assertEquals("plaintext", document.children.get(1).sourceLocation.format);
    }

    @Test
    void normalizesLineEndingsAndByteOrderMark() {
        Document document = parser.parse("\uFEFFone\r\ntwo\r\n\r\n\r\nthree\rfour");

        assertEquals(2, document.children.size());
        Paragraph first = (Paragraph) document.children.get(0);
        assertEquals("one", ((Text) first.content.get(0)).content);
        assertEquals("three four", NodeText.of(document.children.get(1)));
    }

    @Test
    void whitespaceOnlyInputIsEmpty() {
        assertTrue(parser.parse("  \n\t\n").children.isEmpty());
    }
}
