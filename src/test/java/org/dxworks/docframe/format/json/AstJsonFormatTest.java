package org.dxworks.docframe.format.json;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.Text;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.exception.ParsingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstJsonFormatTest {

    @Test
    void renderedJsonParsesBack() throws IOException {
        Document document = Document.of(Heading.of(2, "Title"), Paragraph.of(new Text("body")));
        document.metadata.put("title", "Doc");

        String json = new AstJsonRenderer().renderToString(document);
        Document parsed = new AstJsonParser().parse(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(2, assertInstanceOf(Heading.class, parsed.children.get(0)).level);
        assertEquals("Doc", parsed.metadata.get("title"));
    }

    @Test
    void compactOutputHasNoLineBreaks() {
        Document document = Document.of(Paragraph.of(new Text("body")));

        assertFalse(new AstJsonRenderer(false).renderToString(document).contains("\n"));
        assertTrue(new AstJsonRenderer().renderToString(document).contains("\n"));
    }

    @Test
    void invalidJsonIsAParsingError() {
        DocumentInput input = DocumentInput.of("{\"schema_version\": 1".getBytes(StandardCharsets.UTF_8));

        assertThrows(ParsingException.class, () -> new AstJsonParser().parse(input));
    }
}
