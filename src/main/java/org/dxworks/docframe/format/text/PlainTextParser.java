package org.dxworks.docframe.format.text;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.LineBreak;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.SourceLocation;
import org.dxworks.docframe.ast.Text;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.DocumentParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain text to AST: blank lines separate paragraphs, line breaks inside a paragraph are kept
 * as soft breaks.
 */
public class PlainTextParser implements DocumentParser {

    static final String FORMAT = "plaintext";

    @Override
    public Document parse(DocumentInput input) throws IOException {
        return parse(input.readString(StandardCharsets.UTF_8));
    }

    public Document parse(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }

        List<Node> paragraphs = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        int lineNumber = 0;
        int paragraphStart = 1;
        for (String line : normalized.split("\n", -1)) {
            lineNumber++;
            if (line.isBlank()) {
                addParagraph(paragraphs, lines, paragraphStart);
                lines.clear();
                paragraphStart = lineNumber + 1;
            } else {
                lines.add(line);
            }
        }
        addParagraph(paragraphs, lines, paragraphStart);
        return new Document(paragraphs);
    }

    private static void addParagraph(List<Node> paragraphs, List<String> lines, int startLine) {
        if (lines.isEmpty()) {
            return;
        }
        List<Node> content = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                content.add(new LineBreak(true));
            }
            content.add(new Text(lines.get(i)));
        }
        Paragraph paragraph = new Paragraph(content);
        paragraph.sourceLocation = SourceLocation.atLine(FORMAT, startLine);
        paragraphs.add(paragraph);
    }
}
