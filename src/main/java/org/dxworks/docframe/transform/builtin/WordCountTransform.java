package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeCollector;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.ast.Text;

import java.util.stream.Collectors;

/**
 * Stores word and character counts of the document's text nodes in its metadata.
 */
public class WordCountTransform extends NodeTransformer {

    private final String wordField;
    private final String charField;

    public WordCountTransform(String wordField, String charField) {
        this.wordField = wordField;
        this.charField = charField;
    }

    @Override
    public Node visit(Document document) {
        String text = NodeCollector.collect(document, Text.class).stream()
                .map(node -> node.content)
                .collect(Collectors.joining(" "));
        String trimmed = text.strip();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        Document copy = (Document) super.visit(document);
        copy.metadata.put(wordField, words);
        copy.metadata.put(charField, text.length());
        return copy;
    }
}
