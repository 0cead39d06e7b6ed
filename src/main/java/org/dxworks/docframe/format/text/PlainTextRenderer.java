package org.dxworks.docframe.format.text;

import org.dxworks.docframe.ast.*;
import org.dxworks.docframe.converter.TextRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the text of a document without markup. Lists keep their markers and table cells are
 * separated by {@code " | "} so structure stays readable.
 */
public class PlainTextRenderer extends TextRenderer {

    @Override
    protected String renderText(Document document) {
        String body = blocks(document.children);
        return body.isEmpty() ? "" : body + "\n";
    }

    private String blocks(List<? extends Node> nodes) {
        List<String> parts = new ArrayList<>();
        for (Node node : nodes) {
            String rendered = block(node);
            if (!rendered.isBlank()) {
                parts.add(rendered);
            }
        }
        return String.join("\n\n", parts);
    }

    private String block(Node node) {
        if (node instanceof ListBlock list) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < list.items.size(); i++) {
                String marker = list.ordered ? (list.start + i) + ". " : "- ";
                String item = blocks(list.items.get(i).children).replace("\n\n", "\n");
                items.add(marker + item.replace("\n", "\n" + " ".repeat(marker.length())));
            }
            return String.join("\n", items);
        }
        if (node instanceof Table table) {
            List<String> rows = new ArrayList<>();
            if (table.header != null) {
                rows.add(row(table.header));
            }
            for (TableRow row : table.rows) {
                rows.add(row(row));
            }
            return String.join("\n", rows);
        }
        if (node instanceof DefinitionList definitions) {
            List<String> items = new ArrayList<>();
            for (DefinitionList.Item item : definitions.items) {
                StringBuilder text = new StringBuilder(NodeText.of(item.term));
                for (DefinitionDescription description : item.descriptions) {
                    text.append("\n  ").append(NodeText.of(description));
                }
                items.add(text.toString());
            }
            return String.join("\n", items);
        }
        if (node instanceof BlockQuote quote) {
            return blocks(quote.children);
        }
        if (node instanceof ThematicBreak) {
            return "----";
        }
        if (node instanceof HtmlBlock) {
            return "";
        }
        return NodeText.of(node);
    }

    private static String row(TableRow row) {
        List<String> cells = new ArrayList<>();
        for (TableCell cell : row.cells) {
            cells.add(NodeText.of(cell));
        }
        return String.join(" | ", cells);
    }
}
