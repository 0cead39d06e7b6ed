package org.dxworks.docframe.format.markdown;

import org.dxworks.docframe.ast.*;
import org.dxworks.docframe.converter.TextRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders GitHub-flavoured Markdown. Blocks are separated by a blank line and the output ends
 * with a single newline. Underline, superscript and subscript have no Markdown syntax and are
 * written as inline HTML.
 */
public class MarkdownRenderer extends TextRenderer {

    private static final Pattern LONGEST_FENCE = Pattern.compile("^(`{3,}|~{3,})", Pattern.MULTILINE);

    @Override
    protected String renderText(Document document) {
        String body = document.accept(new Writer());
        return body.isEmpty() ? "" : body + "\n";
    }

    private static class Writer implements NodeVisitor<String> {

        private String blocks(List<? extends Node> nodes, String separator) {
            List<String> parts = new ArrayList<>();
            for (Node node : nodes) {
                String rendered = node.accept(this);
                if (!rendered.isEmpty()) {
                    parts.add(rendered);
                }
            }
            return String.join(separator, parts);
        }

        private String inlines(List<? extends Node> nodes) {
            StringBuilder text = new StringBuilder();
            for (Node node : nodes) {
                text.append(node.accept(this));
            }
            return text.toString();
        }

        @Override
        public String visit(Document document) {
            return blocks(document.children, "\n\n");
        }

        @Override
        public String visit(Heading heading) {
            return "#".repeat(heading.level) + " " + inlines(heading.content);
        }

        @Override
        public String visit(Paragraph paragraph) {
            return inlines(paragraph.content);
        }

        @Override
        public String visit(CodeBlock codeBlock) {
            int length = Math.max(3, codeBlock.fenceLength);
            Matcher fences = LONGEST_FENCE.matcher(codeBlock.content);
            while (fences.find()) {
                if (fences.group(1).charAt(0) == codeBlock.fenceChar) {
                    length = Math.max(length, fences.group(1).length() + 1);
                }
            }
            String fence = String.valueOf(codeBlock.fenceChar).repeat(length);
            String info = codeBlock.language == null ? "" : codeBlock.language;
            if (codeBlock.content.isEmpty()) {
                return fence + info + "\n" + fence;
            }
            return fence + info + "\n" + codeBlock.content + "\n" + fence;
        }

        @Override
        public String visit(BlockQuote blockQuote) {
            String inner = blocks(blockQuote.children, "\n\n");
            StringBuilder quoted = new StringBuilder();
            for (String line : inner.split("\n", -1)) {
                if (quoted.length() > 0) {
                    quoted.append('\n');
                }
                quoted.append(line.isEmpty() ? ">" : "> " + line);
            }
            return quoted.toString();
        }

        @Override
        public String visit(ListBlock list) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < list.items.size(); i++) {
                String marker = list.ordered ? (list.start + i) + "." : "-";
                items.add(renderItem(list.items.get(i), marker, list.tight));
            }
            return String.join(list.tight ? "\n" : "\n\n", items);
        }

        private String renderItem(ListItem item, String marker, boolean tight) {
            String body = blocks(item.children, tight ? "\n" : "\n\n");
            if (item.taskStatus != null) {
                body = (item.taskStatus == ListItem.TaskStatus.CHECKED ? "[x] " : "[ ] ") + body;
            }
            String indent = " ".repeat(marker.length() + 1);
            StringBuilder text = new StringBuilder(marker);
            String[] lines = body.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i == 0) {
                    text.append(lines[i].isEmpty() ? "" : " " + lines[i]);
                } else {
                    text.append('\n').append(lines[i].isEmpty() ? "" : indent + lines[i]);
                }
            }
            return text.toString();
        }

        @Override
        public String visit(ListItem listItem) {
            return blocks(listItem.children, "\n\n");
        }

        @Override
        public String visit(Table table) {
            int columns = table.columnCount();
            if (columns == 0) {
                return "";
            }
            List<String> lines = new ArrayList<>();
            lines.add(row(table.header, columns));
            List<String> separators = new ArrayList<>();
            for (int i = 0; i < columns; i++) {
                Alignment alignment = i < table.alignments.size() ? table.alignments.get(i) : null;
                separators.add(separator(alignment));
            }
            lines.add("| " + String.join(" | ", separators) + " |");
            for (TableRow row : table.rows) {
                lines.add(row(row, columns));
            }
            String rendered = String.join("\n", lines);
            if (table.caption != null && !table.caption.isBlank()) {
                rendered += "\n\n*" + escape(table.caption) + "*";
            }
            return rendered;
        }

        private String row(TableRow row, int columns) {
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < columns; i++) {
                cells.add(row != null && i < row.cells.size() ? row.cells.get(i).accept(this) : "");
            }
            return "| " + String.join(" | ", cells) + " |";
        }

        private static String separator(Alignment alignment) {
            if (alignment == null) {
                return "---";
            }
            return switch (alignment) {
                case LEFT -> ":---";
                case CENTER -> ":---:";
                case RIGHT -> "---:";
            };
        }

        @Override
        public String visit(TableRow tableRow) {
            return row(tableRow, tableRow.cells.size());
        }

        @Override
        public String visit(TableCell tableCell) {
            return inlines(tableCell.content).replace("\n", " ").replace("|", "\\|");
        }

        @Override
        public String visit(ThematicBreak thematicBreak) {
            return "---";
        }

        @Override
        public String visit(HtmlBlock htmlBlock) {
            return htmlBlock.content;
        }

        @Override
        public String visit(MathBlock mathBlock) {
            return "$$\n" + mathBlock.content + "\n$$";
        }

        @Override
        public String visit(DefinitionList definitionList) {
            List<String> items = new ArrayList<>();
            for (DefinitionList.Item item : definitionList.items) {
                StringBuilder text = new StringBuilder(item.term.accept(this));
                for (DefinitionDescription description : item.descriptions) {
                    text.append("\n: ").append(description.accept(this));
                }
                items.add(text.toString());
            }
            return String.join("\n\n", items);
        }

        @Override
        public String visit(DefinitionTerm definitionTerm) {
            return inlines(definitionTerm.content);
        }

        @Override
        public String visit(DefinitionDescription definitionDescription) {
            return inlines(definitionDescription.content);
        }

        @Override
        public String visit(Text text) {
            return escape(text.content);
        }

        @Override
        public String visit(Strong strong) {
            return "**" + inlines(strong.content) + "**";
        }

        @Override
        public String visit(Emphasis emphasis) {
            return "*" + inlines(emphasis.content) + "*";
        }

        @Override
        public String visit(Code code) {
            String content = code.content;
            int longestRun = 0;
            int run = 0;
            for (char c : content.toCharArray()) {
                run = c == '`' ? run + 1 : 0;
                longestRun = Math.max(longestRun, run);
            }
            String ticks = "`".repeat(longestRun + 1);
            String padding = longestRun > 0 ? " " : "";
            return ticks + padding + content + padding + ticks;
        }

        @Override
        public String visit(Link link) {
            return "[" + inlines(link.content) + "](" + link.url + title(link.title) + ")";
        }

        @Override
        public String visit(Image image) {
            return "![" + escape(image.altText) + "](" + image.url + title(image.title) + ")";
        }

        private static String title(String title) {
            return title == null ? "" : " \"" + title.replace("\"", "\\\"") + "\"";
        }

        @Override
        public String visit(LineBreak lineBreak) {
            return lineBreak.soft ? "\n" : "\\\n";
        }

        @Override
        public String visit(HtmlInline htmlInline) {
            return htmlInline.content;
        }

        @Override
        public String visit(MathInline mathInline) {
            return "$" + mathInline.content + "$";
        }

        @Override
        public String visit(Strikethrough strikethrough) {
            return "~~" + inlines(strikethrough.content) + "~~";
        }

        @Override
        public String visit(Underline underline) {
            return "<u>" + inlines(underline.content) + "</u>";
        }

        @Override
        public String visit(Superscript superscript) {
            return "<sup>" + inlines(superscript.content) + "</sup>";
        }

        @Override
        public String visit(Subscript subscript) {
            return "<sub>" + inlines(subscript.content) + "</sub>";
        }

        private static String escape(String text) {
            StringBuilder escaped = new StringBuilder(text.length());
            for (char c : text.toCharArray()) {
                if (c == '\\' || c == '*' || c == '_' || c == '`') {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
            return escaped.toString();
        }
    }
}
