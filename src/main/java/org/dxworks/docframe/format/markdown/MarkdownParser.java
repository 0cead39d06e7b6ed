package org.dxworks.docframe.format.markdown;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.docframe.ast.*;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.DocumentParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CommonMark (with GFM tables, strikethrough and YAML front matter) to AST.
 * Front matter becomes document metadata; block nodes carry their source line.
 */
public class MarkdownParser implements DocumentParser {

    static final String FORMAT = "markdown";
    private static final char BOM = '\uFEFF';

    private final Parser parser;

    public MarkdownParser() {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        StrikethroughExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    @Override
    public Document parse(DocumentInput input) throws IOException {
        return parse(input.readString(StandardCharsets.UTF_8));
    }

    public Document parse(String markdown) {
        String source = !markdown.isEmpty() && markdown.charAt(0) == BOM ? markdown.substring(1) : markdown;
        org.commonmark.node.Node root = parser.parse(source);

        List<Node> children = new ArrayList<>();
        root.accept(new AstBuildingVisitor(children));
        Document document = new Document(children);

        YamlFrontMatterVisitor frontMatter = new YamlFrontMatterVisitor();
        root.accept(frontMatter);
        if (!frontMatter.getData().isEmpty()) {
            DocumentMetadata.fromMap(frontMatterToMap(frontMatter.getData())).applyTo(document);
        }
        return document;
    }

    private static Map<String, Object> frontMatterToMap(Map<String, List<String>> data) {
        Map<String, Object> map = new LinkedHashMap<>();
        data.forEach((key, values) -> {
            if (DocumentMetadata.KEYWORDS.equals(key) || values.size() != 1) {
                map.put(key, new ArrayList<>(values));
            } else {
                map.put(key, values.get(0));
            }
        });
        return map;
    }

    private static class AstBuildingVisitor extends AbstractVisitor {
        private final List<List<Node>> containerStack = new ArrayList<>();

        AstBuildingVisitor(List<Node> root) {
            containerStack.add(root);
        }

        @Override
        public void visit(org.commonmark.node.Heading heading) {
            add(located(new Heading(heading.getLevel(), collectChildren(heading)), heading));
        }

        @Override
        public void visit(org.commonmark.node.Paragraph paragraph) {
            add(located(new Paragraph(collectChildren(paragraph)), paragraph));
        }

        @Override
        public void visit(org.commonmark.node.Text text) {
            add(new Text(text.getLiteral()));
        }

        @Override
        public void visit(org.commonmark.node.Emphasis emphasis) {
            add(new Emphasis(collectChildren(emphasis)));
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            add(new Strong(collectChildren(strongEmphasis)));
        }

        @Override
        public void visit(org.commonmark.node.Code code) {
            add(new Code(code.getLiteral()));
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            String info = codeBlock.getInfo() == null ? "" : codeBlock.getInfo().trim();
            String language = info.isEmpty() ? null : info.split("\\s+")[0];
            CodeBlock block = new CodeBlock(stripTrailingNewline(codeBlock.getLiteral()), language);
            block.fenceChar = codeBlock.getFenceChar();
            block.fenceLength = codeBlock.getFenceLength();
            add(located(block, codeBlock));
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            add(located(new CodeBlock(stripTrailingNewline(codeBlock.getLiteral()), null), codeBlock));
        }

        @Override
        public void visit(BulletList bulletList) {
            ListBlock list = new ListBlock(false, listItems(bulletList));
            list.tight = bulletList.isTight();
            add(located(list, bulletList));
        }

        @Override
        public void visit(OrderedList orderedList) {
            ListBlock list = new ListBlock(true, listItems(orderedList));
            list.start = orderedList.getStartNumber();
            list.tight = orderedList.isTight();
            add(located(list, orderedList));
        }

        @Override
        public void visit(org.commonmark.node.ListItem listItem) {
            ListItem item = new ListItem(collectChildren(listItem));
            detectTaskMarker(item);
            add(located(item, listItem));
        }

        @Override
        public void visit(org.commonmark.node.BlockQuote blockQuote) {
            add(located(new BlockQuote(collectChildren(blockQuote)), blockQuote));
        }

        @Override
        public void visit(org.commonmark.node.ThematicBreak thematicBreak) {
            add(located(new ThematicBreak(), thematicBreak));
        }

        @Override
        public void visit(org.commonmark.node.HtmlBlock htmlBlock) {
            add(located(new HtmlBlock(stripTrailingNewline(htmlBlock.getLiteral())), htmlBlock));
        }

        @Override
        public void visit(org.commonmark.node.HtmlInline htmlInline) {
            add(new HtmlInline(htmlInline.getLiteral()));
        }

        @Override
        public void visit(org.commonmark.node.Link link) {
            Link node = new Link(link.getDestination(), collectChildren(link));
            node.title = link.getTitle();
            add(node);
        }

        @Override
        public void visit(org.commonmark.node.Image image) {
            Image node = new Image(image.getDestination(), extractText(image));
            node.title = image.getTitle();
            add(node);
        }

        @Override
        public void visit(SoftLineBreak softLineBreak) {
            add(new LineBreak(true));
        }

        @Override
        public void visit(HardLineBreak hardLineBreak) {
            add(new LineBreak(false));
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof YamlFrontMatterBlock) {
                // read separately into document metadata
                return;
            }
            if (customBlock instanceof TableBlock table) {
                add(located(buildTable(table), table));
                return;
            }
            super.visit(customBlock);
        }

        @Override
        public void visit(CustomNode customNode) {
            if (customNode instanceof org.commonmark.ext.gfm.strikethrough.Strikethrough) {
                add(new Strikethrough(collectChildren(customNode)));
                return;
            }
            super.visit(customNode);
        }

        private Table buildTable(TableBlock tableBlock) {
            TableRow header = null;
            List<TableRow> rows = new ArrayList<>();
            for (org.commonmark.node.Node section = tableBlock.getFirstChild(); section != null; section = section.getNext()) {
                for (org.commonmark.node.Node row = section.getFirstChild(); row != null; row = row.getNext()) {
                    if (section instanceof TableHead && header == null) {
                        header = buildRow(row, true);
                    } else if (section instanceof TableHead || section instanceof TableBody) {
                        rows.add(buildRow(row, false));
                    }
                }
            }
            Table table = new Table(header, rows);
            if (header != null) {
                for (TableCell cell : header.cells) {
                    table.alignments.add(cell.alignment);
                }
            }
            return table;
        }

        private TableRow buildRow(org.commonmark.node.Node row, boolean isHeader) {
            List<TableCell> cells = new ArrayList<>();
            for (org.commonmark.node.Node child = row.getFirstChild(); child != null; child = child.getNext()) {
                org.commonmark.ext.gfm.tables.TableCell source = (org.commonmark.ext.gfm.tables.TableCell) child;
                TableCell cell = new TableCell(collectChildren(source));
                cell.alignment = toAlignment(source.getAlignment());
                cells.add(cell);
            }
            TableRow tableRow = new TableRow(cells);
            tableRow.header = isHeader;
            return tableRow;
        }

        private static Alignment toAlignment(org.commonmark.ext.gfm.tables.TableCell.Alignment alignment) {
            if (alignment == null) {
                return null;
            }
            return Alignment.valueOf(alignment.name());
        }

        private List<ListItem> listItems(org.commonmark.node.ListBlock list) {
            List<ListItem> items = new ArrayList<>();
            for (Node child : collectChildren(list)) {
                items.add((ListItem) child);
            }
            return items;
        }

        private static void detectTaskMarker(ListItem item) {
            if (item.children.isEmpty() || !(item.children.get(0) instanceof Paragraph paragraph)
                    || paragraph.content.isEmpty() || !(paragraph.content.get(0) instanceof Text text)) {
                return;
            }
            String content = text.content;
            if (content.startsWith("[ ] ")) {
                item.taskStatus = ListItem.TaskStatus.UNCHECKED;
            } else if (content.startsWith("[x] ") || content.startsWith("[X] ")) {
                item.taskStatus = ListItem.TaskStatus.CHECKED;
            } else {
                return;
            }
            text.content = content.substring(4);
        }

        private List<Node> collectChildren(org.commonmark.node.Node parent) {
            List<Node> children = new ArrayList<>();
            containerStack.add(children);
            try {
                visitChildren(parent);
            } finally {
                containerStack.remove(containerStack.size() - 1);
            }
            return children;
        }

        private void add(Node node) {
            containerStack.get(containerStack.size() - 1).add(node);
        }

        private static <T extends Node> T located(T node, org.commonmark.node.Node source) {
            List<SourceSpan> spans = source.getSourceSpans();
            if (spans != null && !spans.isEmpty()) {
                SourceLocation location = SourceLocation.atLine(FORMAT, spans.get(0).getLineIndex() + 1);
                location.column = spans.get(0).getColumnIndex() + 1;
                node.sourceLocation = location;
            }
            return node;
        }

        private static String stripTrailingNewline(String literal) {
            if (literal == null) {
                return "";
            }
            return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
        }

        private static String extractText(org.commonmark.node.Node node) {
            StringBuilder text = new StringBuilder();
            for (org.commonmark.node.Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof org.commonmark.node.Text literal) {
                    text.append(literal.getLiteral());
                } else if (child instanceof org.commonmark.node.Code code) {
                    text.append(code.getLiteral());
                } else {
                    text.append(extractText(child));
                }
            }
            return text.toString();
        }
    }
}
