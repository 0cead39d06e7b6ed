package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Rewrites a tree into a new tree. The input is never modified: every default {@code visit}
 * method returns a copy of its node built from the transformed children.
 * <p>
 * Overrides return a replacement node, the node itself, or {@code null} to remove it from
 * its parent. Removing or replacing the root {@link Document} is not allowed;
 * {@link #transformDocument(Document)} rejects it.
 */
public abstract class NodeTransformer implements NodeVisitor<Node> {

    public Node transform(Node node) {
        return node.accept(this);
    }

    /**
     * Transforms a whole document and checks that the result is still a document.
     */
    public Document transformDocument(Document document) {
        Node result = transform(document);
        if (!(result instanceof Document transformed)) {
            throw new IllegalStateException(getClass().getSimpleName() + " must return a Document, got "
                    + (result == null ? "null" : result.nodeType()));
        }
        return transformed;
    }

    protected List<Node> transformChildren(List<? extends Node> children) {
        List<Node> result = new ArrayList<>(children.size());
        for (Node child : children) {
            Node transformed = transform(child);
            if (transformed != null) {
                result.add(transformed);
            }
        }
        return result;
    }

    /**
     * Transforms children whose parent only accepts one variant, e.g. list items.
     */
    protected <T extends Node> List<T> transformChildren(List<T> children, Class<T> type) {
        List<T> result = new ArrayList<>(children.size());
        for (T child : children) {
            T transformed = transformAs(child, type);
            if (transformed != null) {
                result.add(transformed);
            }
        }
        return result;
    }

    protected <T extends Node> T transformAs(T node, Class<T> type) {
        if (node == null) {
            return null;
        }
        Node transformed = transform(node);
        if (transformed == null) {
            return null;
        }
        if (!type.isInstance(transformed)) {
            throw new IllegalStateException(getClass().getSimpleName() + " replaced a " + node.nodeType()
                    + " with a " + transformed.nodeType() + " where only " + type.getSimpleName() + " is allowed");
        }
        return type.cast(transformed);
    }

    @Override
    public Node visit(Document document) {
        Document copy = new Document(transformChildren(document.children));
        return copy.copyAttributesFrom(document);
    }

    @Override
    public Node visit(Heading heading) {
        return new Heading(heading.level, transformChildren(heading.content)).copyAttributesFrom(heading);
    }

    @Override
    public Node visit(Paragraph paragraph) {
        return new Paragraph(transformChildren(paragraph.content)).copyAttributesFrom(paragraph);
    }

    @Override
    public Node visit(CodeBlock codeBlock) {
        CodeBlock copy = new CodeBlock(codeBlock.content, codeBlock.language);
        copy.fenceChar = codeBlock.fenceChar;
        copy.fenceLength = codeBlock.fenceLength;
        return copy.copyAttributesFrom(codeBlock);
    }

    @Override
    public Node visit(BlockQuote blockQuote) {
        return new BlockQuote(transformChildren(blockQuote.children)).copyAttributesFrom(blockQuote);
    }

    @Override
    public Node visit(ListBlock list) {
        ListBlock copy = new ListBlock(list.ordered, transformChildren(list.items, ListItem.class));
        copy.start = list.start;
        copy.tight = list.tight;
        return copy.copyAttributesFrom(list);
    }

    @Override
    public Node visit(ListItem listItem) {
        ListItem copy = new ListItem(transformChildren(listItem.children));
        copy.taskStatus = listItem.taskStatus;
        return copy.copyAttributesFrom(listItem);
    }

    @Override
    public Node visit(Table table) {
        Table copy = new Table(transformAs(table.header, TableRow.class), transformChildren(table.rows, TableRow.class));
        copy.alignments = new ArrayList<>(table.alignments);
        copy.caption = table.caption;
        return copy.copyAttributesFrom(table);
    }

    @Override
    public Node visit(TableRow tableRow) {
        TableRow copy = new TableRow(transformChildren(tableRow.cells, TableCell.class));
        copy.header = tableRow.header;
        return copy.copyAttributesFrom(tableRow);
    }

    @Override
    public Node visit(TableCell tableCell) {
        TableCell copy = new TableCell(transformChildren(tableCell.content));
        copy.colspan = tableCell.colspan;
        copy.rowspan = tableCell.rowspan;
        copy.alignment = tableCell.alignment;
        return copy.copyAttributesFrom(tableCell);
    }

    @Override
    public Node visit(ThematicBreak thematicBreak) {
        return new ThematicBreak().copyAttributesFrom(thematicBreak);
    }

    @Override
    public Node visit(HtmlBlock htmlBlock) {
        return new HtmlBlock(htmlBlock.content).copyAttributesFrom(htmlBlock);
    }

    @Override
    public Node visit(MathBlock mathBlock) {
        MathBlock copy = new MathBlock(mathBlock.content);
        copy.notation = mathBlock.notation;
        copy.representations = new LinkedHashMap<>(mathBlock.representations);
        return copy.copyAttributesFrom(mathBlock);
    }

    @Override
    public Node visit(DefinitionList definitionList) {
        List<DefinitionList.Item> items = new ArrayList<>();
        for (DefinitionList.Item item : definitionList.items) {
            DefinitionTerm term = transformAs(item.term, DefinitionTerm.class);
            if (term == null) {
                continue; // descriptions without their term are dropped with it
            }
            items.add(new DefinitionList.Item(term, transformChildren(item.descriptions, DefinitionDescription.class)));
        }
        return new DefinitionList(items).copyAttributesFrom(definitionList);
    }

    @Override
    public Node visit(DefinitionTerm definitionTerm) {
        return new DefinitionTerm(transformChildren(definitionTerm.content)).copyAttributesFrom(definitionTerm);
    }

    @Override
    public Node visit(DefinitionDescription definitionDescription) {
        return new DefinitionDescription(transformChildren(definitionDescription.content))
                .copyAttributesFrom(definitionDescription);
    }

    @Override
    public Node visit(Text text) {
        return new Text(text.content).copyAttributesFrom(text);
    }

    @Override
    public Node visit(Strong strong) {
        return new Strong(transformChildren(strong.content)).copyAttributesFrom(strong);
    }

    @Override
    public Node visit(Emphasis emphasis) {
        return new Emphasis(transformChildren(emphasis.content)).copyAttributesFrom(emphasis);
    }

    @Override
    public Node visit(Code code) {
        return new Code(code.content).copyAttributesFrom(code);
    }

    @Override
    public Node visit(Link link) {
        Link copy = new Link(link.url, transformChildren(link.content));
        copy.title = link.title;
        return copy.copyAttributesFrom(link);
    }

    @Override
    public Node visit(Image image) {
        Image copy = new Image(image.url, image.altText);
        copy.title = image.title;
        copy.width = image.width;
        copy.height = image.height;
        return copy.copyAttributesFrom(image);
    }

    @Override
    public Node visit(LineBreak lineBreak) {
        return new LineBreak(lineBreak.soft).copyAttributesFrom(lineBreak);
    }

    @Override
    public Node visit(HtmlInline htmlInline) {
        return new HtmlInline(htmlInline.content).copyAttributesFrom(htmlInline);
    }

    @Override
    public Node visit(MathInline mathInline) {
        MathInline copy = new MathInline(mathInline.content);
        copy.notation = mathInline.notation;
        copy.representations = new LinkedHashMap<>(mathInline.representations);
        return copy.copyAttributesFrom(mathInline);
    }

    @Override
    public Node visit(Strikethrough strikethrough) {
        return new Strikethrough(transformChildren(strikethrough.content)).copyAttributesFrom(strikethrough);
    }

    @Override
    public Node visit(Underline underline) {
        return new Underline(transformChildren(underline.content)).copyAttributesFrom(underline);
    }

    @Override
    public Node visit(Superscript superscript) {
        return new Superscript(transformChildren(superscript.content)).copyAttributesFrom(superscript);
    }

    @Override
    public Node visit(Subscript subscript) {
        return new Subscript(transformChildren(subscript.content)).copyAttributesFrom(subscript);
    }
}
