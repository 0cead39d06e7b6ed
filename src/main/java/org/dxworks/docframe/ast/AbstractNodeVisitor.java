package org.dxworks.docframe.ast;

/**
 * Depth-first, pre-order walk over a tree. Every {@code visit} method descends into the
 * node's children by default; override the ones you care about and call
 * {@link #visitChildren(Node)} (or the super method) to keep descending.
 */
public abstract class AbstractNodeVisitor implements NodeVisitor<Void> {

    /**
     * Visits {@code root} and everything below it.
     */
    public void walk(Node root) {
        root.accept(this);
    }

    protected void visitChildren(Node parent) {
        for (Node child : parent.children()) {
            child.accept(this);
        }
    }

    @Override
    public Void visit(Document document) {
        visitChildren(document);
        return null;
    }

    @Override
    public Void visit(Heading heading) {
        visitChildren(heading);
        return null;
    }

    @Override
    public Void visit(Paragraph paragraph) {
        visitChildren(paragraph);
        return null;
    }

    @Override
    public Void visit(CodeBlock codeBlock) {
        visitChildren(codeBlock);
        return null;
    }

    @Override
    public Void visit(BlockQuote blockQuote) {
        visitChildren(blockQuote);
        return null;
    }

    @Override
    public Void visit(ListBlock list) {
        visitChildren(list);
        return null;
    }

    @Override
    public Void visit(ListItem listItem) {
        visitChildren(listItem);
        return null;
    }

    @Override
    public Void visit(Table table) {
        visitChildren(table);
        return null;
    }

    @Override
    public Void visit(TableRow tableRow) {
        visitChildren(tableRow);
        return null;
    }

    @Override
    public Void visit(TableCell tableCell) {
        visitChildren(tableCell);
        return null;
    }

    @Override
    public Void visit(ThematicBreak thematicBreak) {
        visitChildren(thematicBreak);
        return null;
    }

    @Override
    public Void visit(HtmlBlock htmlBlock) {
        visitChildren(htmlBlock);
        return null;
    }

    @Override
    public Void visit(MathBlock mathBlock) {
        visitChildren(mathBlock);
        return null;
    }

    @Override
    public Void visit(DefinitionList definitionList) {
        visitChildren(definitionList);
        return null;
    }

    @Override
    public Void visit(DefinitionTerm definitionTerm) {
        visitChildren(definitionTerm);
        return null;
    }

    @Override
    public Void visit(DefinitionDescription definitionDescription) {
        visitChildren(definitionDescription);
        return null;
    }

    @Override
    public Void visit(Text text) {
        visitChildren(text);
        return null;
    }

    @Override
    public Void visit(Strong strong) {
        visitChildren(strong);
        return null;
    }

    @Override
    public Void visit(Emphasis emphasis) {
        visitChildren(emphasis);
        return null;
    }

    @Override
    public Void visit(Code code) {
        visitChildren(code);
        return null;
    }

    @Override
    public Void visit(Link link) {
        visitChildren(link);
        return null;
    }

    @Override
    public Void visit(Image image) {
        visitChildren(image);
        return null;
    }

    @Override
    public Void visit(LineBreak lineBreak) {
        visitChildren(lineBreak);
        return null;
    }

    @Override
    public Void visit(HtmlInline htmlInline) {
        visitChildren(htmlInline);
        return null;
    }

    @Override
    public Void visit(MathInline mathInline) {
        visitChildren(mathInline);
        return null;
    }

    @Override
    public Void visit(Strikethrough strikethrough) {
        visitChildren(strikethrough);
        return null;
    }

    @Override
    public Void visit(Underline underline) {
        visitChildren(underline);
        return null;
    }

    @Override
    public Void visit(Superscript superscript) {
        visitChildren(superscript);
        return null;
    }

    @Override
    public Void visit(Subscript subscript) {
        visitChildren(subscript);
        return null;
    }
}
