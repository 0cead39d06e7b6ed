package org.dxworks.docframe.ast;

/**
 * Exhaustive dispatch over the node variants. Adding a variant adds a method here,
 * so every implementation has to decide how to handle it.
 *
 * @param <R> result of visiting one node
 */
public interface NodeVisitor<R> {
    R visit(Document document);

    R visit(Heading heading);

    R visit(Paragraph paragraph);

    R visit(CodeBlock codeBlock);

    R visit(BlockQuote blockQuote);

    R visit(ListBlock list);

    R visit(ListItem listItem);

    R visit(Table table);

    R visit(TableRow tableRow);

    R visit(TableCell tableCell);

    R visit(ThematicBreak thematicBreak);

    R visit(HtmlBlock htmlBlock);

    R visit(MathBlock mathBlock);

    R visit(DefinitionList definitionList);

    R visit(DefinitionTerm definitionTerm);

    R visit(DefinitionDescription definitionDescription);

    R visit(Text text);

    R visit(Strong strong);

    R visit(Emphasis emphasis);

    R visit(Code code);

    R visit(Link link);

    R visit(Image image);

    R visit(LineBreak lineBreak);

    R visit(HtmlInline htmlInline);

    R visit(MathInline mathInline);

    R visit(Strikethrough strikethrough);

    R visit(Underline underline);

    R visit(Superscript superscript);

    R visit(Subscript subscript);
}
