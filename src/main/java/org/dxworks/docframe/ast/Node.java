package org.dxworks.docframe.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base of the format-agnostic document tree every parser produces and every renderer consumes.
 * <p>
 * The set of variants is closed. Code that has to handle every variant implements
 * {@link NodeVisitor}, which gains a method whenever a variant is added, so missing cases
 * fail compilation instead of being skipped at runtime.
 * <p>
 * Trees are single-owner: a node is referenced by exactly one parent and never by itself.
 */
public abstract sealed class Node
        permits Document, Heading, Paragraph, CodeBlock, BlockQuote, ListBlock, ListItem,
        Table, TableRow, TableCell, ThematicBreak, HtmlBlock, MathBlock,
        DefinitionList, DefinitionTerm, DefinitionDescription,
        Text, Strong, Emphasis, Code, Link, Image, LineBreak, HtmlInline, MathInline,
        Strikethrough, Underline, Superscript, Subscript {

    public Map<String, Object> metadata = new LinkedHashMap<>();
    public SourceLocation sourceLocation;

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Discriminator used by the interchange format, e.g. {@code Heading}.
     */
    public abstract String nodeType();

    /**
     * Direct children in document order. Read-only view; variants expose their own
     * typed fields for mutation.
     */
    public abstract List<Node> children();

    /**
     * Copies metadata and source location of {@code source} onto this node.
     */
    public <T extends Node> T copyAttributesFrom(Node source) {
        this.metadata = new LinkedHashMap<>(source.metadata);
        this.sourceLocation = source.sourceLocation;
        @SuppressWarnings("unchecked")
        T self = (T) this;
        return self;
    }

    @Override
    public String toString() {
        return nodeType() + children();
    }
}
