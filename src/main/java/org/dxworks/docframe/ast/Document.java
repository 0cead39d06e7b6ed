package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of every tree. Owns the top-level blocks and the document-level metadata
 * (see {@link DocumentMetadata} for the typed view of the well-known keys).
 */
public final class Document extends Node {
    public List<Node> children = new ArrayList<>();

    public Document() {
    }

    public Document(List<Node> children) {
        this.children = new ArrayList<>(children);
    }

    public static Document of(Node... children) {
        return new Document(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Document";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }
}
