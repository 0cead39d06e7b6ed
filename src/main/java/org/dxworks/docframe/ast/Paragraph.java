package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Paragraph extends Node {
    public List<Node> content = new ArrayList<>();

    public Paragraph(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Paragraph of(Node... content) {
        return new Paragraph(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Paragraph";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
