package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Underline extends Node {
    public List<Node> content = new ArrayList<>();

    public Underline(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Underline of(Node... content) {
        return new Underline(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Underline";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
