package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Subscript extends Node {
    public List<Node> content = new ArrayList<>();

    public Subscript(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Subscript of(Node... content) {
        return new Subscript(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Subscript";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
