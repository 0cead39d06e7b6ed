package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Emphasis extends Node {
    public List<Node> content = new ArrayList<>();

    public Emphasis(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Emphasis of(Node... content) {
        return new Emphasis(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Emphasis";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
