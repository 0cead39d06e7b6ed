package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Superscript extends Node {
    public List<Node> content = new ArrayList<>();

    public Superscript(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Superscript of(Node... content) {
        return new Superscript(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Superscript";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
