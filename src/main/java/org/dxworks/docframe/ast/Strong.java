package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Strong extends Node {
    public List<Node> content = new ArrayList<>();

    public Strong(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Strong of(Node... content) {
        return new Strong(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Strong";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
