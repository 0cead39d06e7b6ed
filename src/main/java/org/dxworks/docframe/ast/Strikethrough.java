package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Strikethrough extends Node {
    public List<Node> content = new ArrayList<>();

    public Strikethrough(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static Strikethrough of(Node... content) {
        return new Strikethrough(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Strikethrough";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
