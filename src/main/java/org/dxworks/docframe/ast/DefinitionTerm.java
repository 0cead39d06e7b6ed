package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DefinitionTerm extends Node {
    public List<Node> content = new ArrayList<>();

    public DefinitionTerm(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static DefinitionTerm of(Node... content) {
        return new DefinitionTerm(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "DefinitionTerm";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
