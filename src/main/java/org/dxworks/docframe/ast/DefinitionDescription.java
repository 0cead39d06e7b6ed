package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DefinitionDescription extends Node {
    public List<Node> content = new ArrayList<>();

    public DefinitionDescription(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static DefinitionDescription of(Node... content) {
        return new DefinitionDescription(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "DefinitionDescription";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
