package org.dxworks.docframe.ast;

import java.util.List;

public final class ThematicBreak extends Node {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "ThematicBreak";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
