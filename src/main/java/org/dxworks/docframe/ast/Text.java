package org.dxworks.docframe.ast;

import java.util.List;

public final class Text extends Node {
    public String content;

    public Text(String content) {
        this.content = content == null ? "" : content;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Text";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
