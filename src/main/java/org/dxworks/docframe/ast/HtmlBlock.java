package org.dxworks.docframe.ast;

import java.util.List;

public final class HtmlBlock extends Node {
    public String content;

    public HtmlBlock(String content) {
        this.content = content == null ? "" : content;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "HtmlBlock";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
