package org.dxworks.docframe.ast;

import java.util.List;

public final class CodeBlock extends Node {
    public String content;
    public String language;
    public char fenceChar = '`';
    public int fenceLength = 3;

    public CodeBlock(String content, String language) {
        this.content = content == null ? "" : content;
        this.language = language;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "CodeBlock";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
