package org.dxworks.docframe.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MathBlock extends Node {
    public static final String DEFAULT_NOTATION = "latex";

    public String content;
    public String notation = DEFAULT_NOTATION;
    public Map<String, String> representations = new LinkedHashMap<>(); // notation -> source

    public MathBlock(String content) {
        this.content = content == null ? "" : content;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "MathBlock";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
