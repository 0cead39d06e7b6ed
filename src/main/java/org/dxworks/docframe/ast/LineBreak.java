package org.dxworks.docframe.ast;

import java.util.List;

/** Line break inside inline content; soft breaks are plain newlines in the source. */
public final class LineBreak extends Node {
    public boolean soft;

    public LineBreak(boolean soft) {
        this.soft = soft;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "LineBreak";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
