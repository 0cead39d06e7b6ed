package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TableCell extends Node {
    public List<Node> content = new ArrayList<>();
    public int colspan = 1;
    public int rowspan = 1;
    public Alignment alignment;

    public TableCell(List<Node> content) {
        this.content = new ArrayList<>(content);
    }

    public static TableCell of(Node... content) {
        return new TableCell(List.of(content));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "TableCell";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
