package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TableRow extends Node {
    public List<TableCell> cells = new ArrayList<>();
    public boolean header;

    public TableRow(List<TableCell> cells) {
        this.cells = new ArrayList<>(cells);
    }

    public static TableRow of(String... texts) {
        List<TableCell> cells = new ArrayList<>();
        for (String text : texts) {
            cells.add(TableCell.of(new Text(text)));
        }
        return new TableRow(cells);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "TableRow";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(cells);
    }
}
