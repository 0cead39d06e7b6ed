package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table with an optional header row. {@link #alignments} holds one entry per column,
 * null where a column has no explicit alignment.
 */
public final class Table extends Node {
    public TableRow header;
    public List<TableRow> rows = new ArrayList<>();
    public List<Alignment> alignments = new ArrayList<>();
    public String caption;

    public Table(TableRow header, List<TableRow> rows) {
        this.header = header;
        this.rows = new ArrayList<>(rows);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Table";
    }

    @Override
    public List<Node> children() {
        List<Node> all = new ArrayList<>(rows.size() + 1);
        if (header != null) {
            all.add(header);
        }
        all.addAll(rows);
        return Collections.unmodifiableList(all);
    }

    public int columnCount() {
        int count = header != null ? header.cells.size() : 0;
        for (TableRow row : rows) {
            count = Math.max(count, row.cells.size());
        }
        return count;
    }
}
