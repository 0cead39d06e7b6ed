package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered or unordered list. Serialized with the discriminator {@code List}.
 */
public final class ListBlock extends Node {
    public boolean ordered;
    public int start = 1;
    public boolean tight = true;
    public List<ListItem> items = new ArrayList<>();

    public ListBlock(boolean ordered, List<ListItem> items) {
        this.ordered = ordered;
        this.items = new ArrayList<>(items);
    }

    public static ListBlock bullets(ListItem... items) {
        return new ListBlock(false, List.of(items));
    }

    public static ListBlock numbered(ListItem... items) {
        return new ListBlock(true, List.of(items));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "List";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(items);
    }
}
