package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ListItem extends Node {

    public enum TaskStatus {
        CHECKED, UNCHECKED
    }

    public List<Node> children = new ArrayList<>();
    public TaskStatus taskStatus; // null for plain items

    public ListItem(List<Node> children) {
        this.children = new ArrayList<>(children);
    }

    public static ListItem of(Node... children) {
        return new ListItem(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "ListItem";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }
}
