package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class BlockQuote extends Node {
    public List<Node> children = new ArrayList<>();

    public BlockQuote(List<Node> children) {
        this.children = new ArrayList<>(children);
    }

    public static BlockQuote of(Node... children) {
        return new BlockQuote(List.of(children));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "BlockQuote";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }
}
