package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Heading extends Node {
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;

    public int level;
    public List<Node> content = new ArrayList<>();

    public Heading(int level, List<Node> content) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        this.level = level;
        this.content = new ArrayList<>(content);
    }

    public static Heading of(int level, String text) {
        return new Heading(level, List.of(new Text(text)));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Heading";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
