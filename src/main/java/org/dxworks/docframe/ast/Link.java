package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Link extends Node {
    public String url;
    public String title;
    public List<Node> content = new ArrayList<>();

    public Link(String url, List<Node> content) {
        this.url = url;
        this.content = new ArrayList<>(content);
    }

    public static Link of(String url, String text) {
        return new Link(url, List.of(new Text(text)));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Link";
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(content);
    }
}
