package org.dxworks.docframe.ast;

import java.util.List;

public final class Image extends Node {
    public String url;
    public String altText = "";
    public String title;
    public Integer width;
    public Integer height;

    public Image(String url, String altText) {
        this.url = url;
        this.altText = altText == null ? "" : altText;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String nodeType() {
        return "Image";
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
