package org.dxworks.docframe.format.json;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.serialization.AstJsonCodec;
import org.dxworks.docframe.converter.TextRenderer;

public class AstJsonRenderer extends TextRenderer {

    private final boolean pretty;

    public AstJsonRenderer() {
        this(true);
    }

    public AstJsonRenderer(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    protected String renderText(Document document) {
        return pretty ? AstJsonCodec.toPrettyJson(document) : AstJsonCodec.toJson(document);
    }
}
