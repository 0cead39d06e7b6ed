package org.dxworks.docframe.converter;

import org.dxworks.docframe.ast.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Base for renderers producing UTF-8 text.
 */
public abstract class TextRenderer implements DocumentRenderer {

    /**
     * Renders the document as a string; the only method subclasses implement.
     */
    protected abstract String renderText(Document document);

    @Override
    public void render(Document document, OutputStream output) throws IOException {
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        writer.write(renderText(document));
        writer.flush();
    }

    public void render(Document document, Writer writer) throws IOException {
        writer.write(renderText(document));
        writer.flush();
    }

    @Override
    public String renderToString(Document document) {
        return renderText(document);
    }

    @Override
    public boolean isText() {
        return true;
    }
}
