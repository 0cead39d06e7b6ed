package org.dxworks.docframe.converter;

import org.dxworks.docframe.ast.Document;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link Document} in one format.
 */
public interface DocumentRenderer {

    void render(Document document, OutputStream output) throws IOException;

    default void render(Document document, Path path) throws IOException {
        try (OutputStream output = Files.newOutputStream(path)) {
            render(document, output);
        }
    }

    /**
     * Renders into memory. Binary formats decode as ISO-8859-1 so no byte is lost.
     */
    default String renderToString(Document document) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            render(document, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + getClass().getSimpleName(), e);
        }
        return buffer.toString(isText() ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);
    }

    default boolean isText() {
        return false;
    }
}
