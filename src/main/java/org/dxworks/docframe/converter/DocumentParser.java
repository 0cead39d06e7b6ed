package org.dxworks.docframe.converter;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.DocumentMetadata;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Turns the content of one format into a {@link Document}.
 */
public interface DocumentParser {

    Document parse(DocumentInput input) throws IOException;

    default Document parse(Path path) throws IOException {
        return parse(DocumentInput.of(path));
    }

    default Document parse(byte[] bytes) throws IOException {
        return parse(DocumentInput.of(bytes));
    }

    default Document parse(InputStream stream) throws IOException {
        return parse(DocumentInput.of(stream));
    }

    /**
     * Typed view of the metadata the parser stored on {@code document}.
     */
    default DocumentMetadata extractMetadata(Document document) {
        return DocumentMetadata.fromMap(document.metadata);
    }
}
