package org.dxworks.docframe.format.json;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.serialization.AstJsonCodec;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.DocumentParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the JSON interchange form written by {@link AstJsonRenderer}.
 */
public class AstJsonParser implements DocumentParser {

    @Override
    public Document parse(DocumentInput input) throws IOException {
        return AstJsonCodec.fromJson(input.readString(StandardCharsets.UTF_8));
    }
}
