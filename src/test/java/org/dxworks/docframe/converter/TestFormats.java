package org.dxworks.docframe.converter;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.NodeText;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.Text;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Small formats and archives shared by the converter tests.
 */
public class TestFormats {

    public static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    /** Parses any input into a document holding its UTF-8 text. */
    public static class EchoParser implements DocumentParser {
        @Override
        public Document parse(DocumentInput input) throws IOException {
            return Document.of(Paragraph.of(new Text(input.readString(StandardCharsets.UTF_8))));
        }
    }

    /** Renders the plain text of a document. */
    public static class EchoRenderer extends TextRenderer {
        @Override
        protected String renderText(Document document) {
            return NodeText.of(document);
        }
    }

    public static ConverterMetadata.Builder format(String name) {
        return ConverterMetadata.builder(name).parser(EchoParser::new).renderer(EchoRenderer::new);
    }

    /**
     * Builds a zip whose entries are written in the given order. A {@code mimetype} entry is
     * stored uncompressed, like ODF and EPUB packages do; other entries are deflated.
     */
    public static byte[] zip(String... entryNamesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < entryNamesAndContents.length; i += 2) {
                String name = entryNamesAndContents[i];
                byte[] content = entryNamesAndContents[i + 1].getBytes(StandardCharsets.US_ASCII);
                ZipEntry entry = new ZipEntry(name);
                if ("mimetype".equals(name)) {
                    CRC32 crc = new CRC32();
                    crc.update(content);
                    entry.setMethod(ZipEntry.STORED);
                    entry.setSize(content.length);
                    entry.setCompressedSize(content.length);
                    entry.setCrc(crc.getValue());
                }
                zip.putNextEntry(entry);
                zip.write(content);
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
