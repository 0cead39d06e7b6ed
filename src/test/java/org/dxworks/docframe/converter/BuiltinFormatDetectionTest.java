package org.dxworks.docframe.converter;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.serialization.AstJsonCodec;
import org.dxworks.docframe.exception.DependencyException;
import org.dxworks.docframe.exception.FormatDetectionException;
import org.dxworks.docframe.format.BuiltinConverters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.dxworks.docframe.converter.TestFormats.zip;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltinFormatDetectionTest {

    @TempDir
    Path tempDir;

    private ConverterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConverterRegistry();
        new BuiltinConverters().converters().forEach(registry::register);
    }

    private String detect(DocumentInput input) {
        return registry.detectFormat(input).getFormatName();
    }

    private static DocumentInput bytes(String text) {
        return DocumentInput.of(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void textFormatsByExtension() {
        assertEquals("markdown", detect(bytes("# Title").withFilename("README.md")));
        assertEquals("plaintext", detect(bytes("hello").withFilename("notes.txt")));
        assertEquals("ast-json", detect(bytes("{}").withFilename("doc.ast.json")));
    }

    @Test
    void textFormatsByMimeType() {
        assertEquals("markdown", detect(bytes("# Title").withMimeType("text/markdown")));
        assertEquals("plaintext", detect(bytes("hello").withMimeType("text/plain; charset=UTF-8")));
    }

    @Test
    void officeDocumentsByTheirParts() throws IOException {
        assertEquals("docx", detect(DocumentInput.of(zip("word/document.xml", "<w/>"))));
        assertEquals("xlsx", detect(DocumentInput.of(zip("xl/workbook.xml", "<x/>"))));
        assertEquals("pptx", detect(DocumentInput.of(zip("ppt/presentation.xml", "<p/>"))));
    }

    @Test
    void openDocumentAndEpubByTheirMimetypeEntry() throws IOException {
        assertEquals("odt", detect(DocumentInput.of(zip("mimetype", "application/vnd.oasis.opendocument.text",
                "content.xml", "<c/>"))));
        assertEquals("ods", detect(DocumentInput.of(zip("mimetype", "application/vnd.oasis.opendocument.spreadsheet"))));
        assertEquals("epub", detect(DocumentInput.of(zip("mimetype", "application/epub+zip",
                "META-INF/container.xml", "<c/>"))));
    }

    @Test
    void plainArchiveFallsBackToZip() throws IOException {
        assertEquals("zip", detect(DocumentInput.of(zip("readme.txt", "hi"))));
    }

    @Test
    void extensionNarrowsSharedMagicBytes() throws IOException {
        byte[] docx = zip("[Content_Types].xml", "<Types/>", "word/document.xml", "<w/>");

        assertEquals("docx", detect(DocumentInput.of(docx).withFilename("report.docx")));
    }

    @Test
    void inMemoryOfficeDocumentsAreInspectedThroughTheCentralDirectory() throws IOException {
        byte[] docx = zip("[Content_Types].xml", "<Types/>", "_rels/.rels", "<r/>", "word/document.xml", "<w/>");
        byte[] pptx = zip("[Content_Types].xml", "<Types/>", "docProps/app.xml", "<a/>", "ppt/presentation.xml", "<p/>");

        assertEquals("docx", detect(DocumentInput.of(docx)));
        assertEquals("pptx", detect(DocumentInput.of(pptx)));
    }

    @Test
    void filesAreInspectedThroughTheCentralDirectory() throws IOException {
        Path file = tempDir.resolve("upload.bin");
        Files.write(file, zip("[Content_Types].xml", "<Types/>", "_rels/.rels", "<r/>", "xl/workbook.xml", "<x/>"));

        assertEquals("xlsx", detect(DocumentInput.of(file)));
    }

    @Test
    void pdfAndRtfByMagicBytes() {
        assertEquals("pdf", detect(bytes("%PDF-1.7\n%binary")));
        assertEquals("rtf", detect(bytes("{\\rtf1\\ansi hello}")));
    }

    @Test
    void astJsonAndHtmlByContent() {
        String json = AstJsonCodec.toJson(Document.of(Heading.of(1, "x")));

        assertEquals("ast-json", detect(bytes(json)));
        assertEquals("html", detect(bytes("  <!DOCTYPE html>\n<html><body></body></html>")));
    }

    @Test
    void unrecognisedTextWithoutHintsFails() {
        assertThrows(FormatDetectionException.class, () -> detect(bytes("just some words")));
    }

    @Test
    void externalFormatsNeedTheirLibraries() {
        DependencyException e = assertThrows(DependencyException.class, () -> registry.getParser("docx"));

        assertTrue(e.getRemediationHint().contains("org.apache.poi:poi-ooxml>=5.0"));
    }
}
