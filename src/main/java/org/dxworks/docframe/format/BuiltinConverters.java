package org.dxworks.docframe.format;

import org.dxworks.docframe.converter.ConverterMetadata;
import org.dxworks.docframe.converter.ConverterProvider;
import org.dxworks.docframe.converter.DetectionContext;
import org.dxworks.docframe.converter.MagicBytes;
import org.dxworks.docframe.converter.detect.ZipEntryDetector;
import org.dxworks.docframe.format.json.AstJsonParser;
import org.dxworks.docframe.format.json.AstJsonRenderer;
import org.dxworks.docframe.format.markdown.MarkdownParser;
import org.dxworks.docframe.format.markdown.MarkdownRenderer;
import org.dxworks.docframe.format.text.PlainTextParser;
import org.dxworks.docframe.format.text.PlainTextRenderer;

import java.util.List;
import java.util.Locale;

/**
 * Formats known out of the box. Markdown, plain text and the AST JSON form convert in-process;
 * the other entries only carry detection signals and name the optional library whose plugin
 * supplies their parser.
 */
public class BuiltinConverters implements ConverterProvider {

    public static final String MARKDOWN = "markdown";
    public static final String PLAINTEXT = "plaintext";
    public static final String AST_JSON = "ast-json";

    private static final MagicBytes ZIP = MagicBytes.of(new byte[]{'P', 'K', 3, 4});
    private static final MagicBytes EMPTY_ZIP = MagicBytes.of(new byte[]{'P', 'K', 5, 6});
    private static final String PLUGIN_PARSER = "parser";

    @Override
    public List<ConverterMetadata> converters() {
        return List.of(
                markdown(),
                plainText(),
                astJson(),
                office("docx", "Word document (Office Open XML)", "word/",
                        "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                        "org.apache.poi.xwpf.usermodel.XWPFDocument"),
                office("xlsx", "Excel workbook (Office Open XML)", "xl/",
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                        "org.apache.poi.xssf.usermodel.XSSFWorkbook"),
                office("pptx", "PowerPoint presentation (Office Open XML)", "ppt/",
                        "application/vnd.openxmlformats-officedocument.presentationml.presentation",
                        "org.apache.poi.xslf.usermodel.XMLSlideShow"),
                openDocument("odt", "OpenDocument text", "application/vnd.oasis.opendocument.text"),
                openDocument("ods", "OpenDocument spreadsheet", "application/vnd.oasis.opendocument.spreadsheet"),
                openDocument("odp", "OpenDocument presentation", "application/vnd.oasis.opendocument.presentation"),
                ConverterMetadata.builder("epub")
                        .description("EPUB e-book")
                        .extensions(".epub")
                        .mimeTypes("application/epub+zip")
                        .magic(ZIP)
                        .contentDetector(ZipEntryDetector.withMimetype("application/epub+zip"))
                        .parser(PLUGIN_PARSER)
                        .dependency("org.jsoup:jsoup", "org.jsoup.Jsoup", ">=1.15")
                        .priority(10)
                        .build(),
                ConverterMetadata.builder("zip")
                        .description("Zip archive")
                        .extensions(".zip")
                        .mimeTypes("application/zip", "application/x-zip-compressed")
                        .magic(ZIP, EMPTY_ZIP)
                        .parser(PLUGIN_PARSER)
                        .build(),
                ConverterMetadata.builder("pdf")
                        .description("Portable Document Format")
                        .extensions(".pdf")
                        .mimeTypes("application/pdf")
                        .magic(MagicBytes.ascii("%PDF-"))
                        .parser(PLUGIN_PARSER)
                        .dependency("org.apache.pdfbox:pdfbox", "org.apache.pdfbox.Loader", ">=3.0")
                        .priority(10)
                        .build(),
                ConverterMetadata.builder("rtf")
                        .description("Rich Text Format")
                        .extensions(".rtf")
                        .mimeTypes("application/rtf", "text/rtf")
                        .magic(MagicBytes.ascii("{\\rtf"))
                        .parser(PLUGIN_PARSER)
                        .build(),
                ConverterMetadata.builder("html")
                        .description("HTML document")
                        .extensions(".html", ".htm", ".xhtml")
                        .mimeTypes("text/html", "application/xhtml+xml")
                        .contentDetector(BuiltinConverters::looksLikeHtml)
                        .parser(PLUGIN_PARSER)
                        .dependency("org.jsoup:jsoup", "org.jsoup.Jsoup", ">=1.15")
                        .build()
        );
    }

    private static ConverterMetadata markdown() {
        return ConverterMetadata.builder(MARKDOWN)
                .description("CommonMark with GitHub tables and strikethrough")
                .extensions(".md", ".markdown", ".mdown", ".mkd")
                .mimeTypes("text/markdown", "text/x-markdown")
                .parser(MarkdownParser::new)
                .renderer(MarkdownRenderer::new)
                .dependency("org.commonmark:commonmark", "org.commonmark.parser.Parser", ">=0.21")
                .build();
    }

    private static ConverterMetadata plainText() {
        return ConverterMetadata.builder(PLAINTEXT)
                .description("Plain text")
                .extensions(".txt", ".text")
                .mimeTypes("text/plain")
                .parser(PlainTextParser::new)
                .renderer(PlainTextRenderer::new)
                .build();
    }

    private static ConverterMetadata astJson() {
        return ConverterMetadata.builder(AST_JSON)
                .description("Serialized document tree")
                .extensions(".ast.json")
                .mimeTypes("application/vnd.docframe.ast+json")
                .contentDetector(BuiltinConverters::looksLikeAstJson)
                .parser(AstJsonParser::new)
                .renderer(AstJsonRenderer::new)
                .priority(5)
                .build();
    }

    private static ConverterMetadata office(String name, String description, String partDirectory,
                                            String mimeType, String probeClass) {
        return ConverterMetadata.builder(name)
                .description(description)
                .extensions("." + name)
                .mimeTypes(mimeType)
                .magic(ZIP)
                .contentDetector(ZipEntryDetector.containingEntry(partDirectory))
                .parser(PLUGIN_PARSER)
                .dependency("org.apache.poi:poi-ooxml", probeClass, ">=5.0")
                .priority(10)
                .build();
    }

    private static ConverterMetadata openDocument(String name, String description, String mimeType) {
        return ConverterMetadata.builder(name)
                .description(description)
                .extensions("." + name)
                .mimeTypes(mimeType)
                .magic(ZIP)
                .contentDetector(ZipEntryDetector.withMimetype(mimeType))
                .parser(PLUGIN_PARSER)
                .priority(10)
                .build();
    }

    private static boolean looksLikeHtml(DetectionContext context) {
        String head = context.prefixAsText().stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<html");
    }

    private static boolean looksLikeAstJson(DetectionContext context) {
        String head = context.prefixAsText().stripLeading();
        return head.startsWith("{") && head.contains("\"schema_version\"");
    }
}
