package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.Image;
import org.dxworks.docframe.ast.ListBlock;
import org.dxworks.docframe.ast.ListItem;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.Paragraph;
import org.dxworks.docframe.ast.Text;
import org.dxworks.docframe.converter.ConverterRegistry;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.TestFormats;
import org.dxworks.docframe.exception.DocframeException;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.format.BuiltinConverters;
import org.dxworks.docframe.transform.TransformRegistry;
import org.dxworks.docframe.transform.builtin.BuiltinTransforms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HooksTest {

    private static final String MARKDOWN = "# Title\n\nHello *world* again.\n\n![logo](logo.png)\n";

    private final List<String> events = new ArrayList<>();
    private ConverterRegistry converters;
    private ConversionPipeline pipeline;

    @BeforeEach
    void setUp() {
        converters = new ConverterRegistry();
        new BuiltinConverters().converters().forEach(converters::register);
        TransformRegistry transforms = new TransformRegistry();
        BuiltinTransforms.all().forEach(transforms::register);
        pipeline = new ConversionPipeline(converters, transforms);
    }

    private static DocumentInput markdown() {
        return DocumentInput.of(MARKDOWN.getBytes(StandardCharsets.UTF_8)).withFilename("doc.md");
    }

    private String convert(Hooks hooks, String... transforms) throws IOException {
        ConversionOptions options = ConversionOptions.builder().transforms(transforms).hooks(hooks).build();
        return pipeline.convertToString(markdown(), BuiltinConverters.MARKDOWN, options);
    }

    private DocumentHook recording(String label) {
        return (document, context) -> {
            events.add(label + context.getTransformName().map(name -> ":" + name).orElse(""));
            return document;
        };
    }

    @Test
    void hooksRunAtEveryStageInOrder() throws IOException {
        Hooks hooks = Hooks.builder()
                .postRender((output, context) -> {
                    events.add("post-render");
                    return output;
                })
                .onElement(Heading.class, (heading, context) -> {
                    events.add("element:" + heading.nodeType());
                    return heading;
                })
                .on(HookPoint.PRE_RENDER, recording("pre-render"))
                .on(HookPoint.POST_TRANSFORM, recording("post-transform"))
                .on(HookPoint.PRE_TRANSFORM, recording("pre-transform"))
                .on(HookPoint.POST_AST, recording("post-ast"))
                .build();

        convert(hooks, BuiltinTransforms.HEADING_OFFSET);

        assertEquals(List.of("post-ast", "pre-transform:heading-offset", "post-transform:heading-offset",
                "pre-render", "element:Heading", "post-render"), events);
    }

    @Test
    void elementHooksReplaceAndRemoveNodes() throws IOException {
        Hooks hooks = Hooks.builder()
                .onElement(Image.class, (image, context) -> null)
                .onElement(Text.class, (text, context) -> "world".equals(text.content) ? new Text("there") : text)
                .build();

        assertEquals("# Title\n\nHello *there* again.\n", convert(hooks));
    }

    @Test
    void elementHooksSeeTheirAncestors() throws IOException {
        List<String> path = new ArrayList<>();
        Hooks hooks = Hooks.builder()
                .onElement(Heading.class, (heading, context) -> new Heading(4, heading.content))
                .onElement(Text.class, (text, context) -> {
                    if ("world".equals(text.content)) {
                        context.getNodePath().forEach(node -> path.add(node.nodeType()));
                    }
                    if ("Title".equals(text.content)) {
                        Heading parent = (Heading) context.getNodePath().get(1);
                        path.add("level " + parent.level);
                    }
                    return text;
                })
                .build();

        convert(hooks);

        assertEquals(List.of("level 4", "Document", "Paragraph", "Emphasis", "Text"), path);
    }

    @Test
    void hooksShareStateThroughTheContext() throws IOException {
        Hooks hooks = Hooks.builder()
                .onElement(Image.class, (image, context) -> {
                    context.setShared("images", (Integer) context.getShared("images", 0) + 1);
                    return image;
                })
                .postRender((output, context) -> output + "<!-- images: " + context.getShared("images", 0)
                        + ", from " + context.getSourceFormat().orElse("?") + " -->\n")
                .build();

        assertTrue(convert(hooks).endsWith("<!-- images: 1, from markdown -->\n"));
    }

    @Test
    void prioritiesOrderHooksOfOneTarget() throws IOException {
        Hooks hooks = Hooks.builder()
                .postRender((output, context) -> output + "late\n", 50)
                .postRender((output, context) -> output + "early\n", 10)
                .postRender((output, context) -> output + "also late\n", 50)
                .build();

        assertTrue(convert(hooks).endsWith("early\nlate\nalso late\n"));
    }

    @Test
    void postRenderHooksApplyWhenWritingToAStream() throws IOException {
        Hooks hooks = Hooks.builder().postRender((output, context) -> output.toUpperCase()).build();
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        pipeline.convert(markdown(), BuiltinConverters.PLAINTEXT, ConversionOptions.builder().hooks(hooks).build(), output);

        assertEquals("TITLE\n\nHELLO WORLD AGAIN.\n\nLOGO\n", output.toString(StandardCharsets.UTF_8));
    }

    @Test
    void failingHooksAreSkippedUnlessStrict() throws IOException {
        DocumentHook failing = (document, context) -> {
            throw new IllegalArgumentException("broken hook");
        };

        String lenient = convert(Hooks.builder().on(HookPoint.POST_AST, failing).build());
        assertTrue(lenient.startsWith("# Title\n\nHello *world* again.\n"));

        Hooks strict = Hooks.builder().on(HookPoint.POST_AST, failing).strict(true).build();
        DocframeException e = assertThrows(DocframeException.class, () -> convert(strict));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void removingTheDocumentIsAnError() {
        Hooks stage = Hooks.builder().on(HookPoint.PRE_RENDER, (document, context) -> null).build();
        Hooks element = Hooks.builder().onElement(Document.class, (document, context) -> null).build();
        Hooks output = Hooks.builder().postRender((rendered, context) -> null).build();

        assertThrows(DocframeException.class, () -> convert(stage));
        assertThrows(DocframeException.class, () -> convert(element));
        assertThrows(DocframeException.class, () -> convert(output));
    }

    @Test
    void replacingANodeWithAnIllegalVariantIsAnError() {
        Document document = Document.of(ListBlock.bullets(ListItem.of(Paragraph.of(new Text("x")))));
        Hooks hooks = Hooks.builder()
                .onElement(ListItem.class, (item, context) -> Paragraph.of(new Text("not an item")))
                .build();

        assertThrows(DocframeException.class,
                () -> pipeline.transform(document, ConversionOptions.builder().hooks(hooks).build()));
    }

    @Test
    void transformingAParsedDocumentRunsElementHooks() {
        Document document = Document.of(Heading.of(1, "a"), Heading.of(2, "b"));
        Hooks hooks = Hooks.builder()
                .onElement(Heading.class, (heading, context) -> heading.level == 2 ? null : heading)
                .build();

        Document result = pipeline.transform(document, ConversionOptions.builder().hooks(hooks).build());

        assertEquals(List.of("Heading"), result.children.stream().map(Node::nodeType).collect(Collectors.toList()));
        assertEquals(2, document.children.size());
    }

    @Test
    void postRenderHooksNeedATextTarget() {
        converters.register(TestFormats.format("binary")
                .renderer(() -> (document, output) -> output.write(new byte[]{0, 1}))
                .build());
        ConversionOptions options = ConversionOptions.builder()
                .hooks(Hooks.builder().postRender((output, context) -> output).build())
                .build();

        ValidationException e = assertThrows(ValidationException.class,
                () -> pipeline.prepare(markdown(), "binary", options));
        assertEquals("binary", e.getSubject());
        assertEquals("markdown", pipeline.prepare(markdown(), "binary", ConversionOptions.defaults()).getSourceFormat());
    }
}
