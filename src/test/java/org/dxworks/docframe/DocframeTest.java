package org.dxworks.docframe;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.exception.ParsingException;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.format.BuiltinConverters;
import org.dxworks.docframe.pipeline.ConversionOptions;
import org.dxworks.docframe.transform.builtin.BuiltinTransforms;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocframeTest {

    @TempDir
    Path tempDir;

    private final Docframe docframe = new Docframe(DocframeConfig.defaults()).initialize();

    @AfterEach
    void tearDown() {
        Docframe.clearDefault();
    }

    @Test
    void defaultInstanceIsSharedUntilCleared() {
        Docframe first = Docframe.getDefault();

        assertSame(first, Docframe.getDefault());
        assertTrue(first.converters().isInitialized());
        assertTrue(first.transforms().isInitialized());

        Docframe.clearDefault();
        assertNotSame(first, Docframe.getDefault());
    }

    @Test
    void convertsBetweenFormats() throws IOException {
        DocumentInput input = DocumentInput.of(TestUtils.sample("markdown/Basic.md"));

        String text = docframe.convertToString(input, BuiltinConverters.PLAINTEXT);

        assertTrue(text.startsWith("Sample Notes\n\nIntro with emphasis, strong and code. Second line of the paragraph.\n"));
    }

    @Test
    void parsesTransformsAndRenders() {
        Document document = docframe.parse(DocumentInput.of(TestUtils.utf8("# Intro\n")).withFilename("a.md"));
        Document shifted = docframe.transform(document, ConversionOptions.builder()
                .transform(BuiltinTransforms.HEADING_OFFSET, Map.of("offset", 2))
                .build());

        assertEquals(3, assertInstanceOf(Heading.class, shifted.children.get(0)).level);
        assertEquals("### Intro\n", docframe.render(shifted, BuiltinConverters.MARKDOWN));
    }

    @Test
    void convertWritesFilesAndCreatesDirectories() throws IOException {
        Path output = tempDir.resolve("out/nested/doc.txt");

        docframe.convert(DocumentInput.of(TestUtils.utf8("# Hi\n")).withFilename("doc.md"), BuiltinConverters.PLAINTEXT,
                ConversionOptions.defaults(), output);

        assertEquals("Hi\n", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void failedConversionLeavesNoOutput() {
        Path output = tempDir.resolve("broken.md");

        assertThrows(ParsingException.class, () -> docframe.convert(
                DocumentInput.of(TestUtils.utf8("{not json")).withFilename("broken.ast.json"),
                BuiltinConverters.MARKDOWN, ConversionOptions.defaults(), output));
        assertFalse(Files.exists(output));
    }

    @Test
    void convertsAFileInPlace() throws IOException {
        Path notes = Files.writeString(tempDir.resolve("notes.md"), "# Notes\n\nbody\n");

        docframe.convert(DocumentInput.of(notes), BuiltinConverters.MARKDOWN, ConversionOptions.builder()
                .transform(BuiltinTransforms.HEADING_OFFSET, Map.of("offset", 1))
                .build(), notes);

        assertEquals("## Notes\n\nbody\n", Files.readString(notes, StandardCharsets.UTF_8));
    }

    @Test
    void rejectedConversionKeepsTheExistingOutput() throws IOException {
        Path output = Files.writeString(tempDir.resolve("out.txt"), "previous\n");
        ConversionOptions options = ConversionOptions.builder().transform("no-such-transform").build();

        assertThrows(ValidationException.class, () -> docframe.convert(
                DocumentInput.of(TestUtils.utf8("# Hi\n")).withFilename("doc.md"), BuiltinConverters.PLAINTEXT, options, output));
        assertThrows(ParsingException.class, () -> docframe.convert(
                DocumentInput.of(TestUtils.utf8("{not json")).withFilename("broken.ast.json"),
                BuiltinConverters.PLAINTEXT, ConversionOptions.defaults(), output));

        assertEquals("previous\n", Files.readString(output, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(output), files.collect(Collectors.toList()));
        }
    }

    @Test
    void convertAllRefusesToWriteOneOutputTwice() throws IOException {
        Path inputs = Files.createDirectories(tempDir.resolve("in"));
        Path markdown = Files.writeString(inputs.resolve("report.md"), "# Report\n");
        Path text = Files.writeString(inputs.resolve("report.txt"), "plain report\n");
        Path outputs = tempDir.resolve("out");

        List<Docframe.BatchResult> results = docframe.convertAll(List.of(markdown, text), outputs,
                BuiltinConverters.MARKDOWN, ConversionOptions.defaults());

        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertInstanceOf(ValidationException.class, results.get(1).error);
        assertEquals("# Report\n", Files.readString(outputs.resolve("report.md"), StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(outputs)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void convertAllReportsEachFile() throws IOException {
        Path inputs = Files.createDirectories(tempDir.resolve("in"));
        Path first = Files.writeString(inputs.resolve("first.md"), "# First\n");
        Path broken = Files.writeString(inputs.resolve("broken.ast.json"), "{not json");
        Path second = Files.writeString(inputs.resolve("second.txt"), "plain words\n");
        Path outputs = tempDir.resolve("out");

        List<Docframe.BatchResult> results = docframe.convertAll(List.of(first, broken, second), outputs,
                BuiltinConverters.MARKDOWN, ConversionOptions.defaults());

        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals(outputs.resolve("first.md"), results.get(0).output);
        assertFalse(results.get(1).isSuccess());
        assertNull(results.get(1).output);
        assertInstanceOf(ParsingException.class, results.get(1).error);
        assertEquals("plain words\n", Files.readString(outputs.resolve("second.md"), StandardCharsets.UTF_8));
    }
}
