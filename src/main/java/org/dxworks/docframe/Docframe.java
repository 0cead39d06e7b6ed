package org.dxworks.docframe;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.converter.ConverterMetadata;
import org.dxworks.docframe.converter.ConverterRegistry;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.DocumentRenderer;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.pipeline.ConversionOptions;
import org.dxworks.docframe.pipeline.ConversionPipeline;
import org.dxworks.docframe.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * Entry point of the library. Owns a converter registry, a transform registry and the pipeline
 * that joins them.
 * <p>
 * {@link #getDefault()} returns a lazily created, fully initialized instance shared by the process;
 * embedders that need isolation create their own with {@link #Docframe(DocframeConfig)}.
 */
public class Docframe {

    private static final Logger LOG = LoggerFactory.getLogger(Docframe.class);

    private static final Object DEFAULT_LOCK = new Object();
    private static volatile Docframe defaultInstance;

    private final ConverterRegistry converters;
    private final TransformRegistry transforms;
    private final ConversionPipeline pipeline;

    /**
     * Creates an instance with empty registries. Call {@link #initialize()} to add the built-ins and plugins.
     */
    public Docframe(DocframeConfig config) {
        this(new ConverterRegistry(config), new TransformRegistry(config));
    }

    public Docframe(ConverterRegistry converters, TransformRegistry transforms) {
        this.converters = converters;
        this.transforms = transforms;
        this.pipeline = new ConversionPipeline(converters, transforms);
    }

    public static Docframe getDefault() {
        Docframe instance = defaultInstance;
        if (instance == null) {
            synchronized (DEFAULT_LOCK) {
                instance = defaultInstance;
                if (instance == null) {
                    instance = new Docframe(DocframeConfig.load()).initialize();
                    defaultInstance = instance;
                }
            }
        }
        return instance;
    }

    /** Drops the shared instance; the next {@link #getDefault()} builds a new one. */
    public static void clearDefault() {
        synchronized (DEFAULT_LOCK) {
            defaultInstance = null;
        }
    }

    public Docframe initialize() {
        converters.initialize();
        transforms.initialize();
        return this;
    }

    public ConverterRegistry converters() {
        return converters;
    }

    public TransformRegistry transforms() {
        return transforms;
    }

    public ConversionPipeline pipeline() {
        return pipeline;
    }

    public ConverterMetadata detectFormat(DocumentInput input) {
        return converters.detectFormat(input);
    }

    public Document parse(DocumentInput input) {
        return parse(input, null);
    }

    public Document parse(DocumentInput input, String sourceFormat) {
        try {
            return pipeline.parse(input, sourceFormat);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse " + input.describe(), e);
        }
    }

    public Document transform(Document document, ConversionOptions options) {
        return pipeline.transform(document, options);
    }

    public String render(Document document, String targetFormat) {
        return pipeline.renderToString(document, targetFormat);
    }

    public void render(Document document, String targetFormat, Path output) {
        DocumentRenderer renderer = converters.getRenderer(targetFormat);
        try {
            writeReplacing(output, stream -> renderer.render(document, stream));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + output, e);
        }
    }

    public void convert(DocumentInput input, String targetFormat, ConversionOptions options, OutputStream output) {
        try {
            pipeline.convert(input, targetFormat, options, output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert " + input.describe(), e);
        }
    }

    /**
     * Converts into a file. The conversion is validated before {@code output} is touched, and the result
     * replaces it only once complete, so a failure leaves an existing file as it was. The input and
     * the output may be the same file.
     */
    public void convert(DocumentInput input, String targetFormat, ConversionOptions options, Path output) {
        ConversionPipeline.PreparedConversion conversion = pipeline.prepare(input, targetFormat, options);
        try {
            writeReplacing(output, conversion::writeTo);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert " + input.describe() + " to " + output, e);
        }
    }

    /**
     * Writes into a temporary file next to {@code output}, then moves it over {@code output}.
     */
    private static void writeReplacing(Path output, OutputWriter writer) throws IOException {
        Path directory = output.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temporary = Files.createTempFile(directory, "." + output.getFileName(), ".tmp");
        try {
            try (OutputStream stream = Files.newOutputStream(temporary)) {
                writer.writeTo(stream);
            }
            try {
                Files.move(temporary, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, replacing it non-atomically", output);
                Files.move(temporary, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (RuntimeException | IOException e) {
            Files.deleteIfExists(temporary);
            throw e;
        }
    }

    @FunctionalInterface
    private interface OutputWriter {
        void writeTo(OutputStream stream) throws IOException;
    }

    public String convertToString(DocumentInput input, String targetFormat) {
        return convertToString(input, targetFormat, ConversionOptions.defaults());
    }

    public String convertToString(DocumentInput input, String targetFormat, ConversionOptions options) {
        try {
            return pipeline.convertToString(input, targetFormat, options);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert " + input.describe(), e);
        }
    }

    /**
     * Converts every file into {@code outputDirectory}, in parallel. A failing file does not stop
     * the others; its error is reported in the returned list, which follows the order of {@code files}.
     * Output files keep the input's base name and take the target format's first extension. When two
     * inputs map to the same output, e.g. {@code report.md} and {@code report.txt}, only the first is
     * converted and the later ones fail with a {@link ValidationException}.
     */
    public List<BatchResult> convertAll(Collection<Path> files, Path outputDirectory, String targetFormat,
                                        ConversionOptions options) {
        String extension = outputExtension(targetFormat);
        List<Path> inputs = new ArrayList<>(files);
        List<BatchResult> results = new ArrayList<>(Collections.nCopies(inputs.size(), null));
        AtomicInteger progress = new AtomicInteger(0);
        AtomicInteger errors = new AtomicInteger(0);

        List<Path> outputs = new ArrayList<>(inputs.size());
        Map<Path, Path> claimed = new HashMap<>();
        for (Path file : inputs) {
            Path output = outputDirectory.resolve(baseName(file) + extension);
            Path owner = claimed.putIfAbsent(output.toAbsolutePath().normalize(), file);
            outputs.add(owner == null ? output : null);
        }

        IntStream.range(0, inputs.size()).parallel().forEach(index -> {
            Path file = inputs.get(index);
            Path output = outputs.get(index);
            LOG.debug("[{}/{}] Converting {}", progress.incrementAndGet(), inputs.size(), file);
            BatchResult result;
            try {
                if (output == null) {
                    Path taken = outputDirectory.resolve(baseName(file) + extension);
                    throw new ValidationException(file.toString(), null, "Output " + taken + " is already written by "
                            + claimed.get(taken.toAbsolutePath().normalize()));
                }
                convert(DocumentInput.of(file), targetFormat, options, output);
                result = new BatchResult(file, output, null);
            } catch (RuntimeException e) {
                LOG.warn("Error converting {}: {}", file.getFileName(), e.getMessage());
                errors.incrementAndGet();
                result = new BatchResult(file, null, e);
            }
            synchronized (results) {
                results.set(index, result);
            }
        });

        LOG.info("Converted {} file(s) to {}, {} error(s)", inputs.size() - errors.get(), targetFormat, errors.get());
        return List.copyOf(results);
    }

    private String outputExtension(String targetFormat) {
        ConverterMetadata target = converters.getFormatInfo(targetFormat).orElse(null);
        if (target == null || target.getExtensions().isEmpty()) {
            return "." + targetFormat;
        }
        return target.getExtensions().iterator().next();
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Outcome of converting one file in {@link #convertAll}.
     */
    public static final class BatchResult {
        public final Path input;
        public final Path output;
        public final RuntimeException error;

        BatchResult(Path input, Path output, RuntimeException error) {
            this.input = input;
            this.output = output;
            this.error = error;
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
