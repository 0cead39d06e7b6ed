package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.converter.ConverterMetadata;
import org.dxworks.docframe.converter.ConverterRegistry;
import org.dxworks.docframe.converter.DocumentInput;
import org.dxworks.docframe.converter.DocumentParser;
import org.dxworks.docframe.converter.DocumentRenderer;
import org.dxworks.docframe.exception.DocframeException;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parse, transform, render.
 * <p>
 * Everything that can be rejected up front is checked before the input is parsed: the source
 * format, the renderer of the target format and every transform with its parameters. A named
 * transform is preceded by its dependencies, and a transform runs at most once per conversion.
 * <p>
 * Hooks from {@link ConversionOptions#getHooks()} run in this order: {@link HookPoint#POST_AST},
 * {@link HookPoint#PRE_TRANSFORM} and {@link HookPoint#POST_TRANSFORM} around each transform,
 * {@link HookPoint#PRE_RENDER}, the element hooks, and the post-render hooks on the rendered text.
 */
public class ConversionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionPipeline.class);

    private final ConverterRegistry converters;
    private final TransformRegistry transforms;

    public ConversionPipeline(ConverterRegistry converters, TransformRegistry transforms) {
        this.converters = converters;
        this.transforms = transforms;
    }

    public Document parse(DocumentInput input) throws IOException {
        return parse(input, null);
    }

    /**
     * @param sourceFormat explicit format, or null to detect it
     */
    public Document parse(DocumentInput input, String sourceFormat) throws IOException {
        ConverterMetadata format = converters.detectFormat(input, sourceFormat);
        return converters.getParser(format.getFormatName()).parse(input);
    }

    /**
     * Creates the transforms {@code options} asks for, in execution order.
     *
     * @throws ValidationException when a transform is unknown, a parameter is invalid, or parameters
     *                             are given for a transform that will not run
     */
    public List<NodeTransformer> prepareTransforms(ConversionOptions options) {
        List<NodeTransformer> instances = new ArrayList<>();
        for (PlannedTransform planned : planTransforms(options)) {
            instances.add(planned.transformer);
        }
        return instances;
    }

    private List<PlannedTransform> planTransforms(ConversionOptions options) {
        List<Object> plan = new ArrayList<>();
        Set<String> planned = new LinkedHashSet<>();
        for (ConversionOptions.Step step : options.getSteps()) {
            if (step.transformer().isPresent()) {
                plan.add(step.transformer().get());
                continue;
            }
            String name = step.name().orElseThrow();
            if (!transforms.hasTransform(name)) {
                throw new ValidationException(name, null, "Unknown transform '" + name + "'. Registered transforms: "
                        + transforms.listTransforms());
            }
            for (String resolved : transforms.resolveDependencies(List.of(name))) {
                if (planned.add(resolved)) {
                    plan.add(resolved);
                }
            }
        }

        for (String parameterized : options.getParameters().keySet()) {
            if (!planned.contains(parameterized)) {
                throw new ValidationException(parameterized, null, "Parameters were given for transform '"
                        + parameterized + "' which is not part of this conversion");
            }
        }

        List<PlannedTransform> instances = new ArrayList<>(plan.size());
        for (Object entry : plan) {
            if (entry instanceof String name) {
                instances.add(new PlannedTransform(name, transforms.getTransform(name, options.parametersFor(name))));
            } else {
                NodeTransformer transformer = (NodeTransformer) entry;
                instances.add(new PlannedTransform(transformer.getClass().getSimpleName(), transformer));
            }
        }
        LOG.debug("Prepared transforms {}", plan);
        return instances;
    }

    public Document applyTransforms(Document document, List<NodeTransformer> transformers) {
        Document current = document;
        for (NodeTransformer transformer : transformers) {
            current = applyTransform(current, transformer.getClass().getSimpleName(), transformer);
        }
        return current;
    }

    private Document applyTransforms(Document document, List<PlannedTransform> plan, Hooks hooks, HookContext context) {
        Document current = document;
        for (PlannedTransform planned : plan) {
            context.setTransformName(planned.name);
            current = hooks.runDocumentHooks(HookPoint.PRE_TRANSFORM, current, context);
            current = applyTransform(current, planned.name, planned.transformer);
            context.setDocument(current);
            current = hooks.runDocumentHooks(HookPoint.POST_TRANSFORM, current, context);
        }
        context.setTransformName(null);
        return current;
    }

    private static Document applyTransform(Document document, String name, NodeTransformer transformer) {
        Document result;
        try {
            result = transformer.transformDocument(document);
        } catch (IllegalStateException e) {
            throw new DocframeException("Transform " + name + " failed: " + e.getMessage(), e);
        }
        LOG.debug("Applied transform {}", name);
        return result;
    }

    /**
     * Applies the transforms of {@code options} to an already parsed document, with their
     * transform hooks, then runs the element hooks.
     */
    public Document transform(Document document, ConversionOptions options) {
        List<PlannedTransform> plan = planTransforms(options);
        Hooks hooks = options.getHooks();
        HookContext context = new HookContext(document, null, null);
        Document result = applyTransforms(document, plan, hooks, context);
        return applyElementHooks(result, hooks, context);
    }

    public void render(Document document, String targetFormat, OutputStream output) throws IOException {
        converters.getRenderer(targetFormat).render(document, output);
    }

    public String renderToString(Document document, String targetFormat) {
        return converters.getRenderer(targetFormat).renderToString(document);
    }

    /**
     * Converts {@code input} to {@code targetFormat}, writing the result to {@code output}.
     */
    public void convert(DocumentInput input, String targetFormat, ConversionOptions options, OutputStream output)
            throws IOException {
        prepare(input, targetFormat, options).writeTo(output);
    }

    public String convertToString(DocumentInput input, String targetFormat, ConversionOptions options) throws IOException {
        return prepare(input, targetFormat, options).renderToString();
    }

    /**
     * Resolves everything a conversion needs without reading past the detection prefix: the source
     * format, its parser, the renderer and the transform instances.
     *
     * @throws ValidationException when the options are invalid, e.g. post-render hooks for a binary target
     */
    public PreparedConversion prepare(DocumentInput input, String targetFormat, ConversionOptions options) {
        ConverterMetadata source = converters.detectFormat(input, options.getSourceFormat().orElse(null));
        DocumentRenderer renderer = converters.getRenderer(targetFormat);
        List<PlannedTransform> plan = planTransforms(options);
        if (options.getHooks().hasOutputHooks() && !renderer.isText()) {
            throw new ValidationException(targetFormat, null, "Post-render hooks need a text format, but '"
                    + targetFormat + "' renders binary output");
        }
        DocumentParser parser = converters.getParser(source.getFormatName());
        LOG.debug("Converting {} from {} to {}", input, source.getFormatName(), targetFormat);
        return new PreparedConversion(input, source.getFormatName(), targetFormat, parser, plan, renderer,
                options.getHooks());
    }

    private static Document applyElementHooks(Document document, Hooks hooks, HookContext context) {
        try {
            return hooks.applyElementHooks(document, context);
        } catch (IllegalStateException e) {
            throw new DocframeException("Element hooks failed: " + e.getMessage(), e);
        }
    }

    /**
     * A validated conversion of one input, ready to run.
     */
    public final class PreparedConversion {
        private final DocumentInput input;
        private final String sourceFormat;
        private final String targetFormat;
        private final DocumentParser parser;
        private final List<PlannedTransform> plan;
        private final DocumentRenderer renderer;
        private final Hooks hooks;

        private PreparedConversion(DocumentInput input, String sourceFormat, String targetFormat, DocumentParser parser,
                                   List<PlannedTransform> plan, DocumentRenderer renderer, Hooks hooks) {
            this.input = input;
            this.sourceFormat = sourceFormat;
            this.targetFormat = targetFormat;
            this.parser = parser;
            this.plan = plan;
            this.renderer = renderer;
            this.hooks = hooks;
        }

        public String getSourceFormat() {
            return sourceFormat;
        }

        public String getTargetFormat() {
            return targetFormat;
        }

        /**
         * Parses, transforms and renders into {@code output}.
         */
        public void writeTo(OutputStream output) throws IOException {
            HookContext context = new HookContext(null, sourceFormat, targetFormat);
            Document document = buildDocument(context);
            if (hooks.hasOutputHooks()) {
                String rendered = hooks.runOutputHooks(renderer.renderToString(document), context);
                output.write(rendered.getBytes(StandardCharsets.UTF_8));
                output.flush();
                return;
            }
            renderer.render(document, output);
        }

        /**
         * Parses, transforms and renders into memory. Binary output decodes as ISO-8859-1.
         */
        public String renderToString() throws IOException {
            HookContext context = new HookContext(null, sourceFormat, targetFormat);
            Document document = buildDocument(context);
            if (renderer.isText()) {
                return hooks.runOutputHooks(renderer.renderToString(document), context);
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            renderer.render(document, buffer);
            return buffer.toString(StandardCharsets.ISO_8859_1);
        }

        private Document buildDocument(HookContext context) throws IOException {
            Document document = parser.parse(input);
            context.setDocument(document);
            document = hooks.runDocumentHooks(HookPoint.POST_AST, document, context);
            document = applyTransforms(document, plan, hooks, context);
            document = hooks.runDocumentHooks(HookPoint.PRE_RENDER, document, context);
            return applyElementHooks(document, hooks, context);
        }
    }

    private static final class PlannedTransform {
        final String name;
        final NodeTransformer transformer;

        PlannedTransform(String name, NodeTransformer transformer) {
            this.name = name;
            this.transformer = transformer;
        }
    }
}
