package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.NodeTransformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a conversion should do besides parsing and rendering: an explicit source format
 * (skipping detection), the transforms to apply, in order, and the hooks to run along the way.
 */
public final class ConversionOptions {

    /**
     * One transform step: either the name of a registered transform or a ready instance.
     */
    public static final class Step {
        private final String name;
        private final NodeTransformer transformer;

        private Step(String name, NodeTransformer transformer) {
            this.name = name;
            this.transformer = transformer;
        }

        public Optional<String> name() {
            return Optional.ofNullable(name);
        }

        public Optional<NodeTransformer> transformer() {
            return Optional.ofNullable(transformer);
        }

        @Override
        public String toString() {
            return name != null ? name : transformer.getClass().getSimpleName();
        }
    }

    private static final ConversionOptions DEFAULTS = builder().build();

    private final String sourceFormat;
    private final List<Step> steps;
    private final Map<String, Map<String, Object>> parameters;
    private final Hooks hooks;

    private ConversionOptions(Builder builder) {
        this.sourceFormat = builder.sourceFormat;
        this.hooks = builder.hooks;
        this.steps = List.copyOf(builder.steps);
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        builder.parameters.forEach((name, values) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.parameters = Collections.unmodifiableMap(copy);
    }

    public static ConversionOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getSourceFormat() {
        return Optional.ofNullable(sourceFormat);
    }

    public List<Step> getSteps() {
        return steps;
    }

    /** Parameters per transform name. */
    public Map<String, Map<String, Object>> getParameters() {
        return parameters;
    }

    public Map<String, Object> parametersFor(String transformName) {
        return parameters.getOrDefault(transformName, Map.of());
    }

    public Hooks getHooks() {
        return hooks;
    }

    public static final class Builder {
        private String sourceFormat;
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
        private Hooks hooks = Hooks.NONE;

        private Builder() {
        }

        public Builder sourceFormat(String sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public Builder transform(String name) {
            steps.add(new Step(Objects.requireNonNull(name, "name"), null));
            return this;
        }

        public Builder transform(String name, Map<String, ?> transformParameters) {
            transform(name);
            parameters.computeIfAbsent(name, key -> new LinkedHashMap<>()).putAll(transformParameters);
            return this;
        }

        public Builder transform(NodeTransformer transformer) {
            steps.add(new Step(null, Objects.requireNonNull(transformer, "transformer")));
            return this;
        }

        public Builder transforms(String... names) {
            for (String name : names) {
                transform(name);
            }
            return this;
        }

        /**
         * Parameters for a transform that is requested, or pulled in as a dependency of one.
         */
        public Builder parameter(String transformName, String parameter, Object value) {
            parameters.computeIfAbsent(transformName, key -> new LinkedHashMap<>()).put(parameter, value);
            return this;
        }

        public Builder hooks(Hooks hooks) {
            this.hooks = Objects.requireNonNull(hooks, "hooks");
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(this);
        }
    }
}
