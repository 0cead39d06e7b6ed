package org.dxworks.docframe.transform;

import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a registered transform: how to create it, which parameters it takes, which
 * transforms must run before it and its priority among otherwise unordered transforms
 * (lower runs first).
 */
public final class TransformMetadata {

    public static final int DEFAULT_PRIORITY = 100;

    private final String name;
    private final String description;
    private final TransformFactory factory;
    private final Map<String, ParameterSpec> parameters;
    private final int priority;
    private final Set<String> dependencies;
    private final String version;
    private final String author;
    private final Set<String> tags;

    private TransformMetadata(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.factory = builder.factory;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.priority = builder.priority;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.version = builder.version;
        this.author = builder.author;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
    }

    public static Builder builder(String name, TransformFactory factory) {
        return new Builder(name, factory);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, ParameterSpec> getParameters() {
        return parameters;
    }

    public int getPriority() {
        return priority;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public String getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public Set<String> getTags() {
        return tags;
    }

    /**
     * Validates {@code supplied} against the parameter specs and creates the transform.
     *
     * @throws ValidationException for an unknown parameter, a missing required one, a value of the
     *                             wrong type or outside its choices, or a value the factory rejects
     */
    public NodeTransformer createInstance(Map<String, ?> supplied) {
        for (String parameter : supplied.keySet()) {
            if (!parameters.containsKey(parameter)) {
                throw new ValidationException(name, parameter, "Unknown parameter '" + parameter
                        + "' for transform '" + name + "'. Known parameters: " + parameters.keySet());
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, ParameterSpec> entry : parameters.entrySet()) {
            String parameter = entry.getKey();
            ParameterSpec spec = entry.getValue();
            Object value = supplied.get(parameter);
            if (value != null) {
                values.put(parameter, spec.validate(name, parameter, value));
            } else if (spec.isRequired()) {
                throw new ValidationException(name, parameter, "Missing required parameter '" + parameter
                        + "' for transform '" + name + "'");
            } else {
                values.put(parameter, spec.getDefaultValue());
            }
        }

        NodeTransformer transformer;
        try {
            transformer = factory.create(new TransformParameters(values));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(name, null, "Invalid parameters for transform '" + name + "': "
                    + e.getMessage(), e);
        }
        if (transformer == null) {
            throw new ValidationException(name, null, "Factory of transform '" + name + "' returned null");
        }
        return transformer;
    }

    public NodeTransformer createInstance() {
        return createInstance(Map.of());
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private final TransformFactory factory;
        private String description = "";
        private final Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        private int priority = DEFAULT_PRIORITY;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private String version = "1.0.0";
        private String author;
        private final List<String> tags = new ArrayList<>();

        private Builder(String name, TransformFactory factory) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Transform name must not be blank");
            }
            this.name = name;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNullElse(description, "");
            return this;
        }

        public Builder parameter(String parameterName, ParameterSpec spec) {
            this.parameters.put(parameterName, spec);
            return this;
        }

        public Builder priority(int priority) {
            if (priority < 0) {
                throw new IllegalArgumentException("Priority of transform '" + name + "' must be non-negative, got " + priority);
            }
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... transformNames) {
            this.dependencies.addAll(Arrays.asList(transformNames));
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public TransformMetadata build() {
            return new TransformMetadata(this);
        }
    }
}
