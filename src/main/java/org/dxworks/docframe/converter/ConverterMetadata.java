package org.dxworks.docframe.converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Everything the registry knows about one format: how to recognise it and where its
 * parser and renderer come from. Instances are immutable; build them with {@link #builder(String)}.
 */
public final class ConverterMetadata {

    private final String formatName;
    private final Set<String> extensions;
    private final Set<String> mimeTypes;
    private final List<MagicBytes> magicBytes;
    private final ContentDetector contentDetector;
    private final ComponentReference<DocumentParser> parser;
    private final ComponentReference<DocumentRenderer> renderer;
    private final List<DependencySpec> dependencies;
    private final int priority;
    private final String description;

    private ConverterMetadata(Builder builder) {
        this.formatName = builder.formatName;
        this.extensions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.extensions));
        this.mimeTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mimeTypes));
        this.magicBytes = List.copyOf(builder.magicBytes);
        this.contentDetector = builder.contentDetector;
        this.parser = builder.parser;
        this.renderer = builder.renderer;
        this.dependencies = List.copyOf(builder.dependencies);
        this.priority = builder.priority;
        this.description = builder.description;
    }

    public static Builder builder(String formatName) {
        return new Builder(formatName);
    }

    public String getFormatName() {
        return formatName;
    }

    /** Lower-case extensions including the leading dot, e.g. {@code .md} or {@code .ast.json}. */
    public Set<String> getExtensions() {
        return extensions;
    }

    public Set<String> getMimeTypes() {
        return mimeTypes;
    }

    public List<MagicBytes> getMagicBytes() {
        return magicBytes;
    }

    public Optional<ContentDetector> getContentDetector() {
        return Optional.ofNullable(contentDetector);
    }

    public Optional<ComponentReference<DocumentParser>> getParser() {
        return Optional.ofNullable(parser);
    }

    public Optional<ComponentReference<DocumentRenderer>> getRenderer() {
        return Optional.ofNullable(renderer);
    }

    public List<DependencySpec> getDependencies() {
        return dependencies;
    }

    public int getPriority() {
        return priority;
    }

    public String getDescription() {
        return description;
    }

    public boolean matchesFilename(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public boolean matchesMimeType(String mimeType) {
        String lower = mimeType.toLowerCase(Locale.ROOT);
        int parameters = lower.indexOf(';');
        return mimeTypes.contains(parameters >= 0 ? lower.substring(0, parameters).trim() : lower.trim());
    }

    public boolean matchesMagic(byte[] prefix) {
        for (MagicBytes magic : magicBytes) {
            if (magic.matches(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Bytes of content needed to test every magic signature. */
    public int magicSpan() {
        int span = 0;
        for (MagicBytes magic : magicBytes) {
            span = Math.max(span, magic.span());
        }
        return span;
    }

    @Override
    public String toString() {
        return formatName;
    }

    public static final class Builder {
        private final String formatName;
        private final Set<String> extensions = new LinkedHashSet<>();
        private final Set<String> mimeTypes = new LinkedHashSet<>();
        private final List<MagicBytes> magicBytes = new ArrayList<>();
        private ContentDetector contentDetector;
        private ComponentReference<DocumentParser> parser;
        private ComponentReference<DocumentRenderer> renderer;
        private final List<DependencySpec> dependencies = new ArrayList<>();
        private int priority;
        private String description = "";

        private Builder(String formatName) {
            if (formatName == null || formatName.isBlank()) {
                throw new IllegalArgumentException("Format name must not be blank");
            }
            this.formatName = formatName;
        }

        public Builder extensions(String... extensions) {
            for (String extension : extensions) {
                String lower = extension.toLowerCase(Locale.ROOT).trim();
                this.extensions.add(lower.startsWith(".") ? lower : "." + lower);
            }
            return this;
        }

        public Builder mimeTypes(String... mimeTypes) {
            Arrays.stream(mimeTypes).map(m -> m.toLowerCase(Locale.ROOT).trim()).forEach(this.mimeTypes::add);
            return this;
        }

        public Builder magic(MagicBytes... signatures) {
            this.magicBytes.addAll(Arrays.asList(signatures));
            return this;
        }

        public Builder contentDetector(ContentDetector contentDetector) {
            this.contentDetector = contentDetector;
            return this;
        }

        public Builder parser(Supplier<? extends DocumentParser> parser) {
            this.parser = ComponentReference.direct(parser);
            return this;
        }

        public Builder parser(String name) {
            this.parser = ComponentReference.named(name);
            return this;
        }

        public Builder renderer(Supplier<? extends DocumentRenderer> renderer) {
            this.renderer = ComponentReference.direct(renderer);
            return this;
        }

        public Builder renderer(String name) {
            this.renderer = ComponentReference.named(name);
            return this;
        }

        public Builder dependency(String artifact, String probeClass, String versionConstraint) {
            if (versionConstraint != null && !versionConstraint.isBlank()) {
                VersionConstraint.parse(versionConstraint);
            }
            this.dependencies.add(new DependencySpec(artifact, probeClass, versionConstraint));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNullElse(description, "");
            return this;
        }

        public ConverterMetadata build() {
            return new ConverterMetadata(this);
        }
    }
}
