package org.dxworks.docframe.converter;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.exception.ConfigurationException;
import org.dxworks.docframe.exception.FormatDetectionException;
import org.dxworks.docframe.format.BuiltinConverters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Holds the known formats, detects the format of inputs and hands out parsers and renderers.
 * <p>
 * Mutations are serialized and publish a fresh immutable snapshot, so detection and lookups
 * can run concurrently with each other and never see a half-registered format.
 * A new registry is empty; {@link #initialize()} adds the built-in formats and discovered plugins.
 */
public class ConverterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ConverterRegistry.class);
    private static final int MAX_CONSECUTIVE_PLUGIN_FAILURES = 32;

    private final DocframeConfig config;
    private final DependencyChecker dependencyChecker;
    private final FormatDetector detector;
    private final Object lock = new Object();

    private volatile Map<String, ConverterMetadata> formats = Map.of();
    private volatile Map<String, Supplier<?>> components = Map.of();
    private volatile boolean initialized;

    public ConverterRegistry() {
        this(DocframeConfig.defaults(), new DependencyChecker());
    }

    public ConverterRegistry(DocframeConfig config) {
        this(config, new DependencyChecker());
    }

    public ConverterRegistry(DocframeConfig config, DependencyChecker dependencyChecker) {
        this.config = config;
        this.dependencyChecker = dependencyChecker;
        this.detector = new FormatDetector(config.getDetectionPrefixBytes());
    }

    /**
     * Adds a format. An existing format of the same name is replaced with a warning and keeps
     * its registration position.
     */
    public void register(ConverterMetadata metadata) {
        if (metadata.magicSpan() > detector.getPrefixLimit()) {
            LOG.warn("Format '{}' has a magic signature spanning {} bytes, beyond the {} byte detection prefix; "
                    + "it will never match", metadata.getFormatName(), metadata.magicSpan(), detector.getPrefixLimit());
        }
        synchronized (lock) {
            Map<String, ConverterMetadata> next = new LinkedHashMap<>(formats);
            if (next.put(metadata.getFormatName(), metadata) != null) {
                LOG.warn("Format '{}' is already registered, replacing it", metadata.getFormatName());
            } else {
                LOG.debug("Registered format '{}'", metadata.getFormatName());
            }
            formats = Collections.unmodifiableMap(next);
        }
    }

    public boolean unregister(String formatName) {
        synchronized (lock) {
            if (!formats.containsKey(formatName)) {
                return false;
            }
            Map<String, ConverterMetadata> next = new LinkedHashMap<>(formats);
            next.remove(formatName);
            formats = Collections.unmodifiableMap(next);
            LOG.debug("Unregistered format '{}'", formatName);
            return true;
        }
    }

    /**
     * Makes a parser or renderer available to named references, e.g. {@code "pdf.parser"}.
     */
    public void registerComponent(String name, Supplier<?> factory) {
        synchronized (lock) {
            Map<String, Supplier<?>> next = new LinkedHashMap<>(components);
            if (next.put(name, factory) != null) {
                LOG.warn("Component '{}' is already registered, replacing it", name);
            }
            components = Collections.unmodifiableMap(next);
        }
    }

    public Optional<ConverterMetadata> getFormatInfo(String formatName) {
        return Optional.ofNullable(formats.get(formatName));
    }

    public boolean hasFormat(String formatName) {
        return formats.containsKey(formatName);
    }

    /** Registered format names, sorted. */
    public List<String> listFormats() {
        List<String> names = new ArrayList<>(formats.keySet());
        Collections.sort(names);
        return names;
    }

    public ConverterMetadata detectFormat(DocumentInput input) {
        return detectFormat(input, null);
    }

    /**
     * Chooses the format of {@code input}. A non-null {@code explicitFormat} skips detection.
     *
     * @throws FormatDetectionException when the explicit format is unknown or nothing matches
     */
    public ConverterMetadata detectFormat(DocumentInput input, String explicitFormat) {
        if (explicitFormat != null) {
            return require(explicitFormat);
        }
        return detector.detect(input, formats.values());
    }

    public DocumentParser getParser(String formatName) {
        ConverterMetadata metadata = require(formatName);
        ComponentReference<DocumentParser> reference = metadata.getParser()
                .orElseThrow(() -> new ConfigurationException("Format '" + formatName + "' has no parser"));
        dependencyChecker.check(formatName, metadata.getDependencies());
        return resolve(formatName, reference, DocumentParser.class);
    }

    public DocumentRenderer getRenderer(String formatName) {
        ConverterMetadata metadata = require(formatName);
        ComponentReference<DocumentRenderer> reference = metadata.getRenderer()
                .orElseThrow(() -> new ConfigurationException("Format '" + formatName + "' has no renderer"));
        dependencyChecker.check(formatName, metadata.getDependencies());
        return resolve(formatName, reference, DocumentRenderer.class);
    }

    /**
     * Unsatisfied dependencies of one format; empty when it is usable.
     */
    public List<String> checkDependencies(String formatName) {
        return dependencyChecker.findMissing(require(formatName).getDependencies());
    }

    /**
     * Unsatisfied dependencies of every registered format that has any.
     */
    public Map<String, List<String>> checkDependencies() {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (ConverterMetadata metadata : formats.values()) {
            List<String> formatMissing = dependencyChecker.findMissing(metadata.getDependencies());
            if (!formatMissing.isEmpty()) {
                missing.put(metadata.getFormatName(), formatMissing);
            }
        }
        return missing;
    }

    /**
     * Registers the built-in formats and then discovers plugins. Later calls do nothing.
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            registerBuiltins();
            discoverPlugins();
            initialized = true;
        }
    }

    private void registerBuiltins() {
        for (ConverterMetadata metadata : new BuiltinConverters().converters()) {
            if (config.isFormatEnabled(metadata.getFormatName())) {
                register(metadata);
            } else {
                LOG.debug("Built-in format '{}' is disabled by configuration", metadata.getFormatName());
            }
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void clear() {
        synchronized (lock) {
            formats = Map.of();
            components = Map.of();
            initialized = false;
        }
    }

    public int discoverPlugins() {
        return discoverPlugins(defaultClassLoader());
    }

    /**
     * Registers the formats of every {@link ConverterProvider} visible to {@code classLoader}.
     * A plugin that fails to load or to describe its formats is logged and skipped. Plugin formats
     * never replace formats that are already registered.
     *
     * @return number of formats registered
     */
    public int discoverPlugins(ClassLoader classLoader) {
        Iterator<ConverterProvider> providers = ServiceLoader.load(ConverterProvider.class, classLoader).iterator();
        int registered = 0;
        int failures = 0;
        int consecutiveFailures = 0;
        while (consecutiveFailures < MAX_CONSECUTIVE_PLUGIN_FAILURES) {
            ConverterProvider provider;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                provider = providers.next();
            } catch (ServiceConfigurationError e) {
                LOG.warn("Skipping converter plugin that failed to load: {}", e.getMessage());
                failures++;
                consecutiveFailures++;
                continue;
            }
            consecutiveFailures = 0;
            int count = registerProvider(provider);
            if (count < 0) {
                failures++;
            } else {
                registered += count;
            }
        }
        LOG.info("Converter plugin discovery registered {} format(s), {} plugin(s) failed", registered, failures);
        return registered;
    }

    private int registerProvider(ConverterProvider provider) {
        String pluginName = provider.getClass().getName();
        List<ConverterMetadata> converters;
        Map<String, Supplier<?>> pluginComponents;
        try {
            converters = List.copyOf(provider.converters());
            pluginComponents = Map.copyOf(provider.components());
        } catch (RuntimeException e) {
            LOG.warn("Skipping converter plugin {}: {}", pluginName, e.toString());
            return -1;
        }
        pluginComponents.forEach(this::registerComponent);
        int count = 0;
        for (ConverterMetadata metadata : converters) {
            String formatName = metadata.getFormatName();
            if (!config.isFormatEnabled(formatName)) {
                LOG.debug("Format '{}' from {} is disabled by configuration", formatName, pluginName);
            } else if (hasFormat(formatName)) {
                LOG.warn("Plugin {} declares format '{}' which is already registered, skipping it", pluginName, formatName);
            } else {
                register(metadata);
                count++;
            }
        }
        return count;
    }

    private ConverterMetadata require(String formatName) {
        ConverterMetadata metadata = formats.get(formatName);
        if (metadata == null) {
            throw new FormatDetectionException(formatName, "Unknown format '" + formatName + "'. Registered formats: " + listFormats());
        }
        return metadata;
    }

    private <T> T resolve(String formatName, ComponentReference<T> reference, Class<T> type) {
        Object component;
        if (reference.supplier().isPresent()) {
            component = reference.supplier().get().get();
        } else {
            component = resolveNamed(formatName, reference.name().orElseThrow(), type);
        }
        if (!type.isInstance(component)) {
            throw new ConfigurationException("Component '" + reference + "' of format '" + formatName + "' is not a "
                    + type.getSimpleName() + ": " + (component == null ? "null" : component.getClass().getName()));
        }
        return type.cast(component);
    }

    private Object resolveNamed(String formatName, String name, Class<?> type) {
        Map<String, Supplier<?>> table = components;
        Supplier<?> factory = table.get(formatName + "." + name);
        if (factory == null) {
            factory = table.get(name);
        }
        if (factory != null) {
            return factory.get();
        }
        if (!name.contains(".")) {
            throw new ConfigurationException("Cannot resolve " + type.getSimpleName() + " '" + name + "' of format '"
                    + formatName + "': no component named '" + formatName + "." + name + "' is registered");
        }
        try {
            Class<?> componentClass = Class.forName(name, true, defaultClassLoader());
            return componentClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new ConfigurationException("Cannot resolve " + type.getSimpleName() + " '" + name + "' of format '"
                    + formatName + "': " + e, e);
        }
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return contextLoader != null ? contextLoader : ConverterRegistry.class.getClassLoader();
    }
}
