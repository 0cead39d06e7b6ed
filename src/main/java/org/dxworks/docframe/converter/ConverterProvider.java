package org.dxworks.docframe.converter;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Plugin entry point for additional formats, found with {@link java.util.ServiceLoader}.
 * List implementations in {@code META-INF/services/org.dxworks.docframe.converter.ConverterProvider}.
 */
public interface ConverterProvider {

    List<ConverterMetadata> converters();

    /**
     * Named parsers and renderers that this plugin's metadata refers to by name,
     * keyed as {@code <format>.<name>} or by a fully-qualified name.
     */
    default Map<String, Supplier<?>> components() {
        return Map.of();
    }
}
