package org.dxworks.docframe.converter;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Points at a parser or renderer: either directly through a supplier, or by a name
 * resolved when the component is first requested.
 * <p>
 * Names are looked up as {@code <format>.<name>} in the registry's component table,
 * then as given, then as a fully-qualified class name with a public no-arg constructor.
 */
public final class ComponentReference<T> {

    private final Supplier<? extends T> supplier;
    private final String name;

    private ComponentReference(Supplier<? extends T> supplier, String name) {
        this.supplier = supplier;
        this.name = name;
    }

    public static <T> ComponentReference<T> direct(Supplier<? extends T> supplier) {
        return new ComponentReference<>(Objects.requireNonNull(supplier, "supplier"), null);
    }

    public static <T> ComponentReference<T> instance(T component) {
        Objects.requireNonNull(component, "component");
        return new ComponentReference<>(() -> component, null);
    }

    public static <T> ComponentReference<T> named(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        return new ComponentReference<>(null, name);
    }

    public Optional<Supplier<? extends T>> supplier() {
        return Optional.ofNullable(supplier);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public boolean isNamed() {
        return name != null;
    }

    @Override
    public String toString() {
        return name != null ? name : "<direct>";
    }
}
