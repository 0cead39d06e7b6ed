package org.dxworks.docframe.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Value shapes a transform parameter may take. Values are never converted between shapes:
 * {@code "20"} is not an {@link #INTEGER}.
 */
public enum ParameterType {
    INTEGER("integer"),
    STRING("string"),
    BOOLEAN("boolean"),
    STRING_LIST("list of strings");

    private final String description;

    ParameterType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the value in its canonical form ({@link Integer}, {@link String}, {@link Boolean}
     * or an unmodifiable {@code List<String>}), or null if it has the wrong shape.
     */
    Object normalize(Object value) {
        switch (this) {
            case INTEGER:
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).intValue();
                }
                if (value instanceof Long longValue && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                    return longValue.intValue();
                }
                return null;
            case STRING:
                return value instanceof String ? value : null;
            case BOOLEAN:
                return value instanceof Boolean ? value : null;
            case STRING_LIST:
                if (!(value instanceof List<?> list)) {
                    return null;
                }
                List<String> strings = new ArrayList<>(list.size());
                for (Object element : list) {
                    if (!(element instanceof String string)) {
                        return null;
                    }
                    strings.add(string);
                }
                return List.copyOf(strings);
            default:
                throw new IllegalStateException("Unhandled parameter type " + this);
        }
    }
}
