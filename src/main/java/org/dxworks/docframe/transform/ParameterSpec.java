package org.dxworks.docframe.transform;

import org.dxworks.docframe.exception.ValidationException;

import java.util.List;

/**
 * Declares one parameter of a transform: its type, default, whether it must be given,
 * optional allowed values and help text. Instances are immutable; the {@code with}-style
 * methods return modified copies.
 */
public final class ParameterSpec {

    private final ParameterType type;
    private final Object defaultValue;
    private final boolean required;
    private final List<Object> choices;
    private final String help;

    private ParameterSpec(ParameterType type, Object defaultValue, boolean required, List<Object> choices, String help) {
        this.type = type;
        this.defaultValue = defaultValue;
        this.required = required;
        this.choices = choices;
        this.help = help;
    }

    public static ParameterSpec of(ParameterType type, Object defaultValue) {
        Object normalized = null;
        if (defaultValue != null) {
            normalized = type.normalize(defaultValue);
            if (normalized == null) {
                throw new IllegalArgumentException("Default " + defaultValue + " is not a " + type.getDescription());
            }
        }
        return new ParameterSpec(type, normalized, false, List.of(), "");
    }

    public static ParameterSpec integer(Integer defaultValue) {
        return of(ParameterType.INTEGER, defaultValue);
    }

    public static ParameterSpec string(String defaultValue) {
        return of(ParameterType.STRING, defaultValue);
    }

    public static ParameterSpec bool(Boolean defaultValue) {
        return of(ParameterType.BOOLEAN, defaultValue);
    }

    public static ParameterSpec stringList(List<String> defaultValue) {
        return of(ParameterType.STRING_LIST, defaultValue);
    }

    public ParameterSpec required() {
        return new ParameterSpec(type, defaultValue, true, choices, help);
    }

    public ParameterSpec choices(Object... allowed) {
        return new ParameterSpec(type, defaultValue, required, List.of(allowed), help);
    }

    public ParameterSpec help(String text) {
        return new ParameterSpec(type, defaultValue, required, choices, text);
    }

    public ParameterType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public List<Object> getChoices() {
        return choices;
    }

    public String getHelp() {
        return help;
    }

    /**
     * Checks a supplied value and returns it in canonical form.
     *
     * @throws ValidationException when the value has the wrong type or is not one of the choices
     */
    Object validate(String transformName, String parameterName, Object value) {
        Object normalized = type.normalize(value);
        if (normalized == null) {
            throw new ValidationException(transformName, parameterName, "Parameter '" + parameterName
                    + "' of transform '" + transformName + "' must be a " + type.getDescription() + ", got "
                    + (value == null ? "null" : value.getClass().getSimpleName() + " " + value));
        }
        if (!choices.isEmpty() && !choices.contains(normalized)) {
            throw new ValidationException(transformName, parameterName, "Parameter '" + parameterName
                    + "' of transform '" + transformName + "' must be one of " + choices + ", got " + normalized);
        }
        return normalized;
    }
}
