package org.dxworks.docframe.transform;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validated parameter values handed to a {@link TransformFactory}: every declared parameter
 * is present, holding the supplied value or its default (which may be null).
 */
public final class TransformParameters {

    private final Map<String, Object> values;

    TransformParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Integer getInt(String name) {
        return (Integer) values.get(name);
    }

    public String getString(String name) {
        return (String) values.get(name);
    }

    public Boolean getBoolean(String name) {
        return (Boolean) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String name) {
        return (List<String>) values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
