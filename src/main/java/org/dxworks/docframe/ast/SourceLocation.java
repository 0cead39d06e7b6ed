package org.dxworks.docframe.ast;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Where a node came from in its source document. Every position is optional.
 */
public final class SourceLocation {
    public String format;
    public Integer page;
    public Integer line;
    public Integer column;
    public String elementId;
    public Map<String, Object> metadata = new LinkedHashMap<>();

    public SourceLocation(String format) {
        this.format = format;
    }

    public static SourceLocation atLine(String format, int line) {
        SourceLocation location = new SourceLocation(format);
        location.line = line;
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation other)) return false;
        return Objects.equals(format, other.format)
                && Objects.equals(page, other.page)
                && Objects.equals(line, other.line)
                && Objects.equals(column, other.column)
                && Objects.equals(elementId, other.elementId)
                && Objects.equals(metadata, other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, page, line, column, elementId, metadata);
    }
}
