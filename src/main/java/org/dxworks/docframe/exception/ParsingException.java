package org.dxworks.docframe.exception;

/** Raised for malformed serialized documents and structural parse failures. */
public class ParsingException extends DocframeException {

    private final String field;

    public ParsingException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ParsingException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /** Path of the offending field, e.g. {@code root.children[2].level}; may be null. */
    public String getField() {
        return field;
    }
}
