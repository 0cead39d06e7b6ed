package org.dxworks.docframe.exception;

/** Raised for malformed options or transform parameters, always before any document is touched. */
public class ValidationException extends DocframeException {

    private final String subject;
    private final String parameter;

    public ValidationException(String subject, String parameter, String message) {
        super(message);
        this.subject = subject;
        this.parameter = parameter;
    }

    public ValidationException(String subject, String parameter, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
        this.parameter = parameter;
    }

    /** Name of the transform (or other component) whose input was rejected. */
    public String getSubject() {
        return subject;
    }

    /** Offending parameter name, or null when the failure is not tied to one parameter. */
    public String getParameter() {
        return parameter;
    }
}
