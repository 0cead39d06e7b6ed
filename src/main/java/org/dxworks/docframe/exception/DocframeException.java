package org.dxworks.docframe.exception;

/**
 * Base type for every failure raised by the conversion core.
 */
public class DocframeException extends RuntimeException {

    public DocframeException(String message) {
        super(message);
    }

    public DocframeException(String message, Throwable cause) {
        super(message, cause);
    }
}
