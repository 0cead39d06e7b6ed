package org.dxworks.docframe.exception;

/** Raised when a parser or renderer reference cannot be resolved, or registered metadata is unusable. */
public class ConfigurationException extends DocframeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
