package org.dxworks.docframe.exception;

import java.util.List;

/** Raised when transform ordering fails: an unknown dependency or a dependency cycle. */
public class DependencyResolutionException extends DocframeException {

    private final List<String> transformNames;

    public DependencyResolutionException(String message, List<String> transformNames) {
        super(message);
        this.transformNames = List.copyOf(transformNames);
    }

    /**
     * Transforms involved in the failure. For a cycle this is the cycle path,
     * starting and ending with the same name.
     */
    public List<String> getTransformNames() {
        return transformNames;
    }
}
