package org.dxworks.docframe.exception;

import java.util.List;

/** Raised when a format needs an optional capability that is absent or too old. */
public class DependencyException extends DocframeException {

    private final String formatName;
    private final List<String> missingDependencies;
    private final String remediationHint;

    public DependencyException(String formatName, List<String> missingDependencies, String remediationHint) {
        super("Format '" + formatName + "' requires unavailable dependencies " + missingDependencies
                + ". " + remediationHint);
        this.formatName = formatName;
        this.missingDependencies = List.copyOf(missingDependencies);
        this.remediationHint = remediationHint;
    }

    public String getFormatName() {
        return formatName;
    }

    public List<String> getMissingDependencies() {
        return missingDependencies;
    }

    public String getRemediationHint() {
        return remediationHint;
    }
}
