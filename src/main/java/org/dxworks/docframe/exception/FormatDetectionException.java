package org.dxworks.docframe.exception;

/** Raised when no registered format applies to an input, or a requested format is unknown. */
public class FormatDetectionException extends DocframeException {

    private final String input;

    public FormatDetectionException(String input, String message) {
        super(message);
        this.input = input;
    }

    /**
     * Description of the input (file name, format name or "&lt;bytes&gt;") detection failed for.
     */
    public String getInput() {
        return input;
    }
}
