package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeText;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.ast.Paragraph;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Drops paragraphs whose trimmed text starts matching one of the patterns (case-insensitive),
 * e.g. "CONFIDENTIAL" or "Page 3 of 10".
 */
public class RemoveBoilerplateTransform extends NodeTransformer {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "^CONFIDENTIAL$",
            "^Page \\d+ of \\d+$",
            "^Internal Use Only$",
            "^\\[DRAFT\\]$",
            "^Copyright \\d{4}",
            "^Printed on \\d{4}-\\d{2}-\\d{2}$"
    );

    private final List<Pattern> patterns;

    /**
     * @throws IllegalArgumentException when a pattern is not a valid regular expression
     */
    public RemoveBoilerplateTransform(List<String> patterns) {
        this.patterns = patterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    @Override
    public Node visit(Paragraph paragraph) {
        String text = NodeText.of(paragraph).strip();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).lookingAt()) {
                return null;
            }
        }
        return super.visit(paragraph);
    }
}
