package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Link;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

import java.util.regex.Pattern;

/**
 * Rewrites link URLs with a regular expression. The replacement uses {@link java.util.regex.Matcher}
 * syntax, e.g. {@code $1} for the first group.
 */
public class LinkRewriterTransform extends NodeTransformer {

    private final Pattern pattern;
    private final String replacement;

    /**
     * @throws IllegalArgumentException when {@code pattern} is not a valid regular expression
     */
    public LinkRewriterTransform(String pattern, String replacement) {
        this.pattern = Pattern.compile(pattern);
        this.replacement = replacement;
    }

    @Override
    public Node visit(Link link) {
        Link rewritten = (Link) super.visit(link);
        rewritten.url = pattern.matcher(link.url).replaceAll(replacement);
        return rewritten;
    }
}
