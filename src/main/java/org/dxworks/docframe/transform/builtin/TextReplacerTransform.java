package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.ast.Text;

/**
 * Replaces literal text in text nodes. Code, link targets and other literals are left alone.
 */
public class TextReplacerTransform extends NodeTransformer {

    private final String find;
    private final String replace;

    public TextReplacerTransform(String find, String replace) {
        if (find.isEmpty()) {
            throw new IllegalArgumentException("Text to find must not be empty");
        }
        this.find = find;
        this.replace = replace;
    }

    @Override
    public Node visit(Text text) {
        return new Text(text.content.replace(find, replace)).copyAttributesFrom(text);
    }
}
