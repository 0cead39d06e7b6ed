package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Heading;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

/**
 * Shifts heading levels by an offset, clamped to 1..6.
 */
public class HeadingOffsetTransform extends NodeTransformer {

    private final int offset;

    public HeadingOffsetTransform(int offset) {
        this.offset = offset;
    }

    @Override
    public Node visit(Heading heading) {
        long shifted = (long) heading.level + offset;
        int level = (int) Math.max(Heading.MIN_LEVEL, Math.min(Heading.MAX_LEVEL, shifted));
        return new Heading(level, transformChildren(heading.content)).copyAttributesFrom(heading);
    }
}
