package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Image;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

public class RemoveImagesTransform extends NodeTransformer {

    @Override
    public Node visit(Image image) {
        return null;
    }
}
