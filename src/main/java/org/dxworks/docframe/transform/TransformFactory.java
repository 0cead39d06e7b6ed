package org.dxworks.docframe.transform;

import org.dxworks.docframe.ast.NodeTransformer;

/**
 * Creates a transform from validated parameters. Throwing {@link IllegalArgumentException}
 * reports a parameter value the factory cannot use.
 */
@FunctionalInterface
public interface TransformFactory {

    NodeTransformer create(TransformParameters parameters);
}
