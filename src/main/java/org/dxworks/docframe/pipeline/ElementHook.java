package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Node;

/**
 * Runs for every node of one type while the tree is walked before rendering.
 *
 * @param <T> the node variant the hook is registered for
 */
@FunctionalInterface
public interface ElementHook<T extends Node> {

    /**
     * @return the node itself, a replacement, or null to remove the node with its subtree
     */
    Node apply(T node, HookContext context);
}
