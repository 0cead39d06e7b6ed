package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

/**
 * Copies a tree while running element hooks on every node before its children are visited.
 * A replacement node is what gets descended into, and what descendants see in the node path.
 */
final class ElementHookTransformer extends NodeTransformer {

    private final Hooks hooks;
    private final HookContext context;

    ElementHookTransformer(Hooks hooks, HookContext context) {
        this.hooks = hooks;
        this.context = context;
    }

    @Override
    public Node transform(Node node) {
        context.enter(node);
        try {
            Node current = hooks.runElementHooks(node, context);
            if (current == null) {
                return null;
            }
            if (current != node) {
                context.replaceCurrent(current);
            }
            return super.transform(current);
        } finally {
            context.leave();
        }
    }
}
