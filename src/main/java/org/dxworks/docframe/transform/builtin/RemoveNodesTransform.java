package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes every node whose type is listed. Types match the {@code node_type} discriminator
 * case-insensitively, with or without underscores, so {@code CodeBlock} and {@code code_block}
 * are the same. The document root is never removed.
 */
public class RemoveNodesTransform extends NodeTransformer {

    private final Set<String> nodeTypes;

    public RemoveNodesTransform(Collection<String> nodeTypes) {
        this.nodeTypes = nodeTypes.stream().map(RemoveNodesTransform::normalize).collect(Collectors.toSet());
    }

    @Override
    public Node transform(Node node) {
        if (!(node instanceof Document) && nodeTypes.contains(normalize(node.nodeType()))) {
            return null;
        }
        return super.transform(node);
    }

    private static String normalize(String type) {
        return type.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
