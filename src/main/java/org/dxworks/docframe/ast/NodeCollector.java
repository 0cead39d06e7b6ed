package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collects, in pre-order, every node of a tree that matches a predicate.
 */
public class NodeCollector {

    public static List<Node> collect(Node root, Predicate<Node> predicate) {
        List<Node> matches = new ArrayList<>();
        collectInto(root, predicate, matches);
        return matches;
    }

    public static <T extends Node> List<T> collect(Node root, Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Node node : collect(root, type::isInstance)) {
            matches.add(type.cast(node));
        }
        return matches;
    }

    /**
     * Node type discriminators of the whole tree in pre-order, e.g.
     * {@code [Document, Heading, Text, Paragraph, Text]}.
     */
    public static List<String> nodeTypes(Node root) {
        List<String> types = new ArrayList<>();
        for (Node node : collect(root, node -> true)) {
            types.add(node.nodeType());
        }
        return types;
    }

    private static void collectInto(Node node, Predicate<Node> predicate, List<Node> matches) {
        if (predicate.test(node)) {
            matches.add(node);
        }
        for (Node child : node.children()) {
            collectInto(child, predicate, matches);
        }
    }
}
