package com.returnlint.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Static helpers for walking trees.
 */
public final class Nodes {

    private Nodes() {
        // Utility class
    }

    /**
     * Immutable copy of {@code nodes} with null entries dropped; null becomes an empty list.
     */
    static List<Node> compact(List<Node> nodes) {
        if (nodes == null) {
            return List.of();
        }
        return nodes.stream().filter(Objects::nonNull).toList();
    }

    /**
     * All nodes of the tree rooted at {@code root} in pre-order.
     */
    public static List<Node> preOrder(Node root) {
        List<Node> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            result.add(node);
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Every function definition in the tree, outer functions before the ones nested in them.
     */
    public static List<FunctionDefinition> functions(Node root) {
        List<FunctionDefinition> functions = new ArrayList<>();
        for (Node node : preOrder(root)) {
            if (node instanceof FunctionDefinition fn) {
                functions.add(fn);
            }
        }
        return functions;
    }
}
