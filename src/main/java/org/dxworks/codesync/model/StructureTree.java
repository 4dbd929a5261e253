package org.dxworks.codesync.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Arena-backed tree shared by the Java and Markdown models. Every node is registered in the arena in the order
 * it is attached, and a node refers to its parent by arena index so ownership stays one-directional.
 */
public class StructureTree<N extends TreeNode<N>> {
    private final List<N> arena = new ArrayList<>();

    public StructureTree(N root) {
        register(root, -1);
    }

    public N root() {
        return arena.get(0);
    }

    public int size() {
        return arena.size();
    }

    /**
     * Appends {@code child} as the last child of {@code parent}.
     */
    public N attach(N parent, N child) {
        if (!owns(parent)) {
            throw new IllegalArgumentException("Parent node does not belong to this tree");
        }
        if (child.isAttached()) {
            throw new IllegalArgumentException("Node is already attached to a tree");
        }
        register(child, parent.index);
        parent.children.add(child);
        return child;
    }

    public Optional<N> parentOf(N node) {
        if (!owns(node) || node.parentIndex < 0) {
            return Optional.empty();
        }
        return Optional.of(arena.get(node.parentIndex));
    }

    /** Ancestors of {@code node}, nearest first, root last. */
    public List<N> ancestorsOf(N node) {
        List<N> ancestors = new ArrayList<>();
        Optional<N> current = parentOf(node);
        while (current.isPresent()) {
            ancestors.add(current.get());
            current = parentOf(current.get());
        }
        return ancestors;
    }

    /** All nodes in document (pre-)order, root first. */
    public List<N> preOrder() {
        List<N> result = new ArrayList<>();
        Deque<N> stack = new ArrayDeque<>();
        stack.push(root());
        while (!stack.isEmpty()) {
            N node = stack.pop();
            result.add(node);
            List<N> children = node.children;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * First node in document order matching the predicate. When several nodes match, the earliest one wins;
     * there is no ambiguity error.
     */
    public Optional<N> firstMatch(Predicate<N> predicate) {
        for (N node : preOrder()) {
            if (predicate.test(node)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public List<N> findAll(Predicate<N> predicate) {
        List<N> result = new ArrayList<>();
        for (N node : preOrder()) {
            if (predicate.test(node)) {
                result.add(node);
            }
        }
        return result;
    }

    private boolean owns(N node) {
        return node != null && node.index >= 0 && node.index < arena.size() && arena.get(node.index) == node;
    }

    private void register(N node, int parentIndex) {
        node.index = arena.size();
        node.parentIndex = parentIndex;
        arena.add(node);
    }
}
