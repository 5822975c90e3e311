package com.namekis.treewatcher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The ordered roots produced by one build. A well formed listing gives exactly one root, but none or several are
 * accepted as well.
 */
public final class Forest {
    private static final Forest EMPTY = new Forest(List.of());

    private final List<Node> roots;

    Forest(List<Node> roots) {
        this.roots = List.copyOf(roots);
    }

    public static Forest empty() {
        return EMPTY;
    }

    public List<Node> roots() {
        return roots;
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    public int nodeCount() {
        int count = 0;
        Deque<Node> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            count++;
            node.children().forEach(pending::push);
        }
        return count;
    }

    public int maxDepth() {
        int max = -1;
        Deque<Node> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            max = Math.max(max, node.depth());
            node.children().forEach(pending::push);
        }
        return max;
    }

    /** Same shape, names, depths and sibling order. Iterative, so arbitrarily deep forests compare fine. */
    public boolean structurallyEquals(Forest other) {
        Deque<List<Node>> left = new ArrayDeque<>();
        Deque<List<Node>> right = new ArrayDeque<>();
        left.push(roots);
        right.push(other.roots);
        while (!left.isEmpty()) {
            List<Node> a = left.pop();
            List<Node> b = right.pop();
            if (a.size() != b.size())
                return false;
            for (int i = 0; i < a.size(); i++) {
                Node x = a.get(i);
                Node y = b.get(i);
                if (x.depth() != y.depth() || !x.name().equals(y.name()))
                    return false;
                left.push(x.children());
                right.push(y.children());
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Forest" + roots;
    }
}
