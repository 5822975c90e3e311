package com.namekis.treewatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An entry of the rebuilt hierarchy. Children keep the order of the listing. Only the builders of this package attach
 * children; everyone else sees a read-only view.
 */
public final class Node {
    private final String name;
    private final int depth;
    private final List<Node> children = new ArrayList<>();
    private final List<Node> childrenView = Collections.unmodifiableList(children);

    Node(String name, int depth) {
        this.name = Objects.requireNonNull(name, "name");
        this.depth = depth;
    }

    public String name() {
        return name;
    }

    public int depth() {
        return depth;
    }

    public List<Node> children() {
        return childrenView;
    }

    public int childCount() {
        return children.size();
    }

    /**
     * The listing never says what is a folder, so anything that got a child is one. An empty folder reads as a leaf.
     */
    public boolean isFolder() {
        return !children.isEmpty();
    }

    void attach(Node child) {
        if (child.depth != depth + 1)
            throw new IllegalArgumentException("Child " + child + " cannot go under " + this);
        children.add(child);
    }

    @Override
    public String toString() {
        return name + "@" + depth + (isFolder() ? "[" + children.size() + "]" : "");
    }
}
