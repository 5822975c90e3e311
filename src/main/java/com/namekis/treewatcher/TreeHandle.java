package com.namekis.treewatcher;

import java.util.List;

/**
 * A node as exposed by a {@link LazyTreeModel}. Children handles only exist once the model expanded this handle.
 */
public final class TreeHandle {
    private final long id;
    private final Node node;
    private final TreeHandle parent;
    List<TreeHandle> children;

    TreeHandle(long id, Node node, TreeHandle parent) {
        this.id = id;
        this.node = node;
        this.parent = parent;
    }

    public long id() {
        return id;
    }

    public Node node() {
        return node;
    }

    public String name() {
        return node.name();
    }

    /** Null for roots. */
    public TreeHandle parent() {
        return parent;
    }

    public boolean isFolder() {
        return node.isFolder();
    }

    /** A folder can be opened; its grandchildren are not touched until its children are opened too. */
    public boolean isExpandable() {
        return node.isFolder();
    }

    public boolean isExpanded() {
        return children != null;
    }

    @Override
    public String toString() {
        return "#" + id + " " + node;
    }
}
