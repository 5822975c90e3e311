package com.namekis.treewatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out a built forest one level at a time: the roots right away, the children of a node only when it is expanded.
 * A consumer never pays for subtrees it does not open.
 *
 * <p>
 * The model belongs to the thread that created it, normally the one driving the view. Every call checks this, as
 * the handle table is not safe for concurrent use. Exposed handles are never removed; a new load builds a new model.
 */
public final class LazyTreeModel {
    private static final Logger log = LoggerFactory.getLogger(LazyTreeModel.class);

    private final Forest forest;
    private final Thread owner;
    private final Map<Long, TreeHandle> handles = new HashMap<>();
    private final List<TreeHandle> roots;
    private long nextId = 1;
    private int expansions;

    private LazyTreeModel(Forest forest, ProgressReporter progress) {
        this.forest = forest;
        this.owner = Thread.currentThread();
        List<Node> nodes = forest.roots();
        List<TreeHandle> exposed = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            exposed.add(expose(node, null));
            progress.report(Phase.POPULATING, exposed.size(), nodes.size());
        }
        progress.complete(Phase.POPULATING, nodes.size());
        this.roots = Collections.unmodifiableList(exposed);
    }

    public static LazyTreeModel of(Forest forest) {
        return of(forest, ProgressReporter.silent());
    }

    public static LazyTreeModel of(Forest forest, ProgressReporter progress) {
        return new LazyTreeModel(forest, progress);
    }

    public Forest forest() {
        return forest;
    }

    public List<TreeHandle> roots() {
        checkOwner();
        return roots;
    }

    /**
     * Children of {@code handle}, created on the first call. Later calls return the same list. A leaf gives an empty
     * list.
     */
    public List<TreeHandle> expand(TreeHandle handle) {
        checkOwner();
        if (handles.get(handle.id()) != handle)
            throw new IllegalArgumentException(handle + " does not belong to this model");
        if (handle.children == null) {
            List<Node> nodes = handle.node().children();
            List<TreeHandle> exposed = new ArrayList<>(nodes.size());
            for (Node child : nodes)
                exposed.add(expose(child, handle));
            handle.children = Collections.unmodifiableList(exposed);
            expansions++;
            log.trace("Expanded {} into {} children", handle, exposed.size());
        }
        return handle.children;
    }

    public Optional<TreeHandle> lookup(long id) {
        checkOwner();
        return Optional.ofNullable(handles.get(id));
    }

    public int exposedCount() {
        checkOwner();
        return handles.size();
    }

    public int expansions() {
        checkOwner();
        return expansions;
    }

    private TreeHandle expose(Node node, TreeHandle parent) {
        TreeHandle handle = new TreeHandle(nextId++, node, parent);
        handles.put(handle.id(), handle);
        return handle;
    }

    private void checkOwner() {
        if (Thread.currentThread() != owner)
            throw new IllegalStateException(
                    "Tree model owned by " + owner.getName() + " used from " + Thread.currentThread().getName());
    }
}
