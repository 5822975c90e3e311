package com.namekis.treewatcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Places items one at a time under the nearest open ancestor, keeping the open ancestor chain on a stack. Every item is
 * fully placed before the next one is read, which suits feeding a live view line by line.
 *
 * <p>
 * The stack keeps the depth read from the listing; nodes get their parent's depth plus one. A jump of several levels
 * therefore lands under the deepest open ancestor instead of inventing the missing levels.
 */
public final class StackForestBuilder {
    private final Deque<Open> cursor = new ArrayDeque<>();
    private final List<Node> roots = new ArrayList<>();
    private final Consumer<Placement> listener;
    private boolean finished;
    private int accepted;

    public StackForestBuilder() {
        this(placement -> {
        });
    }

    StackForestBuilder(Consumer<Placement> listener) {
        this.listener = listener;
    }

    public Placement accept(ParsedItem item) {
        if (finished)
            throw new IllegalStateException("Builder already finished after " + accepted + " items");
        while (!cursor.isEmpty() && cursor.peek().depth >= item.depth())
            cursor.pop();

        Placement placement;
        if (cursor.isEmpty()) {
            Node node = new Node(item.name(), 0);
            roots.add(node);
            placement = new Placement(node, null, false);
        } else {
            Node parent = cursor.peek().node;
            boolean wasLeaf = !parent.isFolder();
            Node node = new Node(item.name(), parent.depth() + 1);
            parent.attach(node);
            placement = new Placement(node, parent, wasLeaf);
        }
        cursor.push(new Open(placement.node(), item.depth()));
        accepted++;
        listener.accept(placement);
        return placement;
    }

    public int accepted() {
        return accepted;
    }

    public Forest finish() {
        finished = true;
        cursor.clear();
        return new Forest(roots);
    }

    static Forest build(List<ParsedItem> items, ProgressReporter progress) {
        StackForestBuilder builder = new StackForestBuilder();
        int total = items.size();
        for (ParsedItem item : items) {
            builder.accept(item);
            progress.report(Phase.BUILDING, builder.accepted(), total);
        }
        progress.complete(Phase.BUILDING, total);
        return builder.finish();
    }

    private static final class Open {
        final Node node;
        final int depth;

        Open(Node node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }
}
