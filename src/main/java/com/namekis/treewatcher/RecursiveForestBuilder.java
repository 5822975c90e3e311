package com.namekis.treewatcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds a whole forest from a lookahead cursor by descent: a frame collects every following item at least as deep as
 * its minimum, and each collected item opens a child frame one level deeper.
 *
 * <p>
 * The descent runs on an explicit stack of frames rather than the call stack, so a listing that nests once per line
 * builds as well as a flat one.
 */
public final class RecursiveForestBuilder {

    private RecursiveForestBuilder() {
    }

    /** The returned nodes are the roots of the result and sit at depth 0. */
    public static List<Node> build(PeekingCursor<ParsedItem> cursor, int minDepth) {
        return build(cursor, minDepth, ProgressReporter.silent(), 0);
    }

    static Forest build(List<ParsedItem> items, ProgressReporter progress) {
        int total = items.size();
        List<Node> roots = build(PeekingCursor.over(items), 0, progress, total);
        progress.complete(Phase.BUILDING, total);
        return new Forest(roots);
    }

    private static List<Node> build(PeekingCursor<ParsedItem> cursor, int minDepth, ProgressReporter progress,
            int total) {
        List<Node> roots = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(null, minDepth));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            Optional<ParsedItem> next = cursor.peek();
            if (next.isEmpty() || next.get().depth() < frame.minDepth) {
                frames.pop();
                continue;
            }
            ParsedItem item = cursor.advance();
            Node node;
            if (frame.parent == null) {
                node = new Node(item.name(), 0);
                roots.add(node);
            } else {
                node = new Node(item.name(), frame.parent.depth() + 1);
                frame.parent.attach(node);
            }
            progress.report(Phase.BUILDING, cursor.consumed(), total);
            frames.push(new Frame(node, item.depth() + 1));
        }
        return roots;
    }

    private static final class Frame {
        final Node parent;
        final int minDepth;

        Frame(Node parent, int minDepth) {
            this.parent = parent;
            this.minDepth = minDepth;
        }
    }
}
