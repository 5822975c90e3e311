package com.namekis.treewatcher.cli;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.namekis.treewatcher.LazyTreeModel;
import com.namekis.treewatcher.TreeHandle;

/**
 * Draws a {@link LazyTreeModel} back as a `tree` style listing, expanding folders down to a given number of levels.
 * Folders below that level are printed but not opened.
 */
public class TreePrinter {
    public enum Glyphs {
        UNICODE("├── ", "└── ", "│   ", "    "),
        ASCII("+---", "\\---", "|   ", "    ");

        final String branch;
        final String last;
        final String open;
        final String blank;

        Glyphs(String branch, String last, String open, String blank) {
            this.branch = branch;
            this.last = last;
            this.open = open;
            this.blank = blank;
        }
    }

    private final Glyphs glyphs;
    private final TreeWatcherConfig icons;
    private final int maxLevels;

    /**
     * @param icons     null to print names only
     * @param maxLevels levels to expand below the roots, negative for all
     */
    public TreePrinter(Glyphs glyphs, TreeWatcherConfig icons, int maxLevels) {
        this.glyphs = glyphs;
        this.icons = icons;
        this.maxLevels = maxLevels;
    }

    public int print(LazyTreeModel model, PrintStream out) {
        int printed = 0;
        Deque<Row> rows = new ArrayDeque<>();
        pushAll(rows, model.roots(), null, 0);
        while (!rows.isEmpty()) {
            Row row = rows.pop();
            out.println(row.prefix == null ? label(row.handle)
                    : row.prefix + (row.isLast ? glyphs.last : glyphs.branch) + label(row.handle));
            printed++;
            if (row.handle.isExpandable() && (maxLevels < 0 || row.level < maxLevels)) {
                String childPrefix = row.prefix == null ? ""
                        : row.prefix + (row.isLast ? glyphs.blank : glyphs.open);
                pushAll(rows, model.expand(row.handle), childPrefix, row.level + 1);
            }
        }
        return printed;
    }

    // reversed, so the first child is popped first
    private static void pushAll(Deque<Row> rows, List<TreeHandle> handles, String prefix, int level) {
        for (int i = handles.size() - 1; i >= 0; i--)
            rows.push(new Row(handles.get(i), prefix, i == handles.size() - 1, level));
    }

    String label(TreeHandle handle) {
        return icons == null ? handle.name() : icons.iconFor(handle.node()) + " " + handle.name();
    }

    private static final class Row {
        final TreeHandle handle;
        final String prefix;
        final boolean isLast;
        final int level;

        Row(TreeHandle handle, String prefix, boolean isLast, int level) {
            this.handle = handle;
            this.prefix = prefix;
            this.isLast = isLast;
            this.level = level;
        }
    }
}
