package com.namekis.treewatcher;

import java.util.List;

/**
 * The two interchangeable ways of turning parsed items into a forest. Both give structurally equal forests for the
 * same items.
 */
public enum BuildStrategy {
    /** One item at a time against a stack of open ancestors, see {@link StackForestBuilder}. */
    STACK {
        @Override
        public Forest build(List<ParsedItem> items, ProgressReporter progress) {
            return StackForestBuilder.build(items, progress);
        }
    },
    /** Descent over a lookahead cursor, see {@link RecursiveForestBuilder}. */
    RECURSIVE {
        @Override
        public Forest build(List<ParsedItem> items, ProgressReporter progress) {
            return RecursiveForestBuilder.build(items, progress);
        }
    };

    public abstract Forest build(List<ParsedItem> items, ProgressReporter progress);

    public Forest build(List<ParsedItem> items) {
        return build(items, ProgressReporter.silent());
    }
}
