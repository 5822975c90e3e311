package com.namekis.treewatcher;

import java.util.Objects;

/**
 * One named entry of a listing, with the depth read from its indentation. Produced per line and handed straight to a
 * forest builder.
 */
public record ParsedItem(int depth, String name) {
    public ParsedItem {
        if (depth < 0)
            throw new IllegalArgumentException("Negative depth " + depth + " for " + name);
        Objects.requireNonNull(name, "name");
    }

    ParsedItem deeper() {
        return new ParsedItem(depth + 1, name);
    }
}
