package com.namekis.treewatcher;

import java.util.Optional;

/**
 * Result of {@link LineParser#parse(String)}: the indentation depth and, unless the line only carried connector or
 * continuation glyphs, the bare name.
 */
public final class ParsedLine {
    private final int depth;
    private final String name;

    private ParsedLine(int depth, String name) {
        this.depth = depth;
        this.name = name;
    }

    static ParsedLine spacer(int depth) {
        return new ParsedLine(depth, null);
    }

    static ParsedLine named(int depth, String name) {
        return new ParsedLine(depth, name);
    }

    public int depth() {
        return depth;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public boolean isSpacer() {
        return name == null;
    }

    public Optional<ParsedItem> toItem() {
        return isSpacer() ? Optional.empty() : Optional.of(new ParsedItem(depth, name));
    }

    @Override
    public String toString() {
        return isSpacer() ? "spacer@" + depth : name + "@" + depth;
    }
}
