package com.namekis.treewatcher;

import java.util.List;
import java.util.Set;

/**
 * Reads one line of `tree` output into a depth and a bare name.
 *
 * <p>
 * Depth is counted in 4 character indentation units, as drawn by both the Unicode and the ASCII flavours:
 *
 * <pre>
 * C:.
 * ├── fileA.txt          +---fileA.txt
 * │   └── fileB.txt      |   \---fileB.txt
 * └── dirC               \---dirC
 *     └── fileD.txt          \---fileD.txt
 * </pre>
 *
 * The connector of an entry never counts: {@code "├── fileA.txt"} is depth 0 and {@code "│   └── fileB.txt"} is depth
 * 1. Units that are cut short (two bars closer than 4 columns, or a connector or name character inside the unit) still
 * count as one level, so compressed output degrades to a best guess instead of failing. No line is ever rejected.
 */
public final class LineParser {
    static final int UNIT = 4;

    // longest forms first
    private static final List<String> CONNECTOR_PREFIXES = List.of("├── ", "└── ", "├──", "└──", "+---", "\\---",
            "└─ ", "├─ ", "└─", "├─");
    // Windows extends these with more dashes, as in ├───name
    private static final Set<String> OPEN_ENDED_PREFIXES = Set.of("├──", "└──", "└─", "├─");

    private LineParser() {
    }

    public static ParsedLine parse(String line) {
        int depth = 0;
        int idx = 0;
        int n = line.length();

        while (idx + UNIT <= n) {
            char first = line.charAt(idx);
            if (isConnector(first) || !isSpacer(first))
                break;

            int width = UNIT;
            boolean nameStarts = false;
            for (int i = 0; i < UNIT; i++) {
                char c = line.charAt(idx + i);
                if (isContinuation(c)) {
                    if (i > 0) {
                        // compressed indentation: the second bar opens the next level
                        width = i;
                        break;
                    }
                } else if (c != ' ') {
                    // connector or name character inside the unit
                    width = i;
                    nameStarts = true;
                    break;
                }
            }
            depth++;
            idx += width;
            if (nameStarts)
                break;
        }

        String rest = line.substring(idx);
        String trimmed = rest.strip();
        if (trimmed.isEmpty() || isLoneContinuation(trimmed))
            return ParsedLine.spacer(depth);

        String name = null;
        for (String prefix : CONNECTOR_PREFIXES) {
            if (rest.startsWith(prefix)) {
                String after = rest.substring(prefix.length());
                name = OPEN_ENDED_PREFIXES.contains(prefix) ? stripDashRun(after) : after;
                break;
            }
        }
        if (name == null) {
            if (isContinuation(rest.charAt(0)))
                return ParsedLine.spacer(depth);
            name = stripLeadingDash(rest);
        }
        if (name.isEmpty())
            return ParsedLine.spacer(depth);
        return ParsedLine.named(depth, name);
    }

    /** Windows `tree` draws {@code ├───name}; after an open-ended prefix a run of '─' and one space are left over. */
    static String stripDashRun(String text) {
        int k = 0;
        while (k < text.length() && text.charAt(k) == '─')
            k++;
        if (k == 0)
            return text;
        if (k < text.length() && text.charAt(k) == ' ')
            k++;
        return text.substring(k);
    }

    /** Remnant of a malformed connector: drops one {@code "─ "} or one {@code '─'}, nothing more. */
    static String stripLeadingDash(String text) {
        if (text.startsWith("─ "))
            return text.substring(2);
        if (text.startsWith("─"))
            return text.substring(1);
        return text;
    }

    static boolean isConnector(char c) {
        return c == '├' || c == '└' || c == '+' || c == '\\';
    }

    static boolean isContinuation(char c) {
        return c == '│' || c == '|';
    }

    static boolean isSpacer(char c) {
        return c == ' ' || isContinuation(c);
    }

    private static boolean isLoneContinuation(String trimmed) {
        return trimmed.length() == 1 && isContinuation(trimmed.charAt(0));
    }
}
