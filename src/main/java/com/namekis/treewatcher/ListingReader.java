package com.namekis.treewatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the decoded lines of a listing into parsed items: skips the banner, takes the first remaining line verbatim as
 * the single root, and parses every other line with {@link LineParser}.
 *
 * <p>
 * The root is depth 0 and indentation is counted from its children, so every other item is read one level deeper
 * than {@link LineParser} reports. Lines that only carry glyphs, and blank lines, produce nothing.
 */
public final class ListingReader {
    private static final Logger log = LoggerFactory.getLogger(ListingReader.class);

    private ListingReader() {
    }

    /**
     * Windows prints {@code Folder PATH listing for volume OS} and {@code Volume serial number is 1234-ABCD} above the
     * tree.
     */
    public static boolean isBanner(String line) {
        return (line.contains("PATH") && line.contains("listing")) || line.contains("Volume serial number");
    }

    public static List<ParsedItem> read(List<String> lines, ProgressReporter progress) throws NoRootFoundException {
        List<ParsedItem> items = new ArrayList<>();
        read(lines, progress, items::add);
        return items;
    }

    public static List<ParsedItem> read(List<String> lines) throws NoRootFoundException {
        return read(lines, ProgressReporter.silent());
    }

    /**
     * Streams the items of {@code lines} to {@code sink} in line order.
     *
     * @return the number of lines consumed from the root on
     */
    static int read(List<String> lines, ProgressReporter progress, Consumer<ParsedItem> sink)
            throws NoRootFoundException {
        int start = 0;
        while (start < lines.size() && (isBanner(lines.get(start)) || lines.get(start).isBlank()))
            start++;
        if (start >= lines.size())
            throw new NoRootFoundException(start);

        int total = lines.size() - start;
        sink.accept(new ParsedItem(0, lines.get(start).stripTrailing()));
        int spacers = 0;
        for (int i = start + 1; i < lines.size(); i++) {
            progress.report(Phase.PARSING, i - start, total);
            String line = lines.get(i).stripTrailing();
            if (line.isEmpty())
                continue;
            ParsedLine parsed = LineParser.parse(line);
            if (parsed.isSpacer()) {
                spacers++;
                continue;
            }
            sink.accept(parsed.toItem().get().deeper());
        }
        progress.complete(Phase.PARSING, total);
        log.debug("Parsed {} lines after {} header lines, {} spacer lines", total, start, spacers);
        return total;
    }
}
