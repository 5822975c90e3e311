package com.namekis.treewatcher;

/**
 * The listing had nothing left once banner and blank lines were skipped: there is no top path line to hang the tree
 * on.
 */
public class NoRootFoundException extends TreeWatcherException {
    private static final long serialVersionUID = 1L;

    private final int skippedLines;

    public NoRootFoundException(int skippedLines) {
        super("No tree structure found." + (skippedLines > 0 ? " Skipped " + skippedLines + " header lines." : ""));
        this.skippedLines = skippedLines;
    }

    public int skippedLines() {
        return skippedLines;
    }
}
