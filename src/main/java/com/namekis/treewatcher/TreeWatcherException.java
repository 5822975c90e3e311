package com.namekis.treewatcher;

/** Checked base for conditions a caller of the loader is expected to report, not crash on. */
public class TreeWatcherException extends Exception {
    private static final long serialVersionUID = 1L;

    public TreeWatcherException(String message) {
        super(message);
    }

    public TreeWatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
