package com.namekis.treewatcher.cli;

import java.nio.file.Path;

import com.namekis.treewatcher.TreeWatcherException;

/** None of the supported charsets could decode the listing file. */
public class ListingDecodeException extends TreeWatcherException {
    private static final long serialVersionUID = 1L;

    private final Path file;

    public ListingDecodeException(Path file, Throwable cause) {
        super("Cannot decode " + file + " as " + ListingFiles.CHARSETS, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
