package com.namekis.treewatcher;

import java.util.NoSuchElementException;

/** Thrown by {@link PeekingCursor#advance()} once the underlying sequence is used up. */
public class CursorExhaustedException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public CursorExhaustedException(int consumed) {
        super("Cursor exhausted after " + consumed + " items");
    }
}
