package com.namekis.treewatcher;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Single pass cursor that can look at the next element without consuming it. Drives
 * {@link RecursiveForestBuilder}, which needs to see a child's depth before deciding whether it belongs to the current
 * frame.
 */
public final class PeekingCursor<T> {
    private final Iterator<? extends T> source;
    private T peeked;
    private boolean hasPeeked;
    private int consumed;

    public PeekingCursor(Iterator<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static <T> PeekingCursor<T> over(Iterable<? extends T> items) {
        return new PeekingCursor<>(items.iterator());
    }

    /** Repeated calls return the same element until {@link #advance()} is called. */
    public Optional<T> peek() {
        if (!hasPeeked) {
            if (!source.hasNext())
                return Optional.empty();
            peeked = Objects.requireNonNull(source.next(), "null element");
            hasPeeked = true;
        }
        return Optional.of(peeked);
    }

    public boolean hasNext() {
        return hasPeeked || source.hasNext();
    }

    public T advance() {
        T next;
        if (hasPeeked) {
            next = peeked;
            peeked = null;
            hasPeeked = false;
        } else if (source.hasNext()) {
            next = Objects.requireNonNull(source.next(), "null element");
        } else {
            throw new CursorExhaustedException(consumed);
        }
        consumed++;
        return next;
    }

    public int consumed() {
        return consumed;
    }
}
