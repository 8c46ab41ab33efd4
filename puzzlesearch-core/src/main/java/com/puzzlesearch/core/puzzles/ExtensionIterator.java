package com.puzzlesearch.core.puzzles;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base iterator for lazily generated extensions. Subclasses produce one state per
 * {@link #computeNext()} call and return {@code null} once the moves are exhausted.
 */
abstract class ExtensionIterator<S> implements Iterator<S> {

    private S next;
    private boolean exhausted;

    protected abstract S computeNext();

    @Override
    public final boolean hasNext() {
        if (next == null && !exhausted) {
            next = computeNext();
            exhausted = next == null;
        }
        return next != null;
    }

    @Override
    public final S next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        S result = next;
        next = null;
        return result;
    }
}
