package com.puzzlesearch.core.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a terminal node into the ordered sequence of states from the root to that node.
 */
public final class PathReconstructor {

    private PathReconstructor() {
    }

    /**
     * Follows parent handles from {@code terminal} back to the root and returns the states in
     * root-to-terminal order. The result is unmodifiable.
     */
    public static <S> List<S> reconstruct(SearchArena<S> arena, int terminal) {
        Objects.requireNonNull(arena, "arena");
        List<S> path = new ArrayList<>(arena.depth(terminal) + 1);
        for (int handle = terminal; handle != SearchArena.NO_PARENT; handle = arena.parent(handle)) {
            path.add(arena.state(handle));
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }
}
