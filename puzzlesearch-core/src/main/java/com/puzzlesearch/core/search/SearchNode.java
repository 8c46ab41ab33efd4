package com.puzzlesearch.core.search;

/**
 * Snapshot of one arena entry.
 *
 * @param handle the node's own handle
 * @param state  the wrapped puzzle state
 * @param parent the parent's handle, or {@link SearchArena#NO_PARENT} for the root
 * @param depth  the number of moves from the root
 */
public record SearchNode<S>(int handle, S state, int parent, int depth) {

    public boolean isRoot() {
        return parent == SearchArena.NO_PARENT;
    }
}
