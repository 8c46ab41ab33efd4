package com.puzzlesearch.core.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Growable store of search nodes addressed by integer handle. Each node records the handle of
 * its parent instead of a reference, so parent chains never form ownership cycles and path
 * reconstruction is a backward walk over indices.
 *
 * <p>An arena belongs to a single solve call and is not thread-safe.
 */
public final class SearchArena<S> {

    public static final int NO_PARENT = -1;

    private static final int INITIAL_CAPACITY = 64;

    private final List<S> states = new ArrayList<>(INITIAL_CAPACITY);
    private int[] parents = new int[INITIAL_CAPACITY];
    private int[] depths = new int[INITIAL_CAPACITY];

    /**
     * Adds the root node and returns its handle.
     */
    public int addRoot(S state) {
        if (!states.isEmpty()) {
            throw new IllegalStateException("Arena already holds a root node");
        }
        return append(state, NO_PARENT, 0);
    }

    /**
     * Adds a node discovered from {@code parent} and returns its handle.
     */
    public int add(S state, int parent) {
        checkHandle(parent);
        return append(state, parent, depths[parent] + 1);
    }

    public S state(int handle) {
        checkHandle(handle);
        return states.get(handle);
    }

    public int parent(int handle) {
        checkHandle(handle);
        return parents[handle];
    }

    public int depth(int handle) {
        checkHandle(handle);
        return depths[handle];
    }

    public SearchNode<S> node(int handle) {
        checkHandle(handle);
        return new SearchNode<>(handle, states.get(handle), parents[handle], depths[handle]);
    }

    public int size() {
        return states.size();
    }

    /**
     * Drops every node whose handle is greater than or equal to {@code handle}. Used by the
     * depth-first solver to release an abandoned branch.
     */
    public void truncate(int handle) {
        if (handle < 0 || handle > states.size()) {
            throw new IllegalArgumentException("Cannot truncate arena of size " + states.size() + " at " + handle);
        }
        states.subList(handle, states.size()).clear();
    }

    private int append(S state, int parent, int depth) {
        Objects.requireNonNull(state, "state");
        int handle = states.size();
        if (handle == parents.length) {
            int capacity = parents.length * 2;
            parents = Arrays.copyOf(parents, capacity);
            depths = Arrays.copyOf(depths, capacity);
        }
        states.add(state);
        parents[handle] = parent;
        depths[handle] = depth;
        return handle;
    }

    private void checkHandle(int handle) {
        if (handle < 0 || handle >= states.size()) {
            throw new IllegalArgumentException("Node handle out of range: " + handle);
        }
    }
}
