package com.puzzlesearch.core;

/**
 * Contract every puzzle variant implements so that the search engine can explore it without
 * knowing anything about the puzzle itself.
 *
 * <p>Implementations are immutable. A new state is only ever produced by applying one move to an
 * existing state, so several search branches may safely share the same ancestor.
 *
 * @param <S> the concrete state type, so that extensions keep their static type
 */
public interface PuzzleState<S extends PuzzleState<S>> {

    /**
     * Returns {@code true} if this state satisfies the puzzle's goal condition.
     */
    boolean isSolved();

    /**
     * Returns {@code true} if a cheap local check proves that no solution is reachable from this
     * state. A {@code false} answer makes no promise either way.
     */
    boolean failFast();

    /**
     * Returns every state reachable by exactly one legal move, in a deterministic order.
     * Each call to {@link Iterable#iterator()} restarts the sequence, and extensions are produced
     * on demand. The state itself is never part of the sequence.
     */
    Iterable<S> extensions();

    /**
     * Returns the key used to deduplicate states during a search. Two states have equal keys if
     * and only if they are {@link Object#equals(Object) equal}.
     */
    default Object canonicalKey() {
        return this;
    }
}
