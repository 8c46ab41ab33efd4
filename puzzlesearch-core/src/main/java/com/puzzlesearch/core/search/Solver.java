package com.puzzlesearch.core.search;

import com.puzzlesearch.core.PuzzleState;
import java.util.List;
import java.util.Optional;

/**
 * Generic interface for uninformed state-space search implementations.
 */
public interface Solver {

    /**
     * Explores the state space reachable from {@code initial} and reports the solution found
     * together with the run's telemetry. Exhausting the space without a solution is a normal
     * outcome, reported through {@link SolveResult#solved()}.
     *
     * @param initial the starting state
     * @return the result of the search
     */
    <S extends PuzzleState<S>> SolveResult<S> search(S initial);

    /**
     * Returns the solution path from {@code initial} to a solved state, or an empty optional if
     * no solution is reachable.
     */
    default <S extends PuzzleState<S>> Optional<List<S>> solve(S initial) {
        return search(initial).path();
    }

    SearchStrategy strategy();
}
