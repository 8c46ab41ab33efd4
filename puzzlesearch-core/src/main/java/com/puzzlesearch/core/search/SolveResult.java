package com.puzzlesearch.core.search;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Solver} implementations.
 *
 * @param strategy  the strategy that produced this result
 * @param solution  the states from the initial state to a solved state, or {@code null} when the
 *                  reachable space holds no solution
 * @param telemetry counters collected during the run
 */
public record SolveResult<S>(SearchStrategy strategy, List<S> solution, SearchTelemetry telemetry) {

    public SolveResult {
        Objects.requireNonNull(strategy, "strategy");
        solution = solution == null ? null : List.copyOf(solution);
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public static <S> SolveResult<S> unsolved(SearchStrategy strategy, SearchTelemetry telemetry) {
        return new SolveResult<>(strategy, null, telemetry);
    }

    public boolean solved() {
        return solution != null;
    }

    public Optional<List<S>> path() {
        return Optional.ofNullable(solution);
    }

    /**
     * Returns the number of moves in the solution, or {@code -1} if there is none.
     */
    public int moveCount() {
        return solution == null ? -1 : solution.size() - 1;
    }
}
