package com.puzzlesearch.core.search;

import com.puzzlesearch.core.PuzzleState;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Runs breadth-first and depth-first search on the same initial state and reports how the two
 * compare in solution length and memory footprint.
 */
public final class StrategyComparison {

    private static final Logger LOGGER = Logger.getLogger(StrategyComparison.class.getName());

    private final Solver breadthFirst;
    private final Solver depthFirst;

    public StrategyComparison() {
        this(SolverOptions.defaults());
    }

    public StrategyComparison(SolverOptions options) {
        this(new BreadthFirstSolver(options), new DepthFirstSolver(options));
    }

    public StrategyComparison(Solver breadthFirst, Solver depthFirst) {
        this.breadthFirst = Objects.requireNonNull(breadthFirst, "breadthFirst");
        this.depthFirst = Objects.requireNonNull(depthFirst, "depthFirst");
    }

    /**
     * Runs both strategies one after the other on the calling thread.
     */
    public <S extends PuzzleState<S>> Report<S> compare(S initial) {
        Objects.requireNonNull(initial, "initial");
        Report<S> report = new Report<>(breadthFirst.search(initial), depthFirst.search(initial));
        log(report);
        return report;
    }

    /**
     * Races both strategies on {@code executor}. Each run owns its visited set and arena; the
     * initial state is immutable and shared read-only.
     */
    public <S extends PuzzleState<S>> CompletableFuture<Report<S>> compareAsync(S initial, Executor executor) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(executor, "executor");
        CompletableFuture<SolveResult<S>> bfs = CompletableFuture.supplyAsync(() -> breadthFirst.search(initial),
                executor);
        CompletableFuture<SolveResult<S>> dfs = CompletableFuture.supplyAsync(() -> depthFirst.search(initial),
                executor);
        return bfs.thenCombine(dfs, Report::new).whenComplete((report, error) -> {
            if (report != null) {
                log(report);
            }
        });
    }

    private void log(Report<?> report) {
        LOGGER.info(() -> String.format("BFS moves=%d peakFrontier=%d | DFS moves=%d peakPath=%d",
                report.breadthFirst().moveCount(), report.breadthFirst().telemetry().peakFrontier(),
                report.depthFirst().moveCount(), report.depthFirst().telemetry().peakFrontier()));
    }

    /**
     * Outcome of running both strategies on one initial state.
     */
    public record Report<S>(SolveResult<S> breadthFirst, SolveResult<S> depthFirst) {

        public Report {
            Objects.requireNonNull(breadthFirst, "breadthFirst");
            Objects.requireNonNull(depthFirst, "depthFirst");
        }

        /**
         * Returns {@code true} if both strategies agree on whether a solution exists.
         */
        public boolean agreeOnSolvability() {
            return breadthFirst.solved() == depthFirst.solved();
        }

        /**
         * Returns {@code true} if the breadth-first solution is no longer than the depth-first one.
         * Trivially {@code true} when neither strategy found a solution.
         */
        public boolean breadthFirstNoLonger() {
            if (!breadthFirst.solved() || !depthFirst.solved()) {
                return !depthFirst.solved();
            }
            return breadthFirst.moveCount() <= depthFirst.moveCount();
        }

        /**
         * Returns how many extra moves the depth-first solution uses, or {@code -1} if either
         * strategy found no solution.
         */
        public int extraDepthFirstMoves() {
            if (!breadthFirst.solved() || !depthFirst.solved()) {
                return -1;
            }
            return depthFirst.moveCount() - breadthFirst.moveCount();
        }
    }
}
