package com.puzzlesearch.core.search;

/**
 * Immutable configuration passed to {@link Solver} implementations.
 *
 * @param pruneOnGenerate     whether the breadth-first solver applies {@code failFast()} to new
 *                            extensions before enqueuing them
 * @param progressLogInterval log a progress line every this many expanded states; {@code 0}
 *                            disables progress logging
 */
public record SolverOptions(boolean pruneOnGenerate, long progressLogInterval) {

    private static final SolverOptions DEFAULTS = new SolverOptions(true, 0L);

    public SolverOptions {
        if (progressLogInterval < 0L) {
            throw new IllegalArgumentException("progressLogInterval must not be negative");
        }
    }

    public static SolverOptions defaults() {
        return DEFAULTS;
    }

    public SolverOptions withPruneOnGenerate(boolean prune) {
        return new SolverOptions(prune, progressLogInterval);
    }

    public SolverOptions withProgressLogInterval(long interval) {
        return new SolverOptions(pruneOnGenerate, interval);
    }
}
