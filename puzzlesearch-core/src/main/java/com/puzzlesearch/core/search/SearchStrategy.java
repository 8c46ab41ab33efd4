package com.puzzlesearch.core.search;

import java.util.Locale;
import java.util.Objects;

/**
 * The uninformed traversal strategies offered by the engine.
 */
public enum SearchStrategy {
    BREADTH_FIRST("bfs"),
    DEPTH_FIRST("dfs");

    private final String shortName;

    SearchStrategy(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    public Solver newSolver(SolverOptions options) {
        Objects.requireNonNull(options, "options");
        switch (this) {
            case BREADTH_FIRST:
                return new BreadthFirstSolver(options);
            case DEPTH_FIRST:
                return new DepthFirstSolver(options);
            default:
                throw new IllegalStateException("Unhandled strategy " + this);
        }
    }

    /**
     * Resolves a strategy from its short name ({@code bfs}, {@code dfs}) or its constant name.
     */
    public static SearchStrategy fromName(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SearchStrategy strategy : values()) {
            if (strategy.shortName.equals(normalized)
                    || strategy.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized)
                    || strategy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown search strategy: " + name);
    }
}
