package com.puzzlesearch.core.search;

/**
 * Instrumentation captured during a single {@link Solver#search} call.
 *
 * @param expandedStates  states whose extensions were iterated
 * @param generatedStates extensions produced by those states
 * @param duplicateStates extensions skipped because their key was already visited
 * @param prunedStates    states discarded by {@code failFast()}
 * @param nodesCreated    nodes added to the search arena
 * @param peakFrontier    largest queue (breadth-first) or active path (depth-first) observed
 * @param maxDepth        depth of the deepest node created
 * @param elapsedNanos    wall-clock duration of the run
 */
public record SearchTelemetry(
        long expandedStates,
        long generatedStates,
        long duplicateStates,
        long prunedStates,
        long nodesCreated,
        int peakFrontier,
        int maxDepth,
        long elapsedNanos) {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L, 0L, 0, 0, 0L);

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    /**
     * Mutable counterpart filled in by the solvers while they run.
     */
    static final class Recorder {

        private final long start = System.nanoTime();
        private long expanded;
        private long generated;
        private long duplicates;
        private long pruned;
        private long nodes;
        private int peakFrontier;
        private int maxDepth;

        void expanded() {
            expanded++;
        }

        void generated() {
            generated++;
        }

        void duplicate() {
            duplicates++;
        }

        void pruned() {
            pruned++;
        }

        void nodeCreated(int depth) {
            nodes++;
            if (depth > maxDepth) {
                maxDepth = depth;
            }
        }

        void frontier(int size) {
            if (size > peakFrontier) {
                peakFrontier = size;
            }
        }

        long expandedCount() {
            return expanded;
        }

        SearchTelemetry finish() {
            return new SearchTelemetry(expanded, generated, duplicates, pruned, nodes, peakFrontier, maxDepth,
                    System.nanoTime() - start);
        }
    }
}
