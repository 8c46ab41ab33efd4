package com.puzzlesearch.core;

import com.puzzlesearch.core.search.SearchStrategy;
import com.puzzlesearch.core.search.SearchTelemetry;
import com.puzzlesearch.core.search.SolveResult;
import com.puzzlesearch.core.search.SolverOptions;
import com.puzzlesearch.core.search.StrategyComparison;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point that loads a puzzle definition, solves it with one or both search
 * strategies and prints the solution traces.
 */
public final class PuzzleSolverCLI {

    private static final Logger LOGGER = Logger.getLogger(PuzzleSolverCLI.class.getName());
    private static final String BOTH = "both";

    private PuzzleSolverCLI() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the solver with the given arguments and returns the process exit status.
     */
    static int run(String[] args, PrintStream out) {
        if (args.length < 1 || args.length > 4) {
            printUsage();
            return 2;
        }
        try {
            String strategyName = BOTH;
            SolverOptions options = SolverOptions.defaults();
            for (int index = 1; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--strategy=")) {
                    strategyName = option.substring("--strategy=".length());
                } else if ("--no-prune".equals(option)) {
                    options = options.withPruneOnGenerate(false);
                } else if (option.startsWith("--progress=")) {
                    options = options.withProgressLogInterval(Long.parseLong(option.substring("--progress=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            PuzzleDefinition<?> definition = PuzzleFileParser.load(Paths.get(args[0]));
            if (BOTH.equalsIgnoreCase(strategyName)) {
                compare(definition, options, out);
            } else {
                solve(definition, SearchStrategy.fromName(strategyName), options, out);
            }
            return 0;
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
            return 2;
        } catch (MalformedPuzzleException ex) {
            LOGGER.log(Level.SEVERE, "Malformed puzzle: " + ex.getMessage(), ex);
            return 1;
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            return 1;
        }
    }

    private static <S extends PuzzleState<S>> void solve(PuzzleDefinition<S> definition, SearchStrategy strategy,
            SolverOptions options, PrintStream out) {
        SolveResult<S> result = strategy.newSolver(options).search(definition.initial());
        print(result, out);
    }

    private static <S extends PuzzleState<S>> void compare(PuzzleDefinition<S> definition, SolverOptions options,
            PrintStream out) {
        StrategyComparison.Report<S> report = new StrategyComparison(options).compare(definition.initial());
        print(report.breadthFirst(), out);
        out.println();
        print(report.depthFirst(), out);
        out.println();
        if (report.extraDepthFirstMoves() >= 0) {
            out.printf("Depth-first used %d more moves than breadth-first%n", report.extraDepthFirstMoves());
        }
    }

    private static void print(SolveResult<?> result, PrintStream out) {
        String label = result.strategy() == SearchStrategy.BREADTH_FIRST ? "Breadth-first" : "Depth-first";
        if (!result.solved()) {
            out.printf("%s search: no solution%n", label);
        } else {
            out.printf("%s search: solved in %d moves%n", label, result.moveCount());
            List<?> path = result.path().orElseThrow();
            for (int step = 0; step < path.size(); step++) {
                out.printf("-- step %d --%n%s%n", step, path.get(step));
            }
        }
        SearchTelemetry telemetry = result.telemetry();
        out.printf("expanded=%d generated=%d duplicates=%d pruned=%d nodes=%d peakFrontier=%d time=%.2fms%n",
                telemetry.expandedStates(), telemetry.generatedStates(), telemetry.duplicateStates(),
                telemetry.prunedStates(), telemetry.nodesCreated(), telemetry.peakFrontier(),
                telemetry.elapsedMillis());
    }

    private static void printUsage() {
        System.err.println("Usage: PuzzleSolverCLI <puzzleFile> [--strategy=bfs|dfs|both] [--no-prune] "
                + "[--progress=<expandedStates>]");
    }
}
