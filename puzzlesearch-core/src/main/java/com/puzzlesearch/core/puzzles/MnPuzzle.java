package com.puzzlesearch.core.puzzles;

import com.puzzlesearch.core.MalformedPuzzleException;
import com.puzzlesearch.core.PuzzleState;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sliding tile puzzle on an m-by-n grid, the 15-puzzle being the 4-by-4 case. A move slides a
 * tile next to the blank into it; the puzzle is solved when the grid matches the target grid.
 */
public final class MnPuzzle implements PuzzleState<MnPuzzle> {

    public static final String BLANK = "*";

    // up, down, left, right
    private static final int[] ROW_STEPS = {-1, 1, 0, 0};
    private static final int[] COLUMN_STEPS = {0, 0, -1, 1};

    private final int rows;
    private final int columns;
    private final String[] tiles;
    private final int blank;
    private final Goal goal;

    /**
     * Creates a puzzle from the current and target grids. Tiles are arbitrary distinct symbols;
     * the blank is written {@code *} or {@code 0}.
     */
    public MnPuzzle(List<List<String>> grid, List<List<String>> target) {
        this(flatten(grid, "grid"), rowCount(grid), columnCount(grid), target);
    }

    private MnPuzzle(String[] tiles, int rows, int columns, List<List<String>> target) {
        this(tiles, rows, columns, new Goal(checkTarget(flatten(target, "target"), target, rows, columns, tiles)));
    }

    private MnPuzzle(String[] tiles, int rows, int columns, Goal goal) {
        this.rows = rows;
        this.columns = columns;
        this.tiles = tiles;
        this.goal = goal;
        this.blank = Arrays.asList(tiles).indexOf(BLANK);
    }

    /**
     * Creates a puzzle from row-major tile numbers where {@code 0} is the blank.
     */
    public static MnPuzzle of(int rows, int columns, int[] tiles, int[] target) {
        Objects.requireNonNull(tiles, "tiles");
        Objects.requireNonNull(target, "target");
        if (rows < 1 || columns < 1) {
            throw new MalformedPuzzleException("Grid must have at least one row and one column");
        }
        if (tiles.length != rows * columns || target.length != rows * columns) {
            throw new MalformedPuzzleException("Expected " + rows * columns + " tiles for a " + rows + "x" + columns
                    + " grid");
        }
        return new MnPuzzle(toGrid(tiles, rows, columns), toGrid(target, rows, columns));
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public String tileAt(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + column);
        }
        return tiles[row * columns + column];
    }

    @Override
    public boolean isSolved() {
        return Arrays.equals(tiles, goal.tiles);
    }

    /**
     * Every move is a transposition that also moves the blank by one cell, so the parity of the
     * permutation from here to the target must match the parity of the blank's distance to its
     * target cell.
     */
    @Override
    public boolean failFast() {
        int blankDistance = Math.abs(blank / columns - goal.blank / columns)
                + Math.abs(blank % columns - goal.blank % columns);
        return permutationParity() != blankDistance % 2;
    }

    /**
     * Moves the blank up, down, left and right, in that order, skipping moves off the grid.
     */
    @Override
    public Iterable<MnPuzzle> extensions() {
        return () -> new ExtensionIterator<MnPuzzle>() {
            private int direction;

            @Override
            protected MnPuzzle computeNext() {
                int row = blank / columns;
                int column = blank % columns;
                while (direction < ROW_STEPS.length) {
                    int d = direction++;
                    int neighbourRow = row + ROW_STEPS[d];
                    int neighbourColumn = column + COLUMN_STEPS[d];
                    if (neighbourRow >= 0 && neighbourRow < rows && neighbourColumn >= 0 && neighbourColumn < columns) {
                        return swapBlank(neighbourRow * columns + neighbourColumn);
                    }
                }
                return null;
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MnPuzzle)) {
            return false;
        }
        MnPuzzle other = (MnPuzzle) obj;
        return rows == other.rows
                && columns == other.columns
                && Arrays.equals(tiles, other.tiles)
                && Arrays.equals(goal.tiles, other.goal.tiles);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tiles);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < tiles.length; index++) {
            if (index > 0) {
                builder.append(index % columns == 0 ? '\n' : ' ');
            }
            builder.append(tiles[index]);
        }
        return builder.toString();
    }

    private MnPuzzle swapBlank(int neighbour) {
        String[] updated = tiles.clone();
        updated[blank] = updated[neighbour];
        updated[neighbour] = BLANK;
        return new MnPuzzle(updated, rows, columns, goal);
    }

    private int permutationParity() {
        boolean[] seen = new boolean[tiles.length];
        int transpositions = 0;
        for (int start = 0; start < tiles.length; start++) {
            int cycleLength = 0;
            for (int index = start; !seen[index]; index = goal.positions.get(tiles[index])) {
                seen[index] = true;
                cycleLength++;
            }
            if (cycleLength > 0) {
                transpositions += cycleLength - 1;
            }
        }
        return transpositions % 2;
    }

    private static String[] flatten(List<List<String>> grid, String name) {
        if (grid == null || grid.isEmpty() || grid.get(0).isEmpty()) {
            throw new MalformedPuzzleException("The " + name + " must have at least one row and one column");
        }
        int columns = grid.get(0).size();
        String[] tiles = new String[grid.size() * columns];
        for (int row = 0; row < grid.size(); row++) {
            List<String> line = grid.get(row);
            if (line.size() != columns) {
                throw new MalformedPuzzleException("Row " + row + " of the " + name + " has " + line.size()
                        + " tiles, expected " + columns);
            }
            for (int column = 0; column < columns; column++) {
                String tile = Objects.requireNonNull(line.get(column), "tile").strip();
                if (tile.isEmpty()) {
                    throw new MalformedPuzzleException("Empty tile in row " + row + " of the " + name);
                }
                tiles[row * columns + column] = "0".equals(tile) ? BLANK : tile;
            }
        }
        return checkTiles(tiles, name);
    }

    private static String[] checkTiles(String[] tiles, String name) {
        int blanks = 0;
        Map<String, Integer> seen = new HashMap<>();
        for (String tile : tiles) {
            if (BLANK.equals(tile)) {
                blanks++;
            } else if (seen.put(tile, 1) != null) {
                throw new MalformedPuzzleException("Tile " + tile + " appears more than once in the " + name);
            }
        }
        if (blanks != 1) {
            throw new MalformedPuzzleException("The " + name + " must contain exactly one blank, found " + blanks);
        }
        return tiles;
    }

    private static String[] checkTarget(String[] targetTiles, List<List<String>> target, int rows, int columns,
            String[] tiles) {
        if (target.size() != rows || columnCount(target) != columns) {
            throw new MalformedPuzzleException("Target grid must be " + rows + "x" + columns);
        }
        String[] sortedTiles = tiles.clone();
        String[] sortedTarget = targetTiles.clone();
        Arrays.sort(sortedTiles);
        Arrays.sort(sortedTarget);
        if (!Arrays.equals(sortedTiles, sortedTarget)) {
            throw new MalformedPuzzleException("Target grid must use the same tiles as the starting grid");
        }
        return targetTiles;
    }

    private static int rowCount(List<List<String>> grid) {
        return grid.size();
    }

    private static int columnCount(List<List<String>> grid) {
        return grid.get(0).size();
    }

    private static List<List<String>> toGrid(int[] values, int rows, int columns) {
        String[][] grid = new String[rows][columns];
        for (int index = 0; index < values.length; index++) {
            grid[index / columns][index % columns] = values[index] == 0 ? BLANK : Integer.toString(values[index]);
        }
        return Arrays.stream(grid).map(Arrays::asList).toList();
    }

    /**
     * Target configuration shared by every state of one puzzle.
     */
    private static final class Goal {

        private final String[] tiles;
        private final int blank;
        private final Map<String, Integer> positions;

        private Goal(String[] tiles) {
            this.tiles = tiles;
            this.blank = Arrays.asList(tiles).indexOf(BLANK);
            this.positions = new HashMap<>();
            for (int index = 0; index < tiles.length; index++) {
                positions.put(tiles[index], index);
            }
        }
    }
}
