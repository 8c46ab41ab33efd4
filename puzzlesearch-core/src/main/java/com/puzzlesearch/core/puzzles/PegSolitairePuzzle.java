package com.puzzlesearch.core.puzzles;

import com.puzzlesearch.core.MalformedPuzzleException;
import com.puzzlesearch.core.PuzzleState;
import java.util.List;
import java.util.Objects;

/**
 * Peg solitaire on a rectangular grid. A move jumps a peg orthogonally over an adjacent peg into
 * the hole directly behind it and removes the jumped peg. The puzzle is solved when a single peg
 * remains.
 *
 * <p>Boards that are images of each other under a symmetry of the grid are treated as the same
 * state, which shrinks the search space considerably.
 */
public final class PegSolitairePuzzle implements PuzzleState<PegSolitairePuzzle> {

    public static final char PEG = '*';
    public static final char HOLE = '.';
    public static final char UNUSED = '#';

    // up, down, left, right
    private static final int[] ROW_STEPS = {-1, 1, 0, 0};
    private static final int[] COLUMN_STEPS = {0, 0, -1, 1};

    private final int rows;
    private final int columns;
    private final char[] cells;
    private final int pegCount;
    private final PegSymmetry symmetry;
    private final String canonicalKey;

    /**
     * Creates a board from its rows, using {@code *} for pegs, {@code .} for holes and {@code #}
     * for cells that are not part of the board.
     */
    public PegSolitairePuzzle(List<String> rows) {
        this(parseCells(rows), rows.size(), rows.get(0).length(), null);
    }

    private PegSolitairePuzzle(char[] cells, int rows, int columns, PegSymmetry symmetry) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
        this.symmetry = symmetry != null ? symmetry : new PegSymmetry(rows, columns);
        this.pegCount = countPegs(cells);
        this.canonicalKey = rows + "x" + columns + ":" + this.symmetry.canonical(cells);
    }

    /**
     * Parses a board from newline separated rows.
     */
    public static PegSolitairePuzzle parse(String text) {
        Objects.requireNonNull(text, "text");
        return new PegSolitairePuzzle(text.strip().lines().map(String::strip).toList());
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int pegCount() {
        return pegCount;
    }

    public char cellAt(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + column);
        }
        return cells[row * columns + column];
    }

    @Override
    public boolean isSolved() {
        return pegCount == 1;
    }

    /**
     * A board with more than one peg is hopeless when no jump is possible, or when some peg sits
     * where no line of three board cells passes through it: such a peg can never move nor be
     * removed, and removing every other peg would leave the last jumper beside it.
     */
    @Override
    public boolean failFast() {
        if (pegCount <= 1) {
            return false;
        }
        boolean anyJump = false;
        for (int index = 0; index < cells.length; index++) {
            if (cells[index] != PEG) {
                continue;
            }
            int row = index / columns;
            int column = index % columns;
            if (isStranded(row, column)) {
                return true;
            }
            if (!anyJump) {
                for (int direction = 0; direction < ROW_STEPS.length; direction++) {
                    if (canJump(row, column, direction)) {
                        anyJump = true;
                        break;
                    }
                }
            }
        }
        return !anyJump;
    }

    /**
     * Lists every board reachable by one jump. Holes are scanned in row-major order and, for each
     * hole, the peg arriving from above, below, the left and the right is tried in that order.
     */
    @Override
    public Iterable<PegSolitairePuzzle> extensions() {
        return () -> new ExtensionIterator<PegSolitairePuzzle>() {
            private int index;
            private int direction;

            @Override
            protected PegSolitairePuzzle computeNext() {
                while (index < cells.length) {
                    if (cells[index] == HOLE) {
                        int row = index / columns;
                        int column = index % columns;
                        while (direction < ROW_STEPS.length) {
                            int d = direction++;
                            // the jumping peg starts two cells away in direction d and lands here
                            int fromRow = row + 2 * ROW_STEPS[d];
                            int fromColumn = column + 2 * COLUMN_STEPS[d];
                            if (inBounds(fromRow, fromColumn) && canJump(fromRow, fromColumn, opposite(d))) {
                                return jump(fromRow, fromColumn, opposite(d));
                            }
                        }
                    }
                    index++;
                    direction = 0;
                }
                return null;
            }
        };
    }

    @Override
    public Object canonicalKey() {
        return canonicalKey;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PegSolitairePuzzle)) {
            return false;
        }
        PegSolitairePuzzle other = (PegSolitairePuzzle) obj;
        return canonicalKey.equals(other.canonicalKey);
    }

    @Override
    public int hashCode() {
        return canonicalKey.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(cells.length + rows);
        for (int row = 0; row < rows; row++) {
            if (row > 0) {
                builder.append('\n');
            }
            builder.append(cells, row * columns, columns);
        }
        return builder.toString();
    }

    private boolean canJump(int row, int column, int direction) {
        int overRow = row + ROW_STEPS[direction];
        int overColumn = column + COLUMN_STEPS[direction];
        int toRow = row + 2 * ROW_STEPS[direction];
        int toColumn = column + 2 * COLUMN_STEPS[direction];
        return inBounds(toRow, toColumn)
                && cells[row * columns + column] == PEG
                && cells[overRow * columns + overColumn] == PEG
                && cells[toRow * columns + toColumn] == HOLE;
    }

    private PegSolitairePuzzle jump(int row, int column, int direction) {
        char[] updated = cells.clone();
        updated[row * columns + column] = HOLE;
        updated[(row + ROW_STEPS[direction]) * columns + column + COLUMN_STEPS[direction]] = HOLE;
        updated[(row + 2 * ROW_STEPS[direction]) * columns + column + 2 * COLUMN_STEPS[direction]] = PEG;
        return new PegSolitairePuzzle(updated, rows, columns, symmetry);
    }

    private boolean isStranded(int row, int column) {
        // a line of three usable cells along either axis, in any of the three offsets
        for (int axis = 0; axis < 2; axis++) {
            int rowStep = axis == 0 ? 0 : 1;
            int columnStep = axis == 0 ? 1 : 0;
            for (int offset = -2; offset <= 0; offset++) {
                boolean usable = true;
                for (int k = 0; k < 3 && usable; k++) {
                    int r = row + (offset + k) * rowStep;
                    int c = column + (offset + k) * columnStep;
                    usable = inBounds(r, c) && cells[r * columns + c] != UNUSED;
                }
                if (usable) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean inBounds(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    private static int opposite(int direction) {
        return direction ^ 1;
    }

    private static int countPegs(char[] cells) {
        int count = 0;
        for (char cell : cells) {
            if (cell == PEG) {
                count++;
            }
        }
        return count;
    }

    private static char[] parseCells(List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new MalformedPuzzleException("Peg solitaire board must have at least one row");
        }
        int columns = rows.get(0).length();
        if (columns == 0) {
            throw new MalformedPuzzleException("Peg solitaire board must have at least one column");
        }
        char[] cells = new char[rows.size() * columns];
        for (int row = 0; row < rows.size(); row++) {
            String line = rows.get(row);
            if (line.length() != columns) {
                throw new MalformedPuzzleException("Row " + row + " has " + line.length()
                        + " cells, expected " + columns);
            }
            for (int column = 0; column < columns; column++) {
                char cell = line.charAt(column);
                if (cell != PEG && cell != HOLE && cell != UNUSED) {
                    throw new MalformedPuzzleException("Illegal peg solitaire cell '" + cell + "' at " + row
                            + "," + column);
                }
                cells[row * columns + column] = cell;
            }
        }
        return cells;
    }
}
