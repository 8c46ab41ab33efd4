package com.puzzlesearch.core.puzzles;

import com.puzzlesearch.core.MalformedPuzzleException;
import com.puzzlesearch.core.PuzzleState;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Sudoku on an n-by-n grid with n in {1, 4, 9}, using the digits {@code 1..n}. Each move fills
 * one empty cell; the grid is solved when every cell is filled and no row, column or box repeats
 * a digit.
 */
public final class SudokuPuzzle implements PuzzleState<SudokuPuzzle> {

    public static final char EMPTY = '.';

    private final int size;
    private final int boxSize;
    private final int[] cells; // 0 marks an empty cell
    private final int emptyCount;

    /**
     * Creates a grid from its rows. Empty cells may be written as {@code .}, {@code *} or
     * {@code 0}.
     */
    public SudokuPuzzle(List<String> rows) {
        this(parseSize(rows), parseCells(rows));
    }

    private SudokuPuzzle(int size, int[] cells) {
        this.size = size;
        this.boxSize = (int) Math.round(Math.sqrt(size));
        this.cells = cells;
        int empty = 0;
        for (int value : cells) {
            if (value == 0) {
                empty++;
            }
        }
        this.emptyCount = empty;
    }

    public static SudokuPuzzle parse(String text) {
        Objects.requireNonNull(text, "text");
        return new SudokuPuzzle(text.strip().lines().map(String::strip).toList());
    }

    public int size() {
        return size;
    }

    public int emptyCells() {
        return emptyCount;
    }

    /**
     * Returns the digit at the given cell, or {@code 0} if it is empty.
     */
    public int valueAt(int row, int column) {
        if (row < 0 || row >= size || column < 0 || column >= size) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + column);
        }
        return cells[row * size + column];
    }

    @Override
    public boolean isSolved() {
        return emptyCount == 0 && !hasDuplicate();
    }

    /**
     * A grid is hopeless once a row, column or box repeats a digit, or once some empty cell has
     * no digit left that it could take.
     */
    @Override
    public boolean failFast() {
        if (hasDuplicate()) {
            return true;
        }
        for (int index = 0; index < cells.length; index++) {
            if (cells[index] == 0 && candidates(index) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fills the empty cell with the fewest candidates (the first one in row-major order on ties)
     * with each candidate digit in ascending order.
     */
    @Override
    public Iterable<SudokuPuzzle> extensions() {
        return () -> {
            int target = mostConstrainedCell();
            int mask = target < 0 ? 0 : candidates(target);
            return new ExtensionIterator<SudokuPuzzle>() {
                private int remaining = mask;

                @Override
                protected SudokuPuzzle computeNext() {
                    if (remaining == 0) {
                        return null;
                    }
                    int digit = Integer.numberOfTrailingZeros(remaining);
                    remaining &= remaining - 1;
                    int[] updated = cells.clone();
                    updated[target] = digit;
                    return new SudokuPuzzle(size, updated);
                }
            };
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SudokuPuzzle)) {
            return false;
        }
        SudokuPuzzle other = (SudokuPuzzle) obj;
        return size == other.size && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(cells.length + size);
        for (int index = 0; index < cells.length; index++) {
            if (index > 0 && index % size == 0) {
                builder.append('\n');
            }
            int value = cells[index];
            builder.append(value == 0 ? EMPTY : Character.forDigit(value, 10));
        }
        return builder.toString();
    }

    /**
     * Returns a bit mask of the digits the cell could still take; bit {@code d} stands for
     * digit {@code d}.
     */
    private int candidates(int index) {
        int row = index / size;
        int column = index % size;
        int used = 0;
        for (int i = 0; i < size; i++) {
            used |= 1 << cells[row * size + i];
            used |= 1 << cells[i * size + column];
        }
        int boxRow = row / boxSize * boxSize;
        int boxColumn = column / boxSize * boxSize;
        for (int r = boxRow; r < boxRow + boxSize; r++) {
            for (int c = boxColumn; c < boxColumn + boxSize; c++) {
                used |= 1 << cells[r * size + c];
            }
        }
        int allDigits = ((1 << (size + 1)) - 1) & ~1;
        return allDigits & ~used;
    }

    private int mostConstrainedCell() {
        int best = -1;
        int bestCount = Integer.MAX_VALUE;
        for (int index = 0; index < cells.length; index++) {
            if (cells[index] != 0) {
                continue;
            }
            int count = Integer.bitCount(candidates(index));
            if (count < bestCount) {
                best = index;
                bestCount = count;
            }
        }
        return best;
    }

    private boolean hasDuplicate() {
        for (int unit = 0; unit < size; unit++) {
            int rowSeen = 0;
            int columnSeen = 0;
            int boxSeen = 0;
            int boxRow = unit / boxSize * boxSize;
            int boxColumn = unit % boxSize * boxSize;
            for (int i = 0; i < size; i++) {
                int rowValue = cells[unit * size + i];
                int columnValue = cells[i * size + unit];
                int boxValue = cells[(boxRow + i / boxSize) * size + boxColumn + i % boxSize];
                if (seenBefore(rowSeen, rowValue) || seenBefore(columnSeen, columnValue)
                        || seenBefore(boxSeen, boxValue)) {
                    return true;
                }
                rowSeen |= bit(rowValue);
                columnSeen |= bit(columnValue);
                boxSeen |= bit(boxValue);
            }
        }
        return false;
    }

    private static boolean seenBefore(int seen, int value) {
        return value != 0 && (seen & bit(value)) != 0;
    }

    private static int bit(int value) {
        return value == 0 ? 0 : 1 << value;
    }

    private static int parseSize(List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new MalformedPuzzleException("Sudoku grid must have at least one row");
        }
        int size = rows.size();
        if (size != 1 && size != 4 && size != 9) {
            throw new MalformedPuzzleException("Unsupported sudoku size " + size + ", expected 1, 4 or 9 rows");
        }
        return size;
    }

    private static int[] parseCells(List<String> rows) {
        int size = rows.size();
        int[] cells = new int[size * size];
        for (int row = 0; row < size; row++) {
            String line = rows.get(row);
            if (line.length() != size) {
                throw new MalformedPuzzleException("Row " + row + " has " + line.length() + " cells, expected " + size);
            }
            for (int column = 0; column < size; column++) {
                char symbol = line.charAt(column);
                int value;
                if (symbol == EMPTY || symbol == '*' || symbol == '0') {
                    value = 0;
                } else if (symbol >= '1' && symbol <= '9' && symbol - '0' <= size) {
                    value = symbol - '0';
                } else {
                    throw new MalformedPuzzleException("Illegal sudoku symbol '" + symbol + "' at " + row + "," + column);
                }
                cells[row * size + column] = value;
            }
        }
        return cells;
    }
}
