package com.puzzlesearch.core;

import com.puzzlesearch.core.puzzles.MnPuzzle;
import com.puzzlesearch.core.puzzles.PegSolitairePuzzle;
import com.puzzlesearch.core.puzzles.SudokuPuzzle;
import com.puzzlesearch.core.puzzles.WordLadderPuzzle;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads plain-text puzzle definitions. The first non-blank line names the puzzle kind
 * ({@code sudoku}, {@code peg}, {@code mn} or {@code ladder}); lines starting with {@code #}
 * before it are comments. The remaining lines hold the puzzle:
 * <ul>
 *     <li>{@code sudoku}: one row of digits per line, {@code .} for empty cells;</li>
 *     <li>{@code peg}: one row per line using {@code *}, {@code .} and {@code #};</li>
 *     <li>{@code mn}: whitespace separated tiles, a {@code --} line, then the target rows;</li>
 *     <li>{@code ladder}: {@code from to} on one line followed by the dictionary words.</li>
 * </ul>
 */
public final class PuzzleFileParser {

    private static final Logger LOGGER = Logger.getLogger(PuzzleFileParser.class.getName());
    private static final String GRID_SEPARATOR = "--";

    private PuzzleFileParser() {
    }

    public static PuzzleDefinition<?> load(Path path) {
        Objects.requireNonNull(path, "path");
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read puzzle definition " + path, ex);
        }
        PuzzleDefinition<?> definition = parse(lines);
        LOGGER.info(() -> String.format("Loaded %s puzzle from %s", definition.kind().keyword(), path));
        return definition;
    }

    public static PuzzleDefinition<?> parse(String text) {
        Objects.requireNonNull(text, "text");
        return parse(text.lines().toList());
    }

    public static PuzzleDefinition<?> parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        int index = 0;
        while (index < lines.size() && (lines.get(index).isBlank() || lines.get(index).strip().startsWith("#"))) {
            index++;
        }
        if (index == lines.size()) {
            throw new MalformedPuzzleException("Puzzle definition is empty");
        }

        PuzzleDefinition.Kind kind = PuzzleDefinition.Kind.fromKeyword(lines.get(index).strip());
        List<String> body = new ArrayList<>();
        for (String line : lines.subList(index + 1, lines.size())) {
            if (!line.isBlank()) {
                body.add(line.strip());
            }
        }
        if (body.isEmpty()) {
            throw new MalformedPuzzleException("The " + kind.keyword() + " definition has no body");
        }

        switch (kind) {
            case SUDOKU:
                return new PuzzleDefinition<>(kind, new SudokuPuzzle(body));
            case PEG_SOLITAIRE:
                return new PuzzleDefinition<>(kind, new PegSolitairePuzzle(body));
            case MN_PUZZLE:
                return new PuzzleDefinition<>(kind, parseMn(body));
            case WORD_LADDER:
                return new PuzzleDefinition<>(kind, parseLadder(body));
            default:
                throw new IllegalStateException("Unhandled puzzle kind " + kind);
        }
    }

    private static MnPuzzle parseMn(List<String> body) {
        int separator = body.indexOf(GRID_SEPARATOR);
        if (separator < 0) {
            throw new MalformedPuzzleException("MN puzzle needs a '" + GRID_SEPARATOR + "' line before the target grid");
        }
        return new MnPuzzle(toRows(body.subList(0, separator)), toRows(body.subList(separator + 1, body.size())));
    }

    private static List<List<String>> toRows(List<String> lines) {
        List<List<String>> rows = new ArrayList<>(lines.size());
        for (String line : lines) {
            rows.add(Arrays.asList(line.split("\\s+")));
        }
        return rows;
    }

    private static WordLadderPuzzle parseLadder(List<String> body) {
        String[] ends = body.get(0).split("\\s+");
        if (ends.length != 2) {
            throw new MalformedPuzzleException("Word ladder needs 'from to' on its first line");
        }
        List<String> words = new ArrayList<>();
        for (String line : body.subList(1, body.size())) {
            words.addAll(Arrays.asList(line.split("\\s+")));
        }
        return new WordLadderPuzzle(ends[0], ends[1], words);
    }
}
