package com.puzzlesearch.core;

import java.util.Objects;

/**
 * An initial puzzle state tagged with the kind of puzzle it belongs to.
 *
 * @param kind    the puzzle variant
 * @param initial the starting state
 */
public record PuzzleDefinition<S extends PuzzleState<S>>(Kind kind, S initial) {

    public PuzzleDefinition {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(initial, "initial");
    }

    /**
     * The puzzle variants understood by {@link PuzzleFileParser}.
     */
    public enum Kind {
        SUDOKU("sudoku"),
        PEG_SOLITAIRE("peg"),
        MN_PUZZLE("mn"),
        WORD_LADDER("ladder");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static Kind fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equalsIgnoreCase(keyword)) {
                    return kind;
                }
            }
            throw new MalformedPuzzleException("Unknown puzzle kind: " + keyword);
        }
    }
}
