package com.puzzlesearch.core;

/**
 * Thrown when raw puzzle input cannot be turned into a valid initial state. Raised at
 * construction time, before any solver sees the state.
 */
public class MalformedPuzzleException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedPuzzleException(String message) {
        super(message);
    }

    public MalformedPuzzleException(String message, Throwable cause) {
        super(message, cause);
    }
}
