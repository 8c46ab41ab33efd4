package com.puzzlesearch.core.puzzles;

import com.puzzlesearch.core.MalformedPuzzleException;
import com.puzzlesearch.core.PuzzleState;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Word ladder: step from one word to a target word, changing a single letter at each step, so that
 * every intermediate word belongs to the dictionary.
 */
public final class WordLadderPuzzle implements PuzzleState<WordLadderPuzzle> {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private final String word;
    private final String target;
    private final Set<String> dictionary;

    /**
     * Creates a ladder from {@code from} to {@code to} over the given dictionary. Words consist of
     * lowercase ASCII letters; the dictionary is copied.
     */
    public WordLadderPuzzle(String from, String to, Collection<String> dictionary) {
        this(checkWord(from, "start word"), checkWord(to, "target word"), copyDictionary(dictionary));
    }

    private WordLadderPuzzle(String word, String target, Set<String> dictionary) {
        this.word = word;
        this.target = target;
        this.dictionary = dictionary;
    }

    public String word() {
        return word;
    }

    public String target() {
        return target;
    }

    public Set<String> dictionary() {
        return dictionary;
    }

    @Override
    public boolean isSolved() {
        return word.equals(target);
    }

    @Override
    public boolean failFast() {
        if (isSolved()) {
            return false;
        }
        return word.length() != target.length() || !dictionary.contains(target);
    }

    /**
     * Changes one letter at a time, positions left to right and letters in alphabetical order,
     * keeping only dictionary words.
     */
    @Override
    public Iterable<WordLadderPuzzle> extensions() {
        return () -> new ExtensionIterator<WordLadderPuzzle>() {
            private int position;
            private int letter;

            @Override
            protected WordLadderPuzzle computeNext() {
                while (position < word.length()) {
                    while (letter < ALPHABET.length()) {
                        char replacement = ALPHABET.charAt(letter++);
                        if (replacement == word.charAt(position)) {
                            continue;
                        }
                        String candidate = word.substring(0, position) + replacement + word.substring(position + 1);
                        if (dictionary.contains(candidate)) {
                            return new WordLadderPuzzle(candidate, target, dictionary);
                        }
                    }
                    position++;
                    letter = 0;
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
        if (!(obj instanceof WordLadderPuzzle)) {
            return false;
        }
        WordLadderPuzzle other = (WordLadderPuzzle) obj;
        return word.equals(other.word)
                && target.equals(other.target)
                && (dictionary == other.dictionary || dictionary.equals(other.dictionary));
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, target);
    }

    @Override
    public String toString() {
        return word + " -> " + target;
    }

    private static String checkWord(String word, String name) {
        if (word == null || word.isEmpty()) {
            throw new MalformedPuzzleException("The " + name + " must not be empty");
        }
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'a' || c > 'z') {
                throw new MalformedPuzzleException("The " + name + " '" + word + "' must use lowercase letters only");
            }
        }
        return word;
    }

    private static Set<String> copyDictionary(Collection<String> dictionary) {
        if (dictionary == null) {
            throw new MalformedPuzzleException("A word ladder needs a dictionary");
        }
        for (String entry : dictionary) {
            checkWord(entry, "dictionary word");
        }
        return Set.copyOf(dictionary);
    }
}
