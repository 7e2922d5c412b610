package org.sn.wordtrie.approx;

import java.lang.System.Logger.Level;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import org.sn.wordtrie.Trie;


/**
 * Generate the strings within an edit distance of a word, and find which of them are keys in a trie.
 *
 * <p>An edit is one of
 * <ul>
 *   <li>delete one character</li>
 *   <li>swap two adjacent characters</li>
 *   <li>replace one character by a letter of the alphabet</li>
 *   <li>insert a letter of the alphabet anywhere, including at the start and end</li>
 * </ul>
 *
 * <p>Replacing a character by itself counts as an edit, so a word is one edit away from itself
 * as long as one of its characters is in the alphabet.
 * Therefore editsN(word, 2) also contains the strings one edit away from word.
 *
 * <p>The number of strings grows as (2 * alphabet size * word length) to the power of distance,
 * so distance 3 or more is only practical for short words.
 * This class works on UTF-16 chars, not code points.
 */
public class EditDistance {
    private static final System.Logger LOGGER = System.getLogger(EditDistance.class.getName());

    public static final int DEFAULT_DISTANCE = 2;

    /**
     * Edits using the 26 letters a to z.
     */
    public static final EditDistance LOWERCASE_LATIN = new EditDistance("abcdefghijklmnopqrstuvwxyz");

    private final char[] alphabet;

    /**
     * Create an edit generator.
     *
     * @param alphabet the letters used for replacements and insertions. Duplicate letters are ignored.
     * @throws IllegalArgumentException if alphabet is empty
     */
    public EditDistance(@Nonnull String alphabet) {
        if (alphabet.isEmpty()) {
            throw new IllegalArgumentException("alphabet must not be empty");
        }
        StringBuilder distinct = new StringBuilder(alphabet.length());
        alphabet.chars().distinct().forEach(c -> distinct.append((char) c));
        this.alphabet = distinct.toString().toCharArray();
    }

    public String getAlphabet() {
        return new String(alphabet);
    }

    /**
     * Return all strings one edit away from word.
     * The set is ordered: deletes, then swaps, then replacements, then insertions, each from the start of the word.
     */
    public Set<String> edits1(@Nonnull String word) {
        Objects.requireNonNull(word);
        int length = word.length();
        Set<String> result = new LinkedHashSet<>(length * (2 * alphabet.length + 2) + alphabet.length);
        for (int i = 0; i < length; i++) {
            result.add(word.substring(0, i) + word.substring(i + 1));
        }
        for (int i = 0; i + 1 < length; i++) {
            result.add(word.substring(0, i) + word.charAt(i + 1) + word.charAt(i) + word.substring(i + 2));
        }
        for (int i = 0; i < length; i++) {
            String left = word.substring(0, i);
            String right = word.substring(i + 1);
            for (char c : alphabet) {
                result.add(left + c + right);
            }
        }
        for (int i = 0; i <= length; i++) {
            String left = word.substring(0, i);
            String right = word.substring(i);
            for (char c : alphabet) {
                result.add(left + c + right);
            }
        }
        return result;
    }

    /**
     * Return all strings reachable from word by applying edits1 distance times.
     * Each string appears once in the result, but may have been generated along several paths.
     *
     * @throws IllegalArgumentException if distance is zero or negative
     */
    public Set<String> editsN(@Nonnull String word, int distance) {
        Objects.requireNonNull(word);
        if (distance <= 0) {
            throw new IllegalArgumentException("distance must be positive: " + distance);
        }
        Set<String> result = new HashSet<>();
        collectEdits(word, distance, result);
        return result;
    }

    private void collectEdits(String word, int remaining, Collection<String> result) {
        if (remaining == 1) {
            result.addAll(edits1(word));
            return;
        }
        for (String edit : edits1(word)) {
            collectEdits(edit, remaining - 1, result);
        }
    }

    /**
     * Find the keys of trie within distance 2 of word.
     */
    public Set<String> findWithinDistance(@Nonnull Trie<String, ?, ?> trie, @Nonnull String word) {
        return findWithinDistance(trie, word, DEFAULT_DISTANCE);
    }

    /**
     * Find the keys of trie within the given edit distance of word.
     * This generates every string within the distance and looks each one up in the trie,
     * so the cost depends on the length of the word and not on the size of the trie.
     *
     * @throws IllegalArgumentException if distance is zero or negative
     */
    public Set<String> findWithinDistance(@Nonnull Trie<String, ?, ?> trie, @Nonnull String word, int distance) {
        Objects.requireNonNull(trie);
        Set<String> candidates = editsN(word, distance);
        Set<String> found = candidates.stream()
                                      .filter(trie::containsKey)
                                      .collect(Collectors.toCollection(HashSet::new));
        LOGGER.log(Level.TRACE, () -> "Found " + found.size() + " of " + candidates.size()
                + " candidates within distance " + distance + " of " + word);
        return found;
    }
}
