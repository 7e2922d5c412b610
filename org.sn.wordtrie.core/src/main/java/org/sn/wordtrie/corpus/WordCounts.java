package org.sn.wordtrie.corpus;

import java.io.IOException;
import java.lang.System.Logger.Level;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.sn.wordtrie.SimpleTrie;


/**
 * Build a trie mapping each word of a text to the number of times it occurs.
 *
 * <p>Usage:
 * <pre>
 *   SimpleTrie&lt;String, Character, Integer&gt; trie = WordCounts.fromText("cat cats catacomb apple cats");
 *   trie.get("cats"); // 2
 *   trie.findPrefix("cat"); // [cat, cats, catacomb]
 *   EditDistance.LOWERCASE_LATIN.findWithinDistance(trie, "app"); // [apple]
 * </pre>
 */
public class WordCounts {
    private static final System.Logger LOGGER = System.getLogger(WordCounts.class.getName());

    private WordCounts() {
    }

    /**
     * Count the words in text.
     *
     * @param text the text to split into words, see {@link WordTokenizer}
     * @param lowercase if true then convert the text to lowercase first, so that "Cat" and "cat" are the same word
     * @return a map of word to count, in order of first occurrence
     */
    public static Map<String, Integer> count(@Nonnull String text, boolean lowercase) {
        Objects.requireNonNull(text);
        if (lowercase) {
            text = text.toLowerCase(Locale.ROOT);
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        WordTokenizer.words(text).forEach(word -> counts.merge(word, 1, Integer::sum));
        return counts;
    }

    /**
     * Build a trie from word counts.
     */
    public static SimpleTrie<String, Character, Integer> toTrie(@Nonnull Map<String, Integer> counts) {
        SimpleTrie<String, Character, Integer> trie = SimpleTrie.forStrings();
        trie.putAll(counts);
        return trie;
    }

    /**
     * Build a word count trie from text, treating uppercase and lowercase letters as the same.
     */
    public static SimpleTrie<String, Character, Integer> fromText(@Nonnull String text) {
        return fromText(text, true);
    }

    public static SimpleTrie<String, Character, Integer> fromText(@Nonnull String text, boolean lowercase) {
        var counts = count(text, lowercase);
        LOGGER.log(Level.DEBUG, "Counted {0} distinct words in {1} chars", counts.size(), text.length());
        return toTrie(counts);
    }

    /**
     * Build a word count trie from a UTF-8 file, treating uppercase and lowercase letters as the same.
     *
     * @throws IOException if there was an error reading the file
     */
    public static SimpleTrie<String, Character, Integer> fromFile(@Nonnull Path path) throws IOException {
        return fromFile(path, StandardCharsets.UTF_8, true);
    }

    /**
     * Build a word count trie from a file.
     *
     * @throws IOException if there was an error reading the file
     */
    public static SimpleTrie<String, Character, Integer> fromFile(@Nonnull Path path, @Nonnull Charset charset, boolean lowercase)
            throws IOException {
        String text = Files.readString(path, charset);
        LOGGER.log(Level.DEBUG, "Read {0} chars from {1}", text.length(), path);
        return fromText(text, lowercase);
    }
}
