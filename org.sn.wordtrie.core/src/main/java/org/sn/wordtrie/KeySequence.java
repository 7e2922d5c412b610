package org.sn.wordtrie;

import java.util.List;
import javax.annotation.Nonnull;


/**
 * Converts between the key that a client passes to a trie and the sequence of symbols used to descend the trie.
 * For example a string key becomes a sequence of characters, and a sentence key a sequence of words.
 *
 * <p>The two functions must be inverses of each other:
 * <code>fromSymbols(toList(toSymbols(key))).equals(key)</code>.
 *
 * @param <K> the type of key, such as String
 * @param <S> the type of each symbol, such as Character
 * @see KeySequences
 */
public interface KeySequence<K, S> {
    /**
     * Return the symbols of a key in order.
     * The trie reads the returned iterable once.
     */
    @Nonnull Iterable<S> toSymbols(@Nonnull K key);

    /**
     * Build a key from a path of symbols.
     * The list passed in may be modified by the trie after this function returns,
     * so the returned key must not be a view of it.
     */
    @Nonnull K fromSymbols(@Nonnull List<S> symbols);
}
