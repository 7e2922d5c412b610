package org.sn.wordtrie;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;


/**
 * Interface for the Trie class.
 * A trie maps keys to values, where each key is split into a sequence of symbols by a {@link KeySequence}.
 * Iterating over a trie returns its keys.
 *
 * @param <K> the type of key, such as String
 * @param <S> the type of symbol, such as Character (for UTF-16 chars), Integer (for Unicode code points), etc.
 * @param <V> the type of data associated with each key in the trie. The value cannot be null.
 */
public interface Trie<K, S, V> extends Iterable<K> {
    /**
     * Add key with associated data to trie.
     *
     * @param key  the key to add
     * @param data the data associated with the key
     * @return the old data associated with the key, or null if there was no key
     * @throws NullPointerException if key or data is null
     */
    @Nullable V put(@Nonnull K key, @Nonnull V data);

    /**
     * Add all the entries of the map to the trie.
     */
    default void putAll(Map<? extends K, ? extends V> map) {
        map.forEach(this::put);
    }

    /**
     * Find key in trie.
     *
     * @param key the key to find
     * @return the data associated with the key
     * @throws KeyNotFoundException if the key is not in the trie, including the case that it is only the prefix of other keys
     */
    @Nonnull V get(@Nonnull K key);

    /**
     * Find key in trie.
     *
     * @return the data associated with the key, or defaultValue if the key is not in the trie
     */
    @Nullable V getOrDefault(@Nonnull K key, @Nullable V defaultValue);

    /**
     * Tell if the key is in the trie.
     * A key that is only the prefix of other keys is not contained in the trie.
     */
    boolean containsKey(@Nonnull K key);

    /**
     * Remove a key from the trie.
     * If the key is only the prefix of other keys then nothing happens and the return value is null.
     *
     * @param key the key to remove
     * @return the data associated with the key, or null if the key was only a prefix of other keys
     * @throws KeyNotFoundException if neither the key nor any key starting with it is in the trie
     */
    @Nullable V remove(@Nonnull K key);

    /**
     * Return the number of keys in the trie.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Remove all keys from the trie.
     */
    void clear();

    /**
     * Return the number of keys starting with prefix, including prefix itself if it is a key.
     * This is an O(length of prefix) operation.
     */
    int countWithPrefix(@Nonnull K prefix);

    /**
     * Return the entries whose key is a prefix of the given key, shortest first.
     * The given key need not be in the trie, and the iteration stops at the first symbol not found in the trie.
     * For example if the trie has "cat" and "catacomb", the prefixes of "catacombs" are "cat" and "catacomb".
     *
     * <p>The iterator is lazy: each call to next descends only as far as the next key.
     */
    Iterator<TrieEntry<K, S, V>> prefixesOf(@Nonnull K key);

    /**
     * Find all keys starting with the given prefix, in depth first order.
     *
     * @return the keys, including prefix itself if it is a key,
     *         or null if there is no node for prefix in the trie (in other words no key starts with prefix)
     */
    @Nullable List<K> findPrefix(@Nonnull K prefix);

    /**
     * Return an iterator going over all the entries in the trie in depth first order.
     * The entry for a key is returned before the entries of the keys that it is a prefix of,
     * and the children of a node are visited in the order they were added.
     *
     * <p>The iterator throws ConcurrentModificationException if the trie is structurally modified after it is created.
     */
    Iterator<TrieEntry<K, S, V>> trieIterator();

    default Iterable<TrieEntry<K, S, V>> entries() {
        return this::trieIterator;
    }

    default Iterable<K> keys() {
        return () -> stream().map(TrieEntry::getKey).iterator();
    }

    default Iterable<V> values() {
        return () -> stream().map(TrieEntry::getValue).iterator();
    }

    default Stream<TrieEntry<K, S, V>> stream() {
        Spliterator<TrieEntry<K, S, V>> spliterator
                = Spliterators.spliterator(trieIterator(), size(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Iterate over the keys of the trie.
     * Same as <code>keys().iterator()</code>.
     */
    @Override
    default @Nonnull Iterator<K> iterator() {
        return keys().iterator();
    }

    interface TrieEntry<K, S, V> extends Map.Entry<K, V> {
        /**
         * Get the symbols of the key of this trie node.
         */
        List<S> getSymbols();
    }
}
