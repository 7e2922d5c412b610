package org.sn.wordtrie;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serial;
import java.io.Serializable;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;


/**
 * Trie class that has one node for each symbol.
 *
 * <p>Each node knows how many keys are stored in its subtree, so size and countWithPrefix do not walk the tree.
 * The count is updated whenever a node gains or loses its data, by walking up the parent links.
 * A node that has no data and no children is removed from its parent right away, so the trie holds no dead branches.
 *
 * <p>The children of a node are kept in insertion order, so iteration order is deterministic:
 * for example after adding "cat", "cats", "catacomb", "apple", the keys are returned in that order.
 *
 * @param <K> the type of key
 * @param <S> the type of symbol
 * @param <V> the type of data
 */
@NotThreadSafe
public class SimpleTrie<K, S, V> implements Trie<K, S, V> {
    private static final System.Logger LOGGER = System.getLogger(SimpleTrie.class.getName());

    private final KeySequence<K, S> keySequence;
    private SimpleTrieNode<S, V> root;
    private int modCount;

    public SimpleTrie(@Nonnull KeySequence<K, S> keySequence) {
        this.keySequence = Objects.requireNonNull(keySequence);
        this.root = new SimpleTrieNode<>(null);
    }

    public SimpleTrie(@Nonnull KeySequence<K, S> keySequence, @Nonnull Map<? extends K, ? extends V> initial) {
        this(keySequence);
        putAll(initial);
    }

    /**
     * Create a trie whose keys are strings and symbols are chars.
     */
    public static <V> SimpleTrie<String, Character, V> forStrings() {
        return new SimpleTrie<>(KeySequences.characters());
    }

    /**
     * Create a trie whose keys are lists of symbols, for example a list of words.
     */
    public static <S, V> SimpleTrie<List<S>, S, V> forLists() {
        return new SimpleTrie<>(KeySequences.lists());
    }

    public KeySequence<K, S> getKeySequence() {
        return keySequence;
    }

    @Override
    public void clear() {
        root.clear();
        modCount++;
    }

    @Override
    public @Nullable V put(@Nonnull K key, @Nonnull V data) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(data);
        V oldData = root.add(keySequence.toSymbols(key), data);
        if (oldData == null) {
            modCount++;
        }
        return oldData;
    }

    @Override
    public @Nonnull V get(@Nonnull K key) {
        V data = root.find(keySequence.toSymbols(Objects.requireNonNull(key)));
        if (data == null) {
            throw new KeyNotFoundException(key);
        }
        return data;
    }

    @Override
    public @Nullable V getOrDefault(@Nonnull K key, @Nullable V defaultValue) {
        V data = root.find(keySequence.toSymbols(Objects.requireNonNull(key)));
        return data != null ? data : defaultValue;
    }

    @Override
    public boolean containsKey(@Nonnull K key) {
        return root.find(keySequence.toSymbols(Objects.requireNonNull(key))) != null;
    }

    @Override
    public @Nullable V remove(@Nonnull K key) {
        List<S> symbols = toList(keySequence.toSymbols(Objects.requireNonNull(key)));
        var trie = SimpleTrieNode.doFind(root, symbols);
        if (trie == null) {
            throw new KeyNotFoundException(key);
        }
        V oldData = trie.clearData();
        if (oldData != null) {
            SimpleTrieNode.prune(trie, symbols);
            modCount++;
        }
        return oldData;
    }

    @Override
    public int size() {
        return root.size();
    }

    @Override
    public int countWithPrefix(@Nonnull K prefix) {
        var trie = SimpleTrieNode.doFind(root, keySequence.toSymbols(Objects.requireNonNull(prefix)));
        return trie != null ? trie.size() : 0;
    }

    @Override
    public Iterator<TrieEntry<K, S, V>> prefixesOf(@Nonnull K key) {
        return new SimplePrefixIterator(root, keySequence.toSymbols(Objects.requireNonNull(key)));
    }

    @Override
    public @Nullable List<K> findPrefix(@Nonnull K prefix) {
        List<S> symbols = toList(keySequence.toSymbols(Objects.requireNonNull(prefix)));
        var trie = SimpleTrieNode.doFind(root, symbols);
        if (trie == null) {
            return null;
        }
        List<K> keys = new ArrayList<>(trie.size());
        new SimpleTrieEntryIterator(trie, symbols).forEachRemaining(entry -> keys.add(entry.getKey()));
        return keys;
    }

    @Override
    public Iterator<TrieEntry<K, S, V>> trieIterator() {
        return new SimpleTrieEntryIterator(root, List.of());
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("{");
        for (var entry : entries()) {
            if (result.length() > 1) {
                result.append(", ");
            }
            result.append(entry);
        }
        return result.append('}').toString();
    }


    /**
     * Write the nodes of this trie to a file using java serialization.
     * The key sequence is not saved, and must be passed to load.
     *
     * @throws java.io.NotSerializableException if a symbol or value is not serializable
     * @throws IOException if there was an error writing the file
     */
    public void save(@Nonnull Path path) throws IOException {
        try (var out = Files.newOutputStream(path); var oos = new ObjectOutputStream(out)) {
            oos.writeObject(root);
        }
        LOGGER.log(Level.DEBUG, "Saved trie with {0} keys to {1}", size(), path);
    }

    /**
     * Read a trie written by save.
     *
     * @param keySequence the key sequence of the saved trie
     * @throws java.io.StreamCorruptedException if the file was not written by java serialization
     * @throws InvalidObjectException if the file does not hold a trie
     * @throws IOException if there was an error reading the file, or a class in the file was not found
     */
    public static <K, S, V> SimpleTrie<K, S, V> load(@Nonnull Path path, @Nonnull KeySequence<K, S> keySequence) throws IOException {
        Object object;
        try (var in = Files.newInputStream(path); var ois = new ObjectInputStream(in)) {
            object = ois.readObject();
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown class in " + path, e);
        }
        if (!(object instanceof SimpleTrieNode<?, ?> node) || node.parent != null) {
            throw new InvalidObjectException("Not a trie: " + path);
        }
        SimpleTrie<K, S, V> trie = new SimpleTrie<>(keySequence);
        trie.root = uncheckedCast(node);
        LOGGER.log(Level.DEBUG, "Loaded trie with {0} keys from {1}", trie.size(), path);
        return trie;
    }

    @SuppressWarnings("unchecked")
    private static <S, V> SimpleTrieNode<S, V> uncheckedCast(SimpleTrieNode<?, ?> node) {
        return (SimpleTrieNode<S, V>) node;
    }

    private static <S> List<S> toList(Iterable<S> symbols) {
        List<S> list = new ArrayList<>();
        symbols.forEach(list::add);
        return list;
    }


    /**
     * The class reflecting each node in the trie.
     * It is a nested class so that SimpleTrie can have additional member variables for the entire trie.
     */
    private static class SimpleTrieNode<S, V> implements TrieIterationHelper.TrieNode<S, V>, Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final @Nullable SimpleTrieNode<S, V> parent;
        private final Map<S, SimpleTrieNode<S, V>> children = new LinkedHashMap<>();
        private @Nullable V data;
        private int size; // number of nodes with data in this subtree, including this node

        private SimpleTrieNode(@Nullable SimpleTrieNode<S, V> parent) {
            this.parent = parent;
        }

        @Override
        public @Nullable V getData() {
            return data;
        }

        /**
         * Set the data of this node.
         * If the node had no data, the size of this node and all its ancestors goes up by one.
         */
        @Override
        public @Nullable V setData(@Nonnull V newData) {
            V old = data;
            data = Objects.requireNonNull(newData);
            if (old == null) {
                rollupSize(this, 1);
            }
            return old;
        }

        /**
         * Clear the data of this node.
         * If the node had data, the size of this node and all its ancestors goes down by one.
         */
        @Nullable V clearData() {
            V old = data;
            data = null;
            if (old != null) {
                rollupSize(this, -1);
            }
            return old;
        }

        @Override
        public @Nullable SimpleTrieNode<S, V> child(S symbol) {
            return children.get(symbol);
        }

        SimpleTrieNode<S, V> childOrCreate(S symbol) {
            return children.computeIfAbsent(symbol, ignored -> new SimpleTrieNode<>(this));
        }

        @Override
        public Iterator<Map.Entry<S, SimpleTrieNode<S, V>>> childrenIterator() {
            return children.entrySet().iterator();
        }

        @Nullable V add(Iterable<S> symbols, @Nonnull V data) {
            var trie = this;
            for (S symbol : symbols) {
                trie = trie.childOrCreate(symbol);
            }
            return trie.setData(data);
        }

        @Nullable V find(Iterable<S> symbols) {
            var trie = doFind(this, symbols);
            return trie != null ? trie.data : null;
        }

        /**
         * Reset this node, and clear the data of all its descendants,
         * so that entries still pointing into the old subtree see that their key is gone.
         */
        void clear() {
            Deque<SimpleTrieNode<S, V>> stack = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                var trie = stack.pop();
                trie.data = null;
                trie.size = 0;
                stack.addAll(trie.children.values());
                trie.children.clear();
            }
        }

        private static @Nullable <S, V> SimpleTrieNode<S, V> doFind(@Nonnull SimpleTrieNode<S, V> trie, Iterable<S> symbols) {
            for (S symbol : symbols) {
                trie = trie.children.get(symbol);
                if (trie == null) {
                    return null;
                }
            }
            return trie;
        }

        /**
         * Remove trie from its parent if it has no data and no children, then do the same for the parent, and so on.
         * The root is never removed.
         *
         * @param symbols the path from the root to trie
         */
        private static <S, V> void prune(SimpleTrieNode<S, V> trie, List<S> symbols) {
            for (int i = symbols.size() - 1; trie.parent != null && trie.data == null && trie.children.isEmpty(); i--) {
                trie.parent.children.remove(symbols.get(i));
                trie = trie.parent;
            }
        }

        private static <S, V> void rollupSize(@Nullable SimpleTrieNode<S, V> trie, int delta) {
            while (trie != null) {
                trie.size += delta;
                trie = trie.parent;
            }
        }

        int size() {
            return size;
        }
    }

    private class SimpleTrieEntryIterator extends TrieIterationHelper.TrieEntryIterator<K, S, V> {
        SimpleTrieEntryIterator(SimpleTrieNode<S, V> start, List<S> startPath) {
            super(keySequence, start, startPath);
        }

        @Override
        int getTrieModificationCount() {
            return SimpleTrie.this.modCount;
        }
    }

    private class SimplePrefixIterator extends TrieIterationHelper.PrefixIterator<K, S, V> {
        SimplePrefixIterator(SimpleTrieNode<S, V> root, Iterable<S> key) {
            super(keySequence, root, key);
        }

        @Override
        int getTrieModificationCount() {
            return SimpleTrie.this.modCount;
        }
    }
}
