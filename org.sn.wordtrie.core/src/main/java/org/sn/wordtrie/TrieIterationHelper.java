package org.sn.wordtrie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;


class TrieIterationHelper {
    private TrieIterationHelper() {
    }

    interface TrieNode<S, V> {
        @Nullable V getData();

        V setData(@Nonnull V newData);

        @Nullable TrieNode<S, V> child(S symbol);

        Iterator<? extends Map.Entry<S, ? extends TrieNode<S, V>>> childrenIterator();
    }

    /**
     * A pointer to a trie node and current iteration index over its children.
     */
    private static class TrieNodePosition<S, V> {
        private final TrieNode<S, V> trieNode;
        private final Iterator<? extends Map.Entry<S, ? extends TrieNode<S, V>>> iter;

        private TrieNodePosition(TrieNode<S, V> trieNode) {
            this.trieNode = trieNode;
            this.iter = trieNode.childrenIterator();
        }
    }

    /**
     * Base class of the trie iterators which throws ConcurrentModificationException if the trie changes during iteration.
     */
    abstract static class FailFastIterator<K, S, V> implements Iterator<Trie.TrieEntry<K, S, V>> {
        private final int expectedModCount;

        FailFastIterator() {
            expectedModCount = getTrieModificationCount();
        }

        final void checkForConcurrentModification() {
            if (getTrieModificationCount() != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        abstract int getTrieModificationCount();
    }

    /**
     * Pre-order depth first iterator over the nodes that hold data.
     * Each iterator has its own path buffer: the symbol of a child is appended when descending into it,
     * and removed when all of the child's descendants have been visited.
     */
    abstract static class TrieEntryIterator<K, S, V> extends FailFastIterator<K, S, V> {
        private final KeySequence<K, S> keySequence;
        private final Deque<TrieNodePosition<S, V>> stack = new ArrayDeque<>();
        private final List<S> pathToHere;
        private @Nullable TrieNode<S, V> nextNode;

        /**
         * Create an iterator over the subtree of start.
         *
         * @param startPath the symbols of the path from the root to start
         */
        TrieEntryIterator(KeySequence<K, S> keySequence, TrieNode<S, V> start, List<S> startPath) {
            this.keySequence = keySequence;
            this.pathToHere = new ArrayList<>(startPath);
            stack.push(new TrieNodePosition<>(start));
            if (start.getData() != null) {
                nextNode = start;
            } else {
                gotoNext();
            }
        }

        private void gotoNext() {
            while (!stack.isEmpty()) {
                var top = stack.peek();
                if (top.iter.hasNext()) {
                    Map.Entry<S, ? extends TrieNode<S, V>> childEntry = top.iter.next();
                    var newTop = new TrieNodePosition<>(childEntry.getValue());
                    stack.push(newTop);
                    pathToHere.add(childEntry.getKey());
                    if (newTop.trieNode.getData() != null) {
                        nextNode = newTop.trieNode;
                        return;
                    }
                } else {
                    stack.pop();
                    if (!stack.isEmpty()) {
                        pathToHere.remove(pathToHere.size() - 1);
                    }
                }
            }
            nextNode = null;
        }

        @Override
        public boolean hasNext() {
            checkForConcurrentModification();
            return nextNode != null;
        }

        @Override
        public Trie.TrieEntry<K, S, V> next() {
            checkForConcurrentModification();
            if (nextNode == null) {
                throw new NoSuchElementException();
            }
            var entry = new TrieEntryImpl<>(keySequence, pathToHere, nextNode);
            gotoNext();
            return entry;
        }
    }

    /**
     * Iterator over the nodes holding data along the path of one key, shortest first.
     */
    abstract static class PrefixIterator<K, S, V> extends FailFastIterator<K, S, V> {
        private final KeySequence<K, S> keySequence;
        private final Iterator<S> symbols;
        private final List<S> pathToHere = new ArrayList<>();
        private @Nullable TrieNode<S, V> node;
        private boolean hasNextNode;

        PrefixIterator(KeySequence<K, S> keySequence, TrieNode<S, V> root, Iterable<S> key) {
            this.keySequence = keySequence;
            this.symbols = key.iterator();
            this.node = root;
            this.hasNextNode = root.getData() != null;
        }

        private void gotoNext() {
            hasNextNode = false;
            while (node != null && symbols.hasNext()) {
                S symbol = symbols.next();
                node = node.child(symbol);
                if (node == null) {
                    return;
                }
                pathToHere.add(symbol);
                if (node.getData() != null) {
                    hasNextNode = true;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            checkForConcurrentModification();
            return hasNextNode;
        }

        @Override
        public Trie.TrieEntry<K, S, V> next() {
            checkForConcurrentModification();
            if (!hasNextNode) {
                throw new NoSuchElementException();
            }
            var entry = new TrieEntryImpl<>(keySequence, pathToHere, Objects.requireNonNull(node));
            gotoNext();
            return entry;
        }
    }

    private static class TrieEntryImpl<K, S, V> implements Trie.TrieEntry<K, S, V> {
        private final K key;
        private final List<S> symbols;
        private final TrieNode<S, V> node;

        TrieEntryImpl(KeySequence<K, S> keySequence, List<S> pathToHere, TrieNode<S, V> node) {
            this.symbols = Collections.unmodifiableList(new ArrayList<>(pathToHere));
            this.key = keySequence.fromSymbols(symbols);
            this.node = node;
        }

        @Override
        public List<S> getSymbols() {
            return symbols;
        }

        @Override
        public K getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return node.getData();
        }

        /**
         * Replace the data of this key.
         *
         * @throws NullPointerException if value is null
         * @throws IllegalStateException if the key has since been removed from the trie
         */
        @Override
        public V setValue(@Nonnull V value) {
            Objects.requireNonNull(value);
            if (node.getData() == null) {
                throw new IllegalStateException("key no longer in trie: " + key);
            }
            return node.setData(value);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Map.Entry<?, ?> other
                    && Objects.equals(key, other.getKey())
                    && Objects.equals(getValue(), other.getValue());
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(key) ^ Objects.hashCode(getValue());
        }

        @Override
        public String toString() {
            return key + "=" + getValue();
        }
    }
}
