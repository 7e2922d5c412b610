package org.sn.wordtrie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;


/**
 * Common key sequences.
 */
public class KeySequences {
    private KeySequences() {
    }

    /**
     * A string key where each symbol is a UTF-16 char.
     */
    public static KeySequence<String, Character> characters() {
        return CharacterKeySequence.INSTANCE;
    }

    /**
     * A string key where each symbol is a Unicode code point, so that a surrogate pair is one symbol.
     */
    public static KeySequence<String, Integer> codePoints() {
        return CodePointKeySequence.INSTANCE;
    }

    /**
     * A list key where each element is a symbol, for example a list of words.
     * Keys built from symbol paths are unmodifiable copies.
     */
    @SuppressWarnings("unchecked")
    public static <S> KeySequence<List<S>, S> lists() {
        return (KeySequence<List<S>, S>) (KeySequence<?, ?>) ListKeySequence.INSTANCE;
    }

    /**
     * Create a key sequence from two functions.
     *
     * @param toSymbols function to split a key into symbols
     * @param fromSymbols function to join symbols back into a key. It must not keep a reference to the list passed in.
     */
    public static <K, S> KeySequence<K, S> of(Function<? super K, ? extends Iterable<S>> toSymbols,
                                              Function<? super List<S>, ? extends K> fromSymbols) {
        Objects.requireNonNull(toSymbols);
        Objects.requireNonNull(fromSymbols);
        return new KeySequence<>() {
            @Override
            public @Nonnull Iterable<S> toSymbols(@Nonnull K key) {
                return toSymbols.apply(key);
            }

            @Override
            public @Nonnull K fromSymbols(@Nonnull List<S> symbols) {
                return fromSymbols.apply(symbols);
            }
        };
    }


    private enum CharacterKeySequence implements KeySequence<String, Character> {
        INSTANCE;

        @Override
        public @Nonnull Iterable<Character> toSymbols(@Nonnull String key) {
            return new CharacterStreamIterable(key::chars);
        }

        @Override
        public @Nonnull String fromSymbols(@Nonnull List<Character> symbols) {
            StringBuilder result = new StringBuilder(symbols.size());
            symbols.forEach(result::append);
            return result.toString();
        }
    }

    private enum CodePointKeySequence implements KeySequence<String, Integer> {
        INSTANCE;

        @Override
        public @Nonnull Iterable<Integer> toSymbols(@Nonnull String key) {
            return () -> key.codePoints().iterator();
        }

        @Override
        public @Nonnull String fromSymbols(@Nonnull List<Integer> symbols) {
            StringBuilder result = new StringBuilder(symbols.size());
            symbols.forEach(result::appendCodePoint);
            return result.toString();
        }
    }

    private enum ListKeySequence implements KeySequence<List<Object>, Object> {
        INSTANCE;

        @Override
        public @Nonnull Iterable<Object> toSymbols(@Nonnull List<Object> key) {
            return key;
        }

        @Override
        public @Nonnull List<Object> fromSymbols(@Nonnull List<Object> symbols) {
            return Collections.unmodifiableList(new ArrayList<>(symbols)); // List.copyOf rejects null symbols
        }
    }

    private record CharacterStreamIterable(Supplier<IntStream> streamSupplier) implements Iterable<Character> {
        @Override
        public @Nonnull Iterator<Character> iterator() {
            return streamSupplier.get().mapToObj(intValue -> (char) intValue).iterator();
        }
    }
}
