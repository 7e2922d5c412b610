package org.sn.wordtrie.corpus;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.IntPredicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;


/**
 * Split text into words, where a word is a maximal run of word characters.
 * By default the word characters are letters, numbers, and underscore, in any script.
 * Numbers include other numeric characters such as superscripts, fractions, and roman numerals.
 * All other characters separate words and are never returned.
 *
 * <p>This class reads unicode code points, so a letter outside the basic multilingual plane is not split.
 */
@NotThreadSafe
public class WordTokenizer implements Iterator<String> {
    public static final IntPredicate DEFAULT_WORD_CHARS = WordTokenizer::isDefaultWordChar;

    private final CharSequence str;
    private final IntPredicate wordChars;
    private int index;

    public WordTokenizer(@Nonnull CharSequence str) {
        this(str, DEFAULT_WORD_CHARS);
    }

    public WordTokenizer(@Nonnull CharSequence str, @Nonnull IntPredicate wordChars) {
        this.str = Objects.requireNonNull(str);
        this.wordChars = Objects.requireNonNull(wordChars);
    }

    private static boolean isDefaultWordChar(int c) {
        if (Character.isLetterOrDigit(c) || c == '_') {
            return true;
        }
        int type = Character.getType(c);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

    /**
     * Return the words of str as a stream.
     */
    public static Stream<String> words(@Nonnull CharSequence str) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new WordTokenizer(str), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    @Override
    public boolean hasNext() {
        handleSkipChars();
        return index < str.length();
    }

    private void handleSkipChars() {
        while (index < str.length()) {
            int c = Character.codePointAt(str, index);
            if (wordChars.test(c)) {
                break;
            }
            index += Character.charCount(c);
        }
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        int tokenStart = index;
        readWordChars();
        return str.subSequence(tokenStart, index).toString();
    }

    private void readWordChars() {
        while (index < str.length()) {
            int c = Character.codePointAt(str, index);
            if (!wordChars.test(c)) {
                break;
            }
            index += Character.charCount(c);
        }
    }
}
