package org.sn.wordtrie.testutils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import org.hamcrest.BaseMatcher;
import org.hamcrest.Description;


public class TestUtil {
    private TestUtil() {
    }

    /**
     * Drain an iterator into a new list.
     */
    public static <T> List<T> toList(Iterator<T> iter) {
        List<T> list = new ArrayList<>();
        iter.forEachRemaining(list::add);
        return list;
    }

    /**
     * Copy an iterable into a new list, in iteration order.
     */
    public static <T> List<T> toList(Iterable<T> iterable) {
        return toList(iterable.iterator());
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass) {
        assertExceptionFromCallable(callable, expectedExceptionClass, ignored -> { });
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param callable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value,
     *        for example <code>exception -> assertEquals(expectedMessage, exception.getMessage())</code>
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        Throwable thrown = null;
        try {
            callable.call();
        } catch (Throwable e) {
            thrown = e;
        }
        checkThrown(thrown, expectedExceptionClass);
        exceptionChecker.accept((U) thrown);
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass) {
        assertException(runnable, expectedExceptionClass, ignored -> { });
    }

    /**
     * Assert that the desired exception is thrown with the given message.
     *
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, String expectedMessage) {
        assertException(runnable, expectedExceptionClass, exception -> assertEquals(expectedMessage, exception.getMessage()));
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param runnable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        Throwable thrown = null;
        try {
            runnable.run();
        } catch (RuntimeException | Error e) {
            thrown = e;
        }
        checkThrown(thrown, expectedExceptionClass);
        exceptionChecker.accept((U) thrown);
    }

    private static void checkThrown(Throwable thrown, Class<?> expectedExceptionClass) {
        if (thrown == null) {
            fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
        }
        assertTrue(expectedExceptionClass.isInstance(thrown), "Expected " + expectedExceptionClass.getSimpleName()
                + " or an exception derived from it, " + "but got " + thrown.getClass().getSimpleName());
    }

    /**
     * Matcher for a value between low and high inclusive.
     */
    public static <T extends Comparable<T>> Between<T> between(T low, T high) {
        return new Between<>(low, high);
    }

    public static class Between<T extends Comparable<T>> extends BaseMatcher<T> {
        private final T low;
        private final T high;

        public Between(T low, T high) {
            if (low.compareTo(high) > 0) {
                throw new IllegalArgumentException("low (" + low + ") should be less than or equal to high (" + high + ")");
            }
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean matches(Object actualObject) {
            @SuppressWarnings("unchecked")
            T actual = (T) actualObject;
            return low.compareTo(actual) <= 0 && high.compareTo(actual) >= 0;
        }

        @Override
        public void describeTo(Description description) {
            description.appendText("between " + low + " and " + high + " inclusive");
        }
    }
}
