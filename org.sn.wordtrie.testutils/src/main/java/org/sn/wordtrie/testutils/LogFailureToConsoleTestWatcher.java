package org.sn.wordtrie.testutils;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;


/**
 * Log the call stack of a failed test to stderr after the test method finishes,
 * cut off below the last wordtrie frame so that the junit and surefire frames do not hide the failure.
 */
public final class LogFailureToConsoleTestWatcher implements TestWatcher {
    private static final String PACKAGE_PREFIX = "org.sn.wordtrie.";

    @Override
    public void testDisabled(ExtensionContext context, Optional<String> reason) {
        System.err.println(context.getDisplayName() + " disabled" + reason.map(text -> ": " + text).orElse(""));
    }

    @Override
    public void testAborted(ExtensionContext context, Throwable cause) {
        System.err.println(context.getDisplayName() + " aborted: " + cause);
    }

    @Override
    public void testFailed(ExtensionContext context, Throwable cause) {
        System.err.println(context.getDisplayName() + " failed");
        cause.setStackTrace(truncateCallStack(cause.getStackTrace()));
        cause.printStackTrace();
    }

    private static StackTraceElement[] truncateCallStack(StackTraceElement[] stackTraceElements) {
        int lastElem = stackTraceElements.length - 1;
        for ( ; lastElem >= 0; lastElem--) {
            if (stackTraceElements[lastElem].getClassName().startsWith(PACKAGE_PREFIX)) {
                break;
            }
        }
        if (lastElem < 0) {
            return stackTraceElements; // no wordtrie frame at all, so keep everything
        }
        return Arrays.copyOf(stackTraceElements, lastElem + 1);
    }
}
