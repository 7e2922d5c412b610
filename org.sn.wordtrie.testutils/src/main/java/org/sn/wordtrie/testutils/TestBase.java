package org.sn.wordtrie.testutils;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.ExtendWith;


/**
 * Base test class that prints a banner when each test class and each test starts and ends, with the elapsed time.
 * This makes the console output of a full build easier to read, as the output of each test is fenced off.
 */
@ExtendWith(LogFailureToConsoleTestWatcher.class)
public abstract class TestBase {
    private static final String SEPARATOR = "-".repeat(80);

    private static Instant startOfClass;
    private Instant startOfTest;

    @BeforeAll
    static void onStartAllTests(TestInfo testInfo) {
        startOfClass = Instant.now();
        System.out.println("start all tests in " + testInfo.getDisplayName());
        System.out.println(SEPARATOR);
    }

    @AfterAll
    static void printAllTestsFinished(TestInfo testInfo) {
        System.out.println(SEPARATOR);
        System.out.println("all tests in " + testInfo.getDisplayName() + " finished"
                                   + " (" + Duration.between(startOfClass, Instant.now()).toMillis() + "ms)");
    }

    @BeforeEach
    void setStartOfTime(TestInfo testInfo) {
        startOfTest = Instant.now();
        System.out.println(SEPARATOR);
        System.out.println("test started: " + testInfo.getDisplayName());
    }

    @AfterEach
    void printTestFinished(TestInfo testInfo) {
        System.out.println("test finished: " + testInfo.getDisplayName()
                                   + " (" + Duration.between(startOfTest, Instant.now()).toMillis() + "ms)");
    }
}
