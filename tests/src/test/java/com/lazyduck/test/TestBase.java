package com.lazyduck.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for lazyduck tests.
 *
 * <p>Logs the start and end of each test and offers {@link #logStep} for
 * Given/When/Then narration.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;
    private long startNanos;

    @BeforeEach
    void logTestStart(TestInfo info) {
        testName = info.getDisplayName();
        startNanos = System.nanoTime();
        logger.debug("Starting: {}", testName);
    }

    @AfterEach
    void logTestEnd() {
        logger.debug("Finished: {} ({} ms)", testName, (System.nanoTime() - startNanos) / 1_000_000);
    }

    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}
