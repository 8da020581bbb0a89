package com.metricsql.test;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for compiler tests.
 *
 * <p>Provides a per-class logger and Given/When/Then step logging so that test
 * output reads as a scenario. Subclasses put their fixture setup in
 * {@link #doSetUp()}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    final void setUp(TestInfo info) {
        testName = info.getDisplayName();
        logger.debug("=== {} ===", testName);
        doSetUp();
    }

    /**
     * Hook for fixture setup, run before each test.
     */
    protected void doSetUp() {
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }
}
