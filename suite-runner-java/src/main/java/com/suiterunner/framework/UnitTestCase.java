package com.suiterunner.framework;

import java.util.Objects;

/**
 * Base class for test cases with the usual assertion helpers.
 */
public abstract class UnitTestCase implements TestCase {

    public UnitTestCase() {}

    protected void assertTrue(boolean condition) {
        assertTrue(condition, "Expected true");
    }

    protected void assertTrue(boolean condition, String message) {
        if (!condition) throw new AssertionFailedError(message);
    }

    protected void assertFalse(boolean condition) {
        assertFalse(condition, "Expected false");
    }

    protected void assertFalse(boolean condition, String message) {
        if (condition) throw new AssertionFailedError(message);
    }

    protected void assertEquals(Object expected, Object actual) {
        assertEquals(expected, actual, null);
    }

    protected void assertEquals(Object expected, Object actual, String message) {
        if (!Objects.equals(expected, actual)) {
            throw new AssertionFailedError(prefix(message)
                + "Equal expectation fails: [" + expected + "] differs from [" + actual + "]");
        }
    }

    protected void assertNotEquals(Object unexpected, Object actual) {
        if (Objects.equals(unexpected, actual)) {
            throw new AssertionFailedError("Not equal expectation fails: both are [" + actual + "]");
        }
    }

    protected void assertNull(Object value) {
        if (value != null) throw new AssertionFailedError("Expected null but got [" + value + "]");
    }

    protected void assertNotNull(Object value) {
        assertNotNull(value, "Expected a non-null value");
    }

    protected void assertNotNull(Object value, String message) {
        if (value == null) throw new AssertionFailedError(message);
    }

    protected void assertSame(Object expected, Object actual) {
        if (expected != actual) {
            throw new AssertionFailedError("Identical expectation fails: [" + expected + "] is not [" + actual + "]");
        }
    }

    protected void fail(String message) {
        throw new AssertionFailedError(message);
    }

    private static String prefix(String message) {
        return message == null || message.isEmpty() ? "" : message + ": ";
    }
}
