package com.suiterunner.framework;

/**
 * Thrown by {@link UnitTestCase} assertions. Reported as a failure, not an exception.
 */
public class AssertionFailedError extends AssertionError {

    public AssertionFailedError(String message) {
        super(message);
    }
}
