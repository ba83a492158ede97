package com.suiterunner.framework;

/**
 * Result of a single test method, or of a test case that could not be constructed
 * (in which case {@code method} is null).
 */
public record TestOutcome(
    String testCase,
    String method,
    Status status,
    String message   // null for PASS
) {

    public enum Status { PASS, FAIL, ERROR }

    public static TestOutcome pass(String testCase, String method) {
        return new TestOutcome(testCase, method, Status.PASS, null);
    }

    public static TestOutcome fail(String testCase, String method, String message) {
        return new TestOutcome(testCase, method, Status.FAIL, message);
    }

    public static TestOutcome error(String testCase, String method, String message) {
        return new TestOutcome(testCase, method, Status.ERROR, message);
    }
}
