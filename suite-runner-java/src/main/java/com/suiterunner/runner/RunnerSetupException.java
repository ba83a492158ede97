package com.suiterunner.runner;

/**
 * A setup problem that makes the whole run pointless: a missing or unreadable
 * test tree, or sources that cannot be made loadable. Raised before any suite runs.
 */
public class RunnerSetupException extends RuntimeException {

    public RunnerSetupException(String message) { super(message); }
    public RunnerSetupException(String message, Throwable cause) { super(message, cause); }
}
