package com.suiterunner.framework;

/**
 * Sink that renders the result of one executed suite.
 */
public interface Reporter {

    void render(SuiteResult result);
}
