package com.suiterunner.report;

import com.suiterunner.framework.Reporter;
import com.suiterunner.framework.SuiteResult;
import com.suiterunner.framework.TestOutcome;

import java.io.PrintStream;

/**
 * Plain-text rendering for terminals and CI logs.
 */
public class TextReporter implements Reporter {

    private final PrintStream out;

    public TextReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void render(SuiteResult result) {
        out.println(result.title());
        int index = 1;
        for (TestOutcome outcome : result.outcomes()) {
            if (outcome.status() == TestOutcome.Status.PASS) continue;
            String kind = outcome.status() == TestOutcome.Status.FAIL ? "" : "Exception: ";
            out.println(index++ + ") " + kind + outcome.message());
            if (outcome.method() != null) {
                out.println("\tin " + outcome.method());
            }
            out.println("\tin " + outcome.testCase());
        }
        out.println(result.isSuccessful() ? "OK" : "FAILURES!!!");
        out.println("Test cases run: " + result.testCaseCount() + "/" + result.testCaseCount()
            + ", Passes: " + result.passes()
            + ", Failures: " + result.failures()
            + ", Exceptions: " + result.exceptions());
        out.flush();
    }
}
