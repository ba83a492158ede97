package com.suiterunner.framework;

import java.util.List;

/**
 * Everything a reporter needs to render one executed suite.
 */
public record SuiteResult(
    String title,
    int testCaseCount,
    List<TestOutcome> outcomes
) {

    public SuiteResult {
        outcomes = List.copyOf(outcomes);
    }

    public long passes()     { return count(TestOutcome.Status.PASS); }
    public long failures()   { return count(TestOutcome.Status.FAIL); }
    public long exceptions() { return count(TestOutcome.Status.ERROR); }

    public boolean isSuccessful() {
        return failures() == 0 && exceptions() == 0;
    }

    private long count(TestOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
