package com.suiterunner.discovery;

import com.suiterunner.framework.TestCase;
import com.suiterunner.framework.TestSuite;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns one bucket of files into a {@link TestSuite}, keeping only files that
 * declare at least one eligible test case.
 */
public class SuiteBuilder {

    private final TestCandidateFilter filter;

    public SuiteBuilder(TestCandidateFilter filter) {
        this.filter = filter;
    }

    public TestSuite build(String suiteKey, List<Path> files) {
        TestSuite suite = TestSuite.named(suiteKey);
        for (Path file : files) {
            List<Class<? extends TestCase>> testCases = filter.eligibleTypes(file);
            if (!testCases.isEmpty()) {
                suite.addFile(file, testCases);
            }
        }
        return suite;
    }
}
