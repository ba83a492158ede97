package com.suiterunner.framework;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named, ordered collection of test source files and the test case types they
 * declare. Built once per directory, run once, then discarded.
 */
public class TestSuite {

    public static final String TITLE_PREFIX = "Test Suite: ";

    private final String title;
    private final Map<Path, Set<Class<? extends TestCase>>> files = new LinkedHashMap<>();

    public TestSuite(String title) {
        this.title = title;
    }

    public static TestSuite named(String suiteKey) {
        return new TestSuite(TITLE_PREFIX + suiteKey);
    }

    public String getTitle() { return title; }

    /** Files in the order they were first added; a file added twice appears once. */
    public List<Path> getFiles() {
        return Collections.unmodifiableList(new ArrayList<>(files.keySet()));
    }

    public List<Class<? extends TestCase>> getTestCases() {
        List<Class<? extends TestCase>> all = new ArrayList<>();
        files.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * Adds a file together with the test case types it declares.
     */
    public void addFile(Path file, List<Class<? extends TestCase>> testCases) {
        files.computeIfAbsent(file, k -> new LinkedHashSet<>()).addAll(testCases);
    }

    /**
     * Runs every test case in file order and hands the collected result to the reporter.
     */
    public SuiteResult run(Reporter reporter) {
        List<TestOutcome> outcomes = new ArrayList<>();
        List<Class<? extends TestCase>> testCases = getTestCases();
        for (Class<? extends TestCase> type : testCases) {
            runTestCase(type, outcomes);
        }
        SuiteResult result = new SuiteResult(title, testCases.size(), outcomes);
        reporter.render(result);
        return result;
    }

    private void runTestCase(Class<? extends TestCase> type, List<TestOutcome> outcomes) {
        TestCase instance;
        try {
            instance = type.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            outcomes.add(TestOutcome.error(type.getName(), null, describe(e.getCause())));
            return;
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            outcomes.add(TestOutcome.error(type.getName(), null, describe(e)));
            return;
        }

        String label = instance.getLabel();
        for (Method method : TestMethods.of(type)) {
            outcomes.add(runTestMethod(instance, label, method));
        }
    }

    private TestOutcome runTestMethod(TestCase instance, String label, Method method) {
        String name = method.getName();
        try {
            instance.setUp();
        } catch (Exception | Error e) {
            return outcomeOf(label, name, e);
        }

        TestOutcome outcome;
        try {
            method.invoke(instance);
            outcome = TestOutcome.pass(label, name);
        } catch (InvocationTargetException e) {
            outcome = outcomeOf(label, name, e.getCause());
        } catch (IllegalAccessException e) {
            outcome = TestOutcome.error(label, name, describe(e));
        }

        try {
            instance.tearDown();
        } catch (Exception | Error e) {
            // Keep the first problem; a teardown failure only shows when the test passed.
            if (outcome.status() == TestOutcome.Status.PASS) {
                outcome = outcomeOf(label, name, e);
            }
        }
        return outcome;
    }

    private static TestOutcome outcomeOf(String label, String method, Throwable t) {
        // A runaway recursion is the test's fault; other VM errors end the run.
        if (t instanceof VirtualMachineError vmError && !(t instanceof StackOverflowError)) {
            throw vmError;
        }
        if (t instanceof AssertionError) {
            return TestOutcome.fail(label, method, t.getMessage() != null ? t.getMessage() : "Assertion failed");
        }
        return TestOutcome.error(label, method, describe(t));
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return "Unexpected exception of type [" + t.getClass().getName() + "]"
            + (message != null ? " with message [" + message + "]" : "");
    }
}
