package com.suiterunner;

import com.suiterunner.framework.UnitTestCase;

import java.util.ArrayList;
import java.util.List;

/**
 * Test case types run by {@link TestSuiteTest}.
 */
public final class SampleCases {

    static final List<String> CALLS = new ArrayList<>();

    private SampleCases() {}

    public static class Lifecycle extends UnitTestCase {
        @Override
        public void setUp() { CALLS.add("setUp"); }

        @Override
        public void tearDown() { CALLS.add("tearDown"); }

        public void testB() { CALLS.add("testB"); }

        public void testA() { CALLS.add("testA"); }

        public void helper() { CALLS.add("helper"); }

        public static void testStatic() { CALLS.add("testStatic"); }

        public void testWithArgument(String ignored) { CALLS.add("testWithArgument"); }
    }

    public static class Mixed extends UnitTestCase {
        public void testPasses() { assertTrue(true); }

        public void testFails() { assertEquals("expected", "actual"); }

        public void testThrows() { throw new IllegalStateException("boom"); }
    }

    public static class BrokenSetUp extends UnitTestCase {
        @Override
        public void setUp() { throw new IllegalArgumentException("no fixture"); }

        @Override
        public void tearDown() { CALLS.add("brokenTearDown"); }

        public void testNeverReached() { CALLS.add("testNeverReached"); }
    }

    public static class FailingTearDown extends UnitTestCase {
        @Override
        public void tearDown() { fail("tear down failed"); }

        public void testPasses() {}
    }

    public static class ExplodingConstructor extends UnitTestCase {
        public ExplodingConstructor() {
            throw new IllegalStateException("cannot build");
        }

        public void testNeverReached() {}
    }

    public static class RunawayRecursion extends UnitTestCase {
        public void testDeep() { testDeep(); }
    }

    public static class MissingClassInSetUp extends UnitTestCase {
        @Override
        public void setUp() { throw new NoClassDefFoundError("com/sample/Gone"); }

        public void testNeverReached() { CALLS.add("testNeverReached"); }
    }

    public static class ErrorInTearDown extends UnitTestCase {
        @Override
        public void tearDown() { throw new ExceptionInInitializerError("static init"); }

        public void testPasses() {}
    }
}
