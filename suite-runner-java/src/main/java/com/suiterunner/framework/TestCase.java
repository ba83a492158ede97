package com.suiterunner.framework;

/**
 * Capability contract for a runnable test case.
 *
 * Implementations expose any number of public, no-argument methods whose name
 * starts with {@code test}. Each is run as setUp, test method, tearDown on the
 * same instance. Discovery only picks up public, concrete implementations with a
 * public no-argument constructor and no private or protected constructors.
 */
public interface TestCase {

    default void setUp() throws Exception {}

    default void tearDown() throws Exception {}

    /** Label shown by reporters. */
    default String getLabel() {
        return getClass().getName();
    }
}
