package com.suiterunner.discovery;

import com.suiterunner.framework.NotATest;
import com.suiterunner.framework.TestCase;
import com.suiterunner.symbols.TypeLoader;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decides which declared types are runnable test cases.
 *
 * A type qualifies when it loads, is a public concrete {@link TestCase}
 * implementation without {@link NotATest}, declares no private or protected
 * constructor, and can be instantiated through a public no-argument constructor.
 * Types with a restricted constructor (singletons, static utilities) are never
 * instantiated. Anything that fails a check is skipped; nothing here is an error.
 */
public class TestCandidateFilter {

    private final TypeLoader loader;

    public TestCandidateFilter(TypeLoader loader) {
        this.loader = loader;
    }

    public boolean isEligible(String typeName) {
        return eligibleType(typeName).isPresent();
    }

    public Optional<Class<? extends TestCase>> eligibleType(String typeName) {
        try {
            Class<?> type = loader.load(typeName);
            if (!isTestCaseType(type) || hasRestrictedConstructor(type)) {
                return Optional.empty();
            }
            Class<? extends TestCase> testType = type.asSubclass(TestCase.class);
            testType.getConstructor().newInstance();
            return Optional.of(testType);
        } catch (ClassNotFoundException | LinkageError e) {
            return Optional.empty();
        } catch (ReflectiveOperationException | RuntimeException e) {
            // no public no-arg constructor, or construction failed
            return Optional.empty();
        }
    }

    /**
     * Eligible types among the given names, in the given order.
     */
    public List<Class<? extends TestCase>> eligibleTypes(Collection<String> typeNames) {
        List<Class<? extends TestCase>> eligible = new ArrayList<>();
        for (String typeName : typeNames) {
            eligibleType(typeName).ifPresent(eligible::add);
        }
        return eligible;
    }

    /**
     * Eligible types declared in a source file.
     */
    public List<Class<? extends TestCase>> eligibleTypes(Path file) {
        return eligibleTypes(loader.reverseLookup(file));
    }

    private static boolean isTestCaseType(Class<?> type) {
        int modifiers = type.getModifiers();
        return TestCase.class.isAssignableFrom(type)
            && !type.isInterface()
            && !Modifier.isAbstract(modifiers)
            && Modifier.isPublic(modifiers)
            && !type.isAnnotationPresent(NotATest.class);
    }

    private static boolean hasRestrictedConstructor(Class<?> type) {
        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            int modifiers = constructor.getModifiers();
            if (Modifier.isPrivate(modifiers) || Modifier.isProtected(modifiers)) {
                return true;
            }
        }
        return false;
    }
}
