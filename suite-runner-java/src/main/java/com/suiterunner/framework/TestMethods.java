package com.suiterunner.framework;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the test methods of a {@link TestCase}: public, non-static, no-argument
 * methods named {@code test*}, sorted by name so runs are repeatable.
 */
public final class TestMethods {

    private TestMethods() {}

    public static List<Method> of(Class<? extends TestCase> type) {
        return Arrays.stream(type.getMethods())
            .filter(m -> m.getName().startsWith("test"))
            .filter(m -> m.getParameterCount() == 0)
            .filter(m -> !Modifier.isStatic(m.getModifiers()))
            .filter(m -> !m.isSynthetic() && !m.isBridge())
            .sorted(Comparator.comparing(Method::getName))
            .collect(Collectors.toList());
    }
}
