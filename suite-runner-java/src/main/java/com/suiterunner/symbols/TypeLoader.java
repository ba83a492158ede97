package com.suiterunner.symbols;

import java.nio.file.Path;
import java.util.Set;

/**
 * Resolves declared type names to loaded classes, and source files to the type names they declare.
 */
public interface TypeLoader {

    /** Loads without running static initializers. */
    Class<?> load(String typeName) throws ClassNotFoundException;

    Set<String> reverseLookup(Path file);
}
