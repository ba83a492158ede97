package com.suiterunner.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the Java source files under a directory, recursively, in sorted path order.
 */
public class SourceFileEnumerator {

    public List<Path> enumerate(Path root) {
        if (!Files.isDirectory(root)) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(p -> p.getFileName() != null && p.getFileName().toString().endsWith(".java"))
                .map(p -> p.toAbsolutePath().normalize())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[suite-runner] Warning: could not walk source tree " + root + ": " + e.getMessage());
            return Collections.emptyList();
        }
    }
}
