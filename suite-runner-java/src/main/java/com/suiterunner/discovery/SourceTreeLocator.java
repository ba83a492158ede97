package com.suiterunner.discovery;

import com.suiterunner.runner.RunnerSetupException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Checks that a test tree exists and is readable before anything is run from it.
 */
public class SourceTreeLocator {

    public enum Problem { MISSING_DIRECTORY, UNREADABLE }

    private final Predicate<Path> readable;

    public SourceTreeLocator() {
        this(Files::isReadable);
    }

    public SourceTreeLocator(Predicate<Path> readable) {
        this.readable = readable;
    }

    public Optional<Problem> probe(Path directory) {
        if (!Files.isDirectory(directory)) return Optional.of(Problem.MISSING_DIRECTORY);
        if (!readable.test(directory)) return Optional.of(Problem.UNREADABLE);
        return Optional.empty();
    }

    /**
     * @throws RunnerSetupException naming the missing or unreadable directory
     */
    public void requireValid(SourceRoot root) {
        Optional<Problem> problem = probe(root.testPath());
        if (problem.isEmpty()) return;

        String name = root.logicalName();
        String testDir = root.testDirName();
        if (problem.get() == Problem.MISSING_DIRECTORY) {
            throw new RunnerSetupException(
                "The " + name + "/" + testDir + " directory is missing from the " + name + "/ directory.\n"
                + "You should create the directory " + name + "/" + testDir + ".");
        }
        throw new RunnerSetupException("The " + name + " path '" + root.testPath() + "' is not readable.");
    }
}
