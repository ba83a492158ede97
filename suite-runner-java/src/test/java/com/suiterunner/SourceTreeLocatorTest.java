package com.suiterunner;

import com.suiterunner.discovery.SourceRoot;
import com.suiterunner.discovery.SourceTreeLocator;
import com.suiterunner.runner.RunnerSetupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceTreeLocatorTest {

    @Test
    void existingReadableDirectoryPasses(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("lib/test"));
        SourceTreeLocator locator = new SourceTreeLocator();

        assertEquals(Optional.empty(), locator.probe(tmp.resolve("lib/test")));
        assertDoesNotThrow(() -> locator.requireValid(SourceRoot.of("lib", tmp.resolve("lib"), "test")));
    }

    @Test
    void missingDirectoryIsReportedWithRemedy(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("lib"));
        SourceTreeLocator locator = new SourceTreeLocator();

        assertEquals(Optional.of(SourceTreeLocator.Problem.MISSING_DIRECTORY), locator.probe(tmp.resolve("lib/test")));
        RunnerSetupException e = assertThrows(RunnerSetupException.class,
            () -> locator.requireValid(SourceRoot.of("lib", tmp.resolve("lib"), "test")));
        assertTrue(e.getMessage().contains("The lib/test directory is missing from the lib/ directory."), e.getMessage());
        assertTrue(e.getMessage().contains("You should create the directory lib/test."), e.getMessage());
    }

    @Test
    void regularFileInPlaceOfDirectoryCountsAsMissing(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("app"));
        Files.writeString(tmp.resolve("app/test"), "not a directory");

        assertEquals(Optional.of(SourceTreeLocator.Problem.MISSING_DIRECTORY),
            new SourceTreeLocator().probe(tmp.resolve("app/test")));
    }

    @Test
    void unreadableDirectoryIsReported(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("app/test"));
        SourceTreeLocator locator = new SourceTreeLocator(p -> false);

        assertEquals(Optional.of(SourceTreeLocator.Problem.UNREADABLE), locator.probe(tmp.resolve("app/test")));
        RunnerSetupException e = assertThrows(RunnerSetupException.class,
            () -> locator.requireValid(SourceRoot.of("app", tmp.resolve("app"), "test")));
        assertTrue(e.getMessage().contains("is not readable"), e.getMessage());
        assertTrue(e.getMessage().contains("app"), e.getMessage());
    }
}
