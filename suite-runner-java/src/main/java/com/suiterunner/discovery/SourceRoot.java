package com.suiterunner.discovery;

import java.nio.file.Path;

/**
 * A source tree taking part in a run.
 */
public record SourceRoot(
    String logicalName,  // "lib" or "app"; prefixes every suite key from this tree
    Path basePath,       // symbol map root
    Path testPath        // enumerated and grouped into suites
) {

    public static SourceRoot of(String logicalName, Path basePath, String testDir) {
        Path base = basePath.toAbsolutePath().normalize();
        return new SourceRoot(logicalName, base, base.resolve(testDir).normalize());
    }

    /** Directory name of the test tree relative to the base, e.g. "test". */
    public String testDirName() {
        return basePath.relativize(testPath).toString();
    }
}
