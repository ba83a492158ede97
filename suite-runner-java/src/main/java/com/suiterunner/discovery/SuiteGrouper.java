package com.suiterunner.discovery;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Buckets test files into suites, one per directory.
 *
 * The suite key of a file is its directory with the root's base path replaced by
 * the root's logical name and path separators replaced by {@value #JOINER}:
 * {@code /srv/lib/test/foo/FooTest.java} under {@code lib} becomes {@code lib-test-foo}.
 */
public class SuiteGrouper {

    public static final String JOINER = "-";

    /**
     * @return suite key -> files, keys and files in enumeration order
     */
    public LinkedHashMap<String, List<Path>> group(SourceRoot root, List<Path> files) {
        LinkedHashMap<String, List<Path>> buckets = new LinkedHashMap<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file) || !Files.isReadable(file)) continue;
            buckets.computeIfAbsent(suiteKey(root, file), k -> new ArrayList<>()).add(file);
        }
        return buckets;
    }

    public static String suiteKey(SourceRoot root, Path file) {
        Path directory = file.toAbsolutePath().normalize().getParent();
        String separator = directory.getFileSystem().getSeparator();
        String dir = directory.toString();
        if (directory.startsWith(root.basePath())) {
            dir = root.logicalName() + dir.substring(root.basePath().toString().length());
        }
        return dir.replace(separator, JOINER);
    }
}
