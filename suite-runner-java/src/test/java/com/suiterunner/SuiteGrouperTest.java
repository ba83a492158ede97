package com.suiterunner;

import com.suiterunner.discovery.SourceRoot;
import com.suiterunner.discovery.SuiteGrouper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SuiteGrouperTest {

    private final SuiteGrouper grouper = new SuiteGrouper();

    @Test
    void keyReplacesBasePathWithLogicalNameAndJoinsDirectories(@TempDir Path tmp) {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), "test");
        Path file = tmp.resolve("lib/test/foo/FooTest.java");
        assertEquals("lib-test-foo", SuiteGrouper.suiteKey(root, file));
    }

    @Test
    void keyIsStable(@TempDir Path tmp) {
        SourceRoot root = SourceRoot.of("app", tmp.resolve("app"), "test");
        Path file = tmp.resolve("app/test/web/admin/PageTest.java");
        String first = SuiteGrouper.suiteKey(root, file);
        assertEquals(first, SuiteGrouper.suiteKey(root, file));
        assertEquals("app-test-web-admin", first);
    }

    @Test
    void filesDirectlyUnderBaseGetLogicalName(@TempDir Path tmp) {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), ".");
        assertEquals("lib", SuiteGrouper.suiteKey(root, tmp.resolve("lib/OnlyTest.java")));
    }

    @Test
    void siblingDirectoryWithSharedPrefixIsNotTreatedAsRoot(@TempDir Path tmp) {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), "test");
        String key = SuiteGrouper.suiteKey(root, tmp.resolve("library/test/XTest.java"));
        assertFalse(key.startsWith("lib-"), "Unexpected key: " + key);
        assertTrue(key.endsWith("library-test"), "Unexpected key: " + key);
    }

    @Test
    void groupsByDirectoryPreservingEnumerationOrder(@TempDir Path tmp) throws IOException {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), "test");
        Path b1 = touch(tmp.resolve("lib/test/b/BTest.java"));
        Path a1 = touch(tmp.resolve("lib/test/a/ATest.java"));
        Path b2 = touch(tmp.resolve("lib/test/b/AnotherTest.java"));
        Path top = touch(tmp.resolve("lib/test/TopTest.java"));

        Map<String, List<Path>> buckets = grouper.group(root, List.of(b1, a1, b2, top));

        assertEquals(List.of("lib-test-b", "lib-test-a", "lib-test"), List.copyOf(buckets.keySet()));
        assertEquals(List.of(b1, b2), buckets.get("lib-test-b"));
        assertEquals(List.of(a1), buckets.get("lib-test-a"));
        assertEquals(List.of(top), buckets.get("lib-test"));
    }

    @Test
    void skipsEntriesThatAreNotRegularFiles(@TempDir Path tmp) throws IOException {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), "test");
        Path real = touch(tmp.resolve("lib/test/foo/FooTest.java"));
        Path directory = Files.createDirectories(tmp.resolve("lib/test/foo/Weird.java"));
        Path missing = tmp.resolve("lib/test/gone/GoneTest.java");

        Map<String, List<Path>> buckets = grouper.group(root, List.of(real, directory, missing));

        assertEquals(1, buckets.size());
        assertEquals(List.of(real), buckets.get("lib-test-foo"));
    }

    @Test
    void emptyInputGivesNoBuckets(@TempDir Path tmp) {
        SourceRoot root = SourceRoot.of("lib", tmp.resolve("lib"), "test");
        assertTrue(grouper.group(root, List.of()).isEmpty());
    }

    private static Path touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "class X {}");
    }
}
