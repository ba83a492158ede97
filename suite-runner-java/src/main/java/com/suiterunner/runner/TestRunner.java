package com.suiterunner.runner;

import com.suiterunner.discovery.SourceFileEnumerator;
import com.suiterunner.discovery.SourceRoot;
import com.suiterunner.discovery.SourceTreeLocator;
import com.suiterunner.discovery.SuiteBuilder;
import com.suiterunner.discovery.SuiteGrouper;
import com.suiterunner.discovery.TestCandidateFilter;
import com.suiterunner.framework.TestSuite;
import com.suiterunner.report.ReporterFactory;
import com.suiterunner.settings.RunnerSettings;
import com.suiterunner.symbols.SourceAutoloader;
import com.suiterunner.symbols.SymbolMapFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every test found under the lib test tree, then under the app test tree
 * when one is configured. Each directory becomes one suite, named after its
 * path ({@code lib-test-foo}), and is reported through a fresh reporter.
 *
 * All setup happens before the first suite runs: both test trees are validated
 * and all sources are made loadable. Any setup failure throws
 * {@link RunnerSetupException} and nothing is run.
 */
public class TestRunner {

    static final String LIB = "lib";
    static final String APP = "app";

    private final RunnerSettings settings;
    private final ReporterFactory reporterFactory;
    private final SourceTreeLocator locator;
    private final SourceFileEnumerator enumerator;
    private final SuiteGrouper grouper;
    private final SymbolMapFactory symbolMapFactory;

    public TestRunner(RunnerSettings settings, ReporterFactory reporterFactory) {
        this(settings, reporterFactory, new SourceTreeLocator(), new SourceFileEnumerator(),
             new SuiteGrouper(), new SymbolMapFactory());
    }

    TestRunner(RunnerSettings settings, ReporterFactory reporterFactory, SourceTreeLocator locator,
               SourceFileEnumerator enumerator, SuiteGrouper grouper, SymbolMapFactory symbolMapFactory) {
        this.settings = settings;
        this.reporterFactory = reporterFactory;
        this.locator = locator;
        this.enumerator = enumerator;
        this.grouper = grouper;
        this.symbolMapFactory = symbolMapFactory;
    }

    /**
     * Run the tests and report on the results.
     *
     * @throws RunnerSetupException if a test tree is missing or unreadable, or the
     *                              sources cannot be compiled and loaded
     */
    public void runAll() {
        List<SourceRoot> roots = configuredRoots();
        for (SourceRoot root : roots) {
            locator.requireValid(root);
        }

        try (SourceAutoloader autoloader = new SourceAutoloader(settings.resolveClasspath())) {
            for (SourceRoot root : roots) {
                autoloader.addSymbolMap(symbolMapFactory.generate(root.basePath(), root.logicalName() + "-map"));
            }
            if (!autoloader.register()) {
                throw new RunnerSetupException("Could not attach the required testing autoloader!");
            }

            SuiteBuilder builder = new SuiteBuilder(new TestCandidateFilter(autoloader));
            for (SourceRoot root : roots) {
                runTestGroupsByPath(root, builder);
            }
        }
    }

    List<SourceRoot> configuredRoots() {
        List<SourceRoot> roots = new ArrayList<>();
        roots.add(SourceRoot.of(LIB, settings.resolveLibPath(), settings.getTestDir()));
        Optional<Path> appPath = settings.resolveAppPath();
        appPath.ifPresent(path -> roots.add(SourceRoot.of(APP, path, settings.getTestDir())));
        return roots;
    }

    /**
     * Run one suite per directory of the root's test tree, in enumeration order.
     */
    void runTestGroupsByPath(SourceRoot root, SuiteBuilder builder) {
        List<Path> files = enumerator.enumerate(root.testPath());
        Map<String, List<Path>> buckets = grouper.group(root, files);
        System.err.println("[suite-runner] " + root.logicalName() + ": " + files.size()
            + " source files in " + buckets.size() + " directories");

        for (Map.Entry<String, List<Path>> bucket : buckets.entrySet()) {
            TestSuite suite = builder.build(bucket.getKey(), bucket.getValue());
            try {
                suite.run(reporterFactory.create());
            } catch (RuntimeException | LinkageError | StackOverflowError e) {
                System.err.println("[suite-runner] ERROR: " + suite.getTitle() + " aborted: " + e);
            }
        }
    }
}
